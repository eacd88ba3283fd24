package works.bpc;

import java.util.List;
import org.junit.jupiter.api.Test;
import works.bpc.GeneratedProgramRunner.Execution;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DumpEpilogueTest {

	@Test
	void dumpText() {
		String code = BpcCompiler.using(CompilerSettings.DEFAULT.withMemorySize(5).withDumpMemory(true)).compile("+");
		assertTrue(code.endsWith("""
			m[p] += 1
			print()
			print('~~~ Program Terminated ~~~')
			print('Pointer:', p)
			print('Memory:')
			m += [0] * 11
			for i in range(0, 5, 16):
			    print('{:7d} | '.format(i) + ''.join('{:4d}'.format(c) for c in m[i:i + 16]))"""), code);
	}

	@Test
	void withComments_labelled() {
		String code = BpcCompiler.using(CompilerSettings.DEFAULT.withMemorySize(5).withDumpMemory(true).withComments(true)).compile("+");
		assertTrue(code.contains("m[p] += 1\n\n# dump the memory\nprint()"), code);
	}

	@Test
	void wholeRows_needNoPadding() {
		String code = BpcCompiler.using(CompilerSettings.DEFAULT.withMemorySize(32).withDumpMemory(true)).compile("");
		assertFalse(code.contains("m += "), code);
		assertTrue(code.contains("for i in range(0, 32, 16):"), code);
	}

	@Test
	void dumpShowsPointerAndCells() {
		String code = BpcCompiler.using(CompilerSettings.DEFAULT.withMemorySize(5).withDumpMemory(true))
			.compile("+++>++>-<");
		Execution execution = GeneratedProgramRunner.run(code);
		assertEquals(List.of(
			"",
			"~~~ Program Terminated ~~~",
			"Pointer: 1",
			"Memory:",
			"      0 |    3   2  -1   0   0   0   0   0   0   0   0   0   0   0   0   0"
		), execution.output());
		assertEquals(16, execution.memory().size());
	}

	@Test
	void noDumpByDefault() {
		String code = BpcCompiler.using(CompilerSettings.DEFAULT).compile("+.");
		assertFalse(code.contains("Program Terminated"));
	}
}
