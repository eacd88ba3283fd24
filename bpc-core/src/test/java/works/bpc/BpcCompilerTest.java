package works.bpc;

import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import works.bpc.exceptions.ConfigurationException;
import works.bpc.exceptions.UnclosedLoopException;
import works.bpc.exceptions.UnmatchedLoopCloseException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BpcCompilerTest {
	static final String PREAMBLE = """
		# -*- coding: UTF-8 -*-
		import sys
		m = [0] * 10
		p = 0
		""";

	static final CompilerSettings SETTINGS = CompilerSettings.DEFAULT.withMemorySize(10);

	@Test
	void directTranslation() {
		assertEquals(PREAMBLE + """
			m[p] += 1
			m[p] += 1
			m[p] += 1
			p = (p + 1) % 10
			p = (p + 1) % 10
			p = (p + 1) % 10""",
			compile(0, "+++>>>"));
	}

	@Test
	void runLengthFusion() {
		assertEquals(PREAMBLE + """
			m[p] += 3
			p = (p + 3) % 10""",
			compile(1, "+++>>>"));
	}

	@Test
	void offsetCaching_commitsAtTheEnd() {
		assertEquals(PREAMBLE + """
			m[p] += 3
			p = (p + 3) % 10""",
			compile(2, "+++>>>"));
	}

	@Test
	void offsetCaching_addressesRelativeToPointer() {
		assertEquals(PREAMBLE + """
			m[(p + 1) % 10] += 1
			m[(p + 2) % 10] += 1""",
			compile(2, ">+>+<<"),
			"No pointer assignment needed when the moves cancel out");
		assertEquals(PREAMBLE + """
			p = (p + 1) % 10
			m[p] += 1
			p = (p + 1) % 10
			m[p] += 1
			p = (p - 2) % 10""",
			compile(1, ">+>+<<"));
	}

	@Test
	void offsetCaching_commitsAroundLoops() {
		assertEquals(PREAMBLE + """
			m[(p + 2) % 10] = int(sys.stdin.readline().strip() or 0)
			p = (p + 2) % 10
			while m[p] != 0:
			    m[p] -= 1
			    print(m[(p - 1) % 10])
			    p = (p - 1) % 10
			print(m[(p + 1) % 10])
			p = (p + 1) % 10""",
			compile(2, ">>,[-<.]>."));
	}

	@Test
	void negativeOffsetWrapsAround() {
		assertEquals(PREAMBLE + """
			m[(p - 3) % 10] += 2
			print(m[(p - 3) % 10])
			p = (p - 3) % 10""",
			compile(2, "<<<++."));
	}

	@Test
	void readAndWriteAtPointer() {
		String expected = PREAMBLE + """
			m[p] = int(sys.stdin.readline().strip() or 0)
			print(m[p])""";
		for (int level = 0; level <= 2; level++) {
			assertEquals(expected, compile(level, ",."), "Level " + level);
		}
	}

	@Test
	void emptyRunProducesNothing() {
		assertEquals(PREAMBLE.strip(), compile(1, ""));
		assertEquals(PREAMBLE.strip(), compile(2, "><"));
	}

	@Test
	void nestedLoopsIndent() {
		assertEquals(PREAMBLE + """
			while m[p] != 0:
			    while m[p] != 0:
			        m[p] -= 1
			    p = (p + 1) % 10""",
			compile(1, "[[-]>]"));
	}

	@Test
	void tabIndentation() {
		CompilerSettings settings = CompilerSettings.builder()
			.memorySize(10)
			.indentStyle(IndentStyle.TABS)
			.indentWidth(1)
			.optimizationLevel(0)
			.build();
		assertEquals(PREAMBLE + "while m[p] != 0:\n\tm[p] -= 1",
			BpcCompiler.using(settings).compile("[-]"));
	}

	@Test
	void multiplicationExample() {
		CompilerSettings settings = CompilerSettings.DEFAULT
			.withMemorySize(5)
			.withComments(true);
		assertEquals("""
				# -*- coding: UTF-8 -*-
				import sys
				m = [0] * 5
				p = 0

				# read a and b
				m[p] = int(sys.stdin.readline().strip() or 0)
				m[(p + 1) % 5] = int(sys.stdin.readline().strip() or 0)

				# | a | b | c | d |
				# compute c = a*b using d as temp (pointer starts and ends and a)
				while m[p] != 0:

				    # sum b to c and copy in d (ends in b)
				    p = (p + 1) % 5
				    while m[p] != 0:
				        m[p] -= 1
				        m[(p + 1) % 5] += 1
				        m[(p + 2) % 5] += 1

				    # move d in b (ends in d)
				    p = (p + 2) % 5
				    while m[p] != 0:
				        m[p] -= 1
				        m[(p - 2) % 5] += 1

				    # back on a
				    m[(p - 3) % 5] -= 1
				    p = (p - 3) % 5

				# print c
				print(m[(p + 2) % 5])
				p = (p + 2) % 5""",
			BpcCompiler.using(settings).compile(Programs.MULTIPLICATION));
	}

	@ParameterizedTest
	@ValueSource(ints = {0, 1, 2})
	void multiplicationPrintsProduct(int level) {
		String code = BpcCompiler.using(CompilerSettings.DEFAULT.withMemorySize(5).withOptimizationLevel(level))
			.compile(Programs.MULTIPLICATION);
		assertEquals(List.of("15"), GeneratedProgramRunner.run(code, 5, 3).output());
	}

	@ParameterizedTest
	@ValueSource(ints = {0, 1, 2})
	void commentsOnlyAddCommentLines(int level) {
		CompilerSettings plain = SETTINGS.withOptimizationLevel(level).withDumpMemory(true);
		String without = BpcCompiler.using(plain).compile(Programs.MULTIPLICATION);
		String with = BpcCompiler.using(plain.withComments(true)).compile(Programs.MULTIPLICATION);
		assertTrue(with.length() > without.length());
		assertEquals(statementsOf(without), statementsOf(with));
	}

	@ParameterizedTest
	@ValueSource(ints = {0, 1, 2})
	void unmatchedLoopClose(int level) {
		var e = assertThrows(UnmatchedLoopCloseException.class, () -> compile(level, "+[-]\n>]<"));
		assertEquals(6, e.position().offset());
		assertEquals(2, e.position().line());
		assertEquals(2, e.position().column());
	}

	@ParameterizedTest
	@ValueSource(ints = {0, 1, 2})
	void unclosedLoops(int level) {
		var e = assertThrows(UnclosedLoopException.class, () -> compile(level, "[>[+[-]"));
		assertEquals(2, e.openLoops());
		assertEquals(2, e.innermostOpening().offset());
		assertTrue(e.getMessage().contains("Unclosed loop(s)"), e.getMessage());
	}

	@ParameterizedTest
	@ValueSource(ints = {-1, 3, 99})
	void invalidOptimizationLevel(int level) {
		assertThrows(ConfigurationException.class, () -> BpcCompiler.using(SETTINGS.withOptimizationLevel(level)));
	}

	@Test
	void invalidSizes() {
		assertThrows(ConfigurationException.class, () -> BpcCompiler.using(SETTINGS.withMemorySize(0)));
		assertThrows(ConfigurationException.class, () -> BpcCompiler.using(SETTINGS.withMemorySize(-5)));
		assertThrows(ConfigurationException.class, () -> BpcCompiler.using(
			new CompilerSettings(10, 0, IndentStyle.SPACES, false, false, 2)));
		assertThrows(ConfigurationException.class, () -> BpcCompiler.using(
			new CompilerSettings(10, 4, null, false, false, 2)));
		assertThrows(ConfigurationException.class, () -> CompilerSettings.builder().indentWidth(-1).build());
		assertThrows(ConfigurationException.class, () -> BpcCompiler.using(null));
	}

	@Test
	void statistics() {
		CompilationResult result = BpcCompiler.using(SETTINGS.withComments(true)).compileWithStatistics(Programs.MULTIPLICATION);
		assertEquals(33, result.instructions());
		assertEquals(3, result.loops());
		assertEquals(statementsOf(result.code()).size(), result.statements());
	}

	@Test
	void compilationsAreIndependent() {
		BpcCompiler compiler = BpcCompiler.using(SETTINGS);
		String first = compiler.compile(Programs.NESTED);
		assertThrows(UnclosedLoopException.class, () -> compiler.compile("[[["));
		assertEquals(first, compiler.compile(Programs.NESTED));
	}

	private static String compile(int level, String source) {
		return BpcCompiler.using(SETTINGS.withOptimizationLevel(level)).compile(source);
	}

	private static List<String> statementsOf(String code) {
		return Arrays.stream(code.split("\n"))
			.filter(line -> !line.isBlank())
			.filter(line -> !line.strip().startsWith("#"))
			.toList();
	}
}
