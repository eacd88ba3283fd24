package works.bpc;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.bpc.emit.CodeBuilder;
import works.bpc.exceptions.CompilationException;
import works.bpc.exceptions.ConfigurationException;
import works.bpc.generator.CodeGenerator;
import works.bpc.tokenizer.Instruction;
import works.bpc.tokenizer.Tokenizer;

/**
 * Compiles source text into a Python program according to some {@link CompilerSettings}.
 * <p>
 * Each call to {@link #compile} is independent: the tokenizer, generator and
 * code builder are created for that call and discarded afterward,
 * so one {@code BpcCompiler} can be shared freely.
 */
public final class BpcCompiler {
	private final CompilerSettings settings;

	private BpcCompiler(CompilerSettings settings) {
		this.settings = settings;
	}

	/**
	 * @throws ConfigurationException if {@code settings} are invalid
	 */
	public static BpcCompiler using(CompilerSettings settings) {
		if (settings == null) {
			throw new ConfigurationException("Settings must not be null");
		}
		return new BpcCompiler(settings.validate());
	}

	public CompilerSettings settings() {
		return settings;
	}

	/**
	 * @return the generated program
	 * @throws CompilationException if the source's loops are not properly nested
	 */
	public String compile(CharSequence source) {
		return compileWithStatistics(source).code();
	}

	/**
	 * Like {@link #compile}, but also reports some numbers about the compilation.
	 */
	public CompilationResult compileWithStatistics(CharSequence source) {
		LOGGER.debug("Compiling {} characters with {}", source.length(), settings);
		CodeBuilder builder = new CodeBuilder(settings.indentWidth(), settings.indentStyle().character(), CodeGenerator.COMMENT_MARKER);
		Tokenizer tokenizer = new Tokenizer();
		CodeGenerator generator = CodeGenerator.create(settings, builder);
		generator.registerWith(tokenizer, settings.comments());

		int[] loops = {0};
		tokenizer.registerInstructionListener(event -> {
			if (event.instruction() == Instruction.LOOP_OPEN) {
				loops[0]++;
			}
		});

		int instructions = tokenizer.tokenize(source);
		String code = builder.render();
		var result = new CompilationResult(code, instructions, builder.statementCount(), loops[0]);
		LOGGER.debug("Compiled {} instructions into {} statements using {}",
			result.instructions(), result.statements(), generator.getClass().getSimpleName());
		return result;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(BpcCompiler.class);
}
