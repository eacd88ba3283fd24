package works.bpc.generator;

import works.bpc.CompilerSettings;
import works.bpc.emit.CodeBuilder;
import works.bpc.exceptions.ConfigurationException;
import works.bpc.tokenizer.CommentListener;
import works.bpc.tokenizer.FinishListener;
import works.bpc.tokenizer.InstructionListener;
import works.bpc.tokenizer.Tokenizer;

/**
 * Consumes {@link Tokenizer} events and appends the corresponding Python statements to a {@link CodeBuilder}.
 * <p>
 * Every optimization level produces a program with the same observable behaviour:
 * the same output, final memory and final pointer for the same input.
 * They differ only in how many statements they need to get there.
 * <p>
 * A generator is good for one compilation; it is not reusable.
 */
public interface CodeGenerator extends InstructionListener, CommentListener, FinishListener {
	/**
	 * Marks comment lines in the generated code. Give this to the {@link CodeBuilder}.
	 */
	String COMMENT_MARKER = PythonSyntax.COMMENT_MARKER;

	/**
	 * Writes the program preamble into {@code builder} and returns the generator
	 * for {@link CompilerSettings#optimizationLevel settings.optimizationLevel()}.
	 *
	 * @param settings must already be {@link CompilerSettings#validate() valid}
	 */
	static CodeGenerator create(CompilerSettings settings, CodeBuilder builder) {
		StatementWriter writer = new StatementWriter(builder, settings);
		CodeGenerator result = switch (settings.optimizationLevel()) {
			case 0 -> new DirectGenerator(writer);
			case 1 -> new RunLengthGenerator(writer);
			case 2 -> new OffsetCachingGenerator(writer);
			default ->
				throw new ConfigurationException("No code generator for optimization level " + settings.optimizationLevel());
		};
		writer.preamble();
		return result;
	}

	/**
	 * Registers this generator for instruction and finish events,
	 * and also for comment events if {@code comments} is true.
	 */
	default void registerWith(Tokenizer tokenizer, boolean comments) {
		tokenizer.registerInstructionListener(this);
		if (comments) {
			tokenizer.registerCommentListener(this);
		}
		tokenizer.registerFinishListener(this);
	}
}
