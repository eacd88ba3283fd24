package works.bpc.generator;

import java.util.ArrayDeque;
import java.util.Deque;
import works.bpc.CompilerSettings;
import works.bpc.emit.CodeBuilder;
import works.bpc.exceptions.UnclosedLoopException;
import works.bpc.exceptions.UnmatchedLoopCloseException;
import works.bpc.tokenizer.SourceEvent.CommentEvent;
import works.bpc.tokenizer.SourceEvent.InstructionEvent;
import works.bpc.tokenizer.SourcePosition;

/**
 * Emits statements into a {@link CodeBuilder} and enforces loop nesting.
 * Shared by all the {@link CodeGenerator}s; they differ only in which of these
 * methods they call, and with what arguments.
 * <p>
 * Cell arguments are offsets relative to the pointer variable.
 */
final class StatementWriter {
	private final CodeBuilder builder;
	private final CompilerSettings settings;
	private final Deque<SourcePosition> openLoops = new ArrayDeque<>();

	StatementWriter(CodeBuilder builder, CompilerSettings settings) {
		this.builder = builder;
		this.settings = settings;
	}

	int memorySize() {
		return settings.memorySize();
	}

	/**
	 * Appends a statement that was rendered elsewhere.
	 */
	void emit(String statement) {
		builder.append(statement);
	}

	void preamble() {
		builder.append(PythonSyntax.preamble(settings.memorySize()));
	}

	void addToCell(int offset, int amount) {
		builder.append(PythonSyntax.addToCell(PythonSyntax.cell(offset, settings.memorySize()), amount));
	}

	void movePointer(int delta) {
		builder.append(PythonSyntax.movePointer(delta, settings.memorySize()));
	}

	void read(int offset) {
		builder.append(PythonSyntax.read(PythonSyntax.cell(offset, settings.memorySize())));
	}

	void write(int offset) {
		builder.append(PythonSyntax.write(PythonSyntax.cell(offset, settings.memorySize())));
	}

	/**
	 * The loop condition always reads the cell under the pointer,
	 * so any deferred movement must be committed before calling this.
	 */
	void openLoop(SourcePosition position) {
		builder.append(PythonSyntax.loopHeader());
		builder.startBlock();
		openLoops.push(position);
	}

	/**
	 * @throws UnmatchedLoopCloseException if no loop is open
	 */
	void closeLoop(SourcePosition position) {
		if (builder.isAtTopLevel()) {
			throw new UnmatchedLoopCloseException(position);
		}
		builder.endBlock();
		openLoops.pop();
	}

	/**
	 * Read, write and loop instructions at the pointer itself.
	 * These are translated the same way at every optimization level
	 * that doesn't defer pointer movement.
	 */
	void unfused(InstructionEvent event) {
		switch (event.instruction()) {
			case READ -> read(0);
			case WRITE -> write(0);
			case LOOP_OPEN -> openLoop(event.position());
			case LOOP_CLOSE -> closeLoop(event.position());
			default ->
				throw new IllegalArgumentException("Not a read, write or loop instruction: " + event);
		}
	}

	/**
	 * One comment line per non-blank line of the comment text.
	 */
	void comment(CommentEvent event) {
		for (String line : event.text().split("\n")) {
			String text = line.strip();
			if (!text.isEmpty()) {
				builder.append(PythonSyntax.comment(text));
			}
		}
	}

	/**
	 * Checks that every loop was closed, then adds the memory dump if requested.
	 *
	 * @throws UnclosedLoopException if any loop is still open
	 */
	void finish() {
		if (!builder.isAtTopLevel()) {
			throw new UnclosedLoopException(builder.depth(), openLoops.peek());
		}
		if (settings.dumpMemory()) {
			if (settings.comments()) {
				builder.append(PythonSyntax.comment("dump the memory"));
			}
			builder.append(PythonSyntax.dumpPrologue(settings.memorySize()));
			builder.startBlock();
			builder.append(PythonSyntax.dumpRow());
			builder.endBlock();
		}
	}
}
