package works.bpc.tokenizer;

import org.jetbrains.annotations.Nullable;

/**
 * The eight instructions of the source language.
 * Every other character is comment text.
 */
public enum Instruction {
	INCREMENT('+'),
	DECREMENT('-'),
	MOVE_LEFT('<'),
	MOVE_RIGHT('>'),
	READ(','),
	WRITE('.'),
	LOOP_OPEN('['),
	LOOP_CLOSE(']');

	private final char symbol;

	Instruction(char symbol) {
		this.symbol = symbol;
	}

	public char symbol() {
		return symbol;
	}

	/**
	 * @return the instruction written as {@code ch}, or null if {@code ch} is comment text
	 */
	public static @Nullable Instruction forSymbol(int ch) {
		return switch (ch) {
			case '+' -> INCREMENT;
			case '-' -> DECREMENT;
			case '<' -> MOVE_LEFT;
			case '>' -> MOVE_RIGHT;
			case ',' -> READ;
			case '.' -> WRITE;
			case '[' -> LOOP_OPEN;
			case ']' -> LOOP_CLOSE;
			default -> null;
		};
	}

	/**
	 * @return true for instructions whose consecutive repetitions can be fused into one statement
	 */
	public boolean isAccumulable() {
		return switch (this) {
			case INCREMENT, DECREMENT, MOVE_LEFT, MOVE_RIGHT ->
				true;
			default ->
				false;
		};
	}

	/**
	 * @return true for the instructions that move the pointer rather than change a cell
	 */
	public boolean isMove() {
		return this == MOVE_LEFT || this == MOVE_RIGHT;
	}

	/**
	 * The signed effect of one occurrence: on the cell for
	 * {@link #INCREMENT}/{@link #DECREMENT}, on the pointer for the moves.
	 *
	 * @throws IllegalStateException if this instruction is not {@link #isAccumulable accumulable}
	 */
	public int delta() {
		return switch (this) {
			case INCREMENT, MOVE_RIGHT -> 1;
			case DECREMENT, MOVE_LEFT -> -1;
			default ->
				throw new IllegalStateException("Instruction has no delta: " + this);
		};
	}
}
