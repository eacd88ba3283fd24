package works.bpc.exceptions;

import works.bpc.tokenizer.SourcePosition;

/**
 * A loop-close instruction appeared while no loop was open.
 * Compilation stops at the offending instruction.
 */
public final class UnmatchedLoopCloseException extends StructuralException {
	private final SourcePosition position;

	public UnmatchedLoopCloseException(SourcePosition position) {
		super("Unmatched loop close ']' at " + position);
		this.position = position;
	}

	UnmatchedLoopCloseException(SourcePosition position, String message, Throwable cause) {
		super(message, cause);
		this.position = position;
	}

	public SourcePosition position() {
		return position;
	}
}
