package works.bpc.exceptions;

import works.bpc.tokenizer.SourcePosition;

/**
 * The source ended with one or more loops still open.
 * Can only be detected once the whole source has been scanned.
 */
public final class UnclosedLoopException extends StructuralException {
	private final int openLoops;
	private final SourcePosition innermostOpening;

	/**
	 * @param innermostOpening position of the last loop-open instruction that was never closed
	 */
	public UnclosedLoopException(int openLoops, SourcePosition innermostOpening) {
		super("Unclosed loop(s): " + openLoops + " '[' never matched; innermost opened at " + innermostOpening);
		this.openLoops = openLoops;
		this.innermostOpening = innermostOpening;
	}

	UnclosedLoopException(int openLoops, SourcePosition innermostOpening, String message, Throwable cause) {
		super(message, cause);
		this.openLoops = openLoops;
		this.innermostOpening = innermostOpening;
	}

	public int openLoops() {
		return openLoops;
	}

	public SourcePosition innermostOpening() {
		return innermostOpening;
	}
}
