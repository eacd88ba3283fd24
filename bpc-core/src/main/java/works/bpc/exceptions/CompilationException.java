package works.bpc.exceptions;

/**
 * Root of everything that can go wrong while compiling a program.
 * All of these are fatal for the compilation attempt that raised them.
 */
public sealed abstract class CompilationException extends RuntimeException permits ConfigurationException, StructuralException {
	protected CompilationException(String message) {
		super(message);
	}

	protected CompilationException(String message, Throwable cause) {
		super(message, cause);
	}

	/**
	 * @return an exception of the same concrete type as {@code exception}
	 * whose message is prefixed with {@code context}
	 */
	@SuppressWarnings("unchecked")
	public static <T extends CompilationException> T wrap(T exception, String context) {
		String newMessage = context + ": " + exception.getMessage();
		if (exception instanceof UnmatchedLoopCloseException e) {
			return (T) new UnmatchedLoopCloseException(e.position(), newMessage, e);
		} else if (exception instanceof UnclosedLoopException e) {
			return (T) new UnclosedLoopException(e.openLoops(), e.innermostOpening(), newMessage, e);
		} else if (exception instanceof StructuralException e) {
			return (T) new StructuralException(newMessage, e);
		} else {
			return (T) new ConfigurationException(newMessage, exception);
		}
	}
}
