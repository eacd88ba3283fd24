package works.bpc.exceptions;

/**
 * The program's loops are not properly nested.
 * <p>
 * This class is concrete because the code builder can detect a block
 * closed at the top level without knowing which instruction caused it.
 * Code that knows the source position should throw one of the subclasses.
 */
public sealed class StructuralException extends CompilationException permits
	UnclosedLoopException,
	UnmatchedLoopCloseException
{
	public StructuralException(String message) {
		super(message);
	}

	public StructuralException(String message, Throwable cause) {
		super(message, cause);
	}
}
