package works.bpc.exceptions;

/**
 * The compiler settings are invalid.
 * Thrown before any source text is looked at.
 */
public final class ConfigurationException extends CompilationException {
	public ConfigurationException(String message) {
		super(message);
	}

	public ConfigurationException(String message, Throwable cause) {
		super(message, cause);
	}
}
