package uk.ac.manchester.cs.taskengine.errors;

/**
 * Work was sent to a backend name that was never registered.
 */
public class UnknownBackendException extends TaskEngineException {
	private static final long serialVersionUID = 1L;

	public UnknownBackendException(String message) {
		super(message);
	}

	public UnknownBackendException(String message, Throwable cause) {
		super(message, cause);
	}
}
