package uk.ac.manchester.cs.taskengine.errors;

/**
 * A backend name was registered twice.
 */
public class DuplicateBackendException extends TaskEngineException {
	private static final long serialVersionUID = 1L;

	public DuplicateBackendException(String message) {
		super(message);
	}

	public DuplicateBackendException(String message, Throwable cause) {
		super(message, cause);
	}
}
