package uk.ac.manchester.cs.taskengine.errors;

/**
 * A backend could not be built or the facility behind it could not be reached.
 */
public class BackendInitException extends TaskEngineException {
	private static final long serialVersionUID = 1L;

	public BackendInitException(String message) {
		super(message);
	}

	public BackendInitException(String message, Throwable cause) {
		super(message, cause);
	}
}
