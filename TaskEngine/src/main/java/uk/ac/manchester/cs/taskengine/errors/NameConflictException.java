package uk.ac.manchester.cs.taskengine.errors;

/**
 * The container or service name is already in use.
 */
public class NameConflictException extends SubmitException {
	private static final long serialVersionUID = 1L;

	public NameConflictException(String message) {
		super(message);
	}

	public NameConflictException(String message, Throwable cause) {
		super(message, cause);
	}
}
