package uk.ac.manchester.cs.taskengine.errors;

/**
 * Handing the work to the backend failed, or the job it created could not be identified.
 */
public class SubmitException extends TaskRunException {
	private static final long serialVersionUID = 1L;

	public SubmitException(String message) {
		super(message);
	}

	public SubmitException(String message, Throwable cause) {
		super(message, cause);
	}
}
