package uk.ac.manchester.cs.taskengine.errors;

/**
 * The work itself failed, as opposed to the mechanism for running it.
 */
public class ExecutionFailedException extends TaskRunException {
	private static final long serialVersionUID = 1L;

	public ExecutionFailedException(String message) {
		super(message);
	}

	public ExecutionFailedException(String message, Throwable cause) {
		super(message, cause);
	}
}
