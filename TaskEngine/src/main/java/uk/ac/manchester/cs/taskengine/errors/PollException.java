package uk.ac.manchester.cs.taskengine.errors;

/**
 * Asking a remote service for the state of a task failed.
 */
public class PollException extends MonitorException {
	private static final long serialVersionUID = 1L;

	public PollException(String message) {
		super(message);
	}

	public PollException(String message, Throwable cause) {
		super(message, cause);
	}
}
