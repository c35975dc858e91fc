package uk.ac.manchester.cs.taskengine.errors;

/**
 * Checking on submitted work failed to execute. This is not the same as the work having finished or failed.
 */
public class MonitorException extends TaskRunException {
	private static final long serialVersionUID = 1L;

	public MonitorException(String message) {
		super(message);
	}

	public MonitorException(String message, Throwable cause) {
		super(message, cause);
	}
}
