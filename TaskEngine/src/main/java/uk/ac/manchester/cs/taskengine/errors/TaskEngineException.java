package uk.ac.manchester.cs.taskengine.errors;

/**
 * The root of all classified failures of the task engine.
 */
public class TaskEngineException extends Exception {
	private static final long serialVersionUID = 1L;

	public TaskEngineException(String message) {
		super(message);
	}

	public TaskEngineException(String message, Throwable cause) {
		super(message, cause);
	}
}
