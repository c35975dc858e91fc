package uk.ac.manchester.cs.taskengine.errors;

/**
 * A failure of one run of a task. A task handle resolves to exactly one of
 * these when it does not resolve to results.
 */
public abstract class TaskRunException extends TaskEngineException {
	private static final long serialVersionUID = 1L;

	protected TaskRunException(String message) {
		super(message);
	}

	protected TaskRunException(String message, Throwable cause) {
		super(message, cause);
	}
}
