package uk.ac.manchester.cs.taskengine.errors;

/**
 * The work reached a terminal state, but its results could not be retrieved.
 */
public class ResultExtractionException extends TaskRunException {
	private static final long serialVersionUID = 1L;

	public ResultExtractionException(String message) {
		super(message);
	}

	public ResultExtractionException(String message, Throwable cause) {
		super(message, cause);
	}
}
