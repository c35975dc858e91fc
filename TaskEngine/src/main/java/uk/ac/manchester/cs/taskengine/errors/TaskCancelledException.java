package uk.ac.manchester.cs.taskengine.errors;

/**
 * The task was cancelled and the cancellation was honoured. Any failure of the
 * teardown that followed is attached as a suppressed exception; it does not
 * change the classification.
 */
public class TaskCancelledException extends TaskRunException {
	private static final long serialVersionUID = 1L;

	public TaskCancelledException(String message) {
		super(message);
	}

	/**
	 * @param teardownFailure
	 *            What went wrong tearing the work down, or <tt>null</tt>.
	 * @return this exception
	 */
	public TaskCancelledException withTeardownFailure(Throwable teardownFailure) {
		if (teardownFailure != null)
			addSuppressed(teardownFailure);
		return this;
	}
}
