package uk.ac.manchester.cs.taskengine.tes.model;

/**
 * The states a task goes through on the service.
 */
public enum TesState {
	/** The service does not know. */
	UNKNOWN,
	/** Accepted but not yet scheduled. */
	QUEUED,
	/** Being prepared: inputs fetched, containers pulled. */
	INITIALIZING,
	/** Executors are running. */
	RUNNING,
	/** Suspended by the service. */
	PAUSED,
	/** All executors finished. */
	COMPLETE,
	/** An executor failed. */
	EXECUTOR_ERROR,
	/** The service failed to run the task. */
	SYSTEM_ERROR,
	/** Cancelled on request. */
	CANCELED,
	/** Cancellation requested but not yet complete. */
	CANCELING,
	/** The underlying machine was reclaimed. */
	PREEMPTED;

	/** @return whether the task can make no further progress */
	public boolean isTerminal() {
		switch (this) {
		case COMPLETE:
		case EXECUTOR_ERROR:
		case SYSTEM_ERROR:
		case CANCELED:
		case PREEMPTED:
			return true;
		default:
			return false;
		}
	}
}
