package uk.ac.manchester.cs.taskengine.events;

import static java.lang.System.currentTimeMillis;

/**
 * Something that happened to a task.
 */
public final class TaskEvent {
	public enum Type {
		/** Accepted by the engine. */
		CREATED,
		/** Holding a concurrency permit and running. */
		STARTED,
		/** A container (or service) was made for an execution. */
		CONTAINER_CREATED,
		/** A container (or service) finished. */
		CONTAINER_EXITED,
		/** Finished with results. */
		COMPLETED,
		/** Finished with a failure. */
		FAILED,
		/** Finished because it was cancelled. */
		CANCELLED,
		/** Output on standard output. */
		STDOUT,
		/** Output on standard error. */
		STDERR
	}

	private final Type type;
	private final String backend;
	private final String taskName;
	private final String message;
	private final long timestamp;

	public TaskEvent(Type type, String backend, String taskName, String message) {
		this.type = type;
		this.backend = backend;
		this.taskName = taskName;
		this.message = message;
		this.timestamp = currentTimeMillis();
	}

	public Type getType() {
		return type;
	}

	public String getBackend() {
		return backend;
	}

	public String getTaskName() {
		return taskName;
	}

	/**
	 * @return free text (a container id, an exit code, a line of output), or
	 *         <tt>null</tt>
	 */
	public String getMessage() {
		return message;
	}

	public long getTimestamp() {
		return timestamp;
	}

	@Override
	public String toString() {
		return type + " " + backend + "/" + taskName
				+ (message == null ? "" : ": " + message);
	}
}
