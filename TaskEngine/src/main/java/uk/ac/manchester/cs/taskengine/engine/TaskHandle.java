package uk.ac.manchester.cs.taskengine.engine;

import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import uk.ac.manchester.cs.taskengine.errors.ExecutionFailedException;
import uk.ac.manchester.cs.taskengine.errors.TaskRunException;
import uk.ac.manchester.cs.taskengine.task.Outcome;

/**
 * The result of a spawned task, once there is one. Dropping the handle does
 * not stop the task; use the cancellation token for that.
 */
public final class TaskHandle {
	private final String backend;
	private final String taskName;
	private final Future<List<Outcome>> future;

	TaskHandle(String backend, String taskName, Future<List<Outcome>> future) {
		this.backend = backend;
		this.taskName = taskName;
		this.future = future;
	}

	public String getBackend() {
		return backend;
	}

	/** @return the task's name, as given or as generated */
	public String getTaskName() {
		return taskName;
	}

	public boolean isDone() {
		return future.isDone();
	}

	/**
	 * Wait for the task to finish.
	 * 
	 * @return One outcome per execution, in order.
	 * @throws TaskRunException
	 *             The classified reason the task did not finish.
	 * @throws InterruptedException
	 *             If this thread was interrupted while waiting. The task
	 *             carries on.
	 */
	public List<Outcome> await() throws TaskRunException, InterruptedException {
		try {
			return future.get();
		} catch (ExecutionException e) {
			throw unwrap(e);
		}
	}

	/**
	 * Wait a limited time for the task to finish.
	 * 
	 * @throws TimeoutException
	 *             If the task is still running. It carries on.
	 * @see #await()
	 */
	public List<Outcome> await(long timeout, TimeUnit unit)
			throws TaskRunException, InterruptedException, TimeoutException {
		try {
			return future.get(timeout, unit);
		} catch (ExecutionException e) {
			throw unwrap(e);
		}
	}

	private TaskRunException unwrap(ExecutionException e) {
		Throwable cause = e.getCause();
		if (cause instanceof TaskRunException)
			return (TaskRunException) cause;
		if (cause instanceof Error)
			throw (Error) cause;
		return new ExecutionFailedException("task " + taskName + " on "
				+ backend + " failed unexpectedly", cause);
	}

	@Override
	public String toString() {
		return "TaskHandle(" + backend + "/" + taskName
				+ (isDone() ? ", done)" : ")");
	}
}
