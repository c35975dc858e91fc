package uk.ac.manchester.cs.taskengine.engine;

import java.util.List;

import uk.ac.manchester.cs.taskengine.errors.TaskRunException;
import uk.ac.manchester.cs.taskengine.task.CancellationToken;
import uk.ac.manchester.cs.taskengine.task.Outcome;
import uk.ac.manchester.cs.taskengine.task.Resources;
import uk.ac.manchester.cs.taskengine.task.Task;

/**
 * Runs tasks on one kind of backend. A runner is shared by all the tasks sent
 * to its backend, so must be safe for concurrent use.
 * <p>
 * Once the token is cancelled, a runner must make a best-effort attempt to
 * tear down whatever it started (a container, a remote job, a service task)
 * and then throw {@link uk.ac.manchester.cs.taskengine.errors.TaskCancelledException
 * TaskCancelledException}, with any teardown failure attached to it. Whatever
 * the outcome, nothing it created may be left behind unless it was configured
 * to keep it.
 */
public interface Runner {
	/**
	 * Run a task to completion.
	 * 
	 * @param task
	 *            What to run. Always named.
	 * @param resources
	 *            The resources to use, already resolved against the defaults.
	 * @param token
	 *            Says when to give up.
	 * @return One outcome per execution of the task, in order.
	 * @throws TaskRunException
	 *             If the task did not run to completion.
	 */
	List<Outcome> run(Task task, Resources resources, CancellationToken token)
			throws TaskRunException;

	/** Let go of any connections held for the backend. */
	void close();
}
