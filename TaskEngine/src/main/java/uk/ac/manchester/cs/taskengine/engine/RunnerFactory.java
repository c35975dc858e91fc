package uk.ac.manchester.cs.taskengine.engine;

import uk.ac.manchester.cs.taskengine.config.BackendConfig;
import uk.ac.manchester.cs.taskengine.errors.BackendInitException;
import uk.ac.manchester.cs.taskengine.events.TaskEvents;

/**
 * Builds the runner for a backend configuration.
 */
public interface RunnerFactory {
	/**
	 * @param config
	 *            The validated configuration.
	 * @param events
	 *            Where the runner reports what its tasks are doing.
	 * @return A connected runner.
	 * @throws BackendInitException
	 *             If the backend cannot be reached or set up.
	 */
	Runner createRunner(BackendConfig config, TaskEvents events)
			throws BackendInitException;
}
