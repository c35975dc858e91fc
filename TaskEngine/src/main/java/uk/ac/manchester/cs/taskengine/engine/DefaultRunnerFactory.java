package uk.ac.manchester.cs.taskengine.engine;

import uk.ac.manchester.cs.taskengine.config.BackendConfig;
import uk.ac.manchester.cs.taskengine.config.DockerBackendConfig;
import uk.ac.manchester.cs.taskengine.config.GenericBackendConfig;
import uk.ac.manchester.cs.taskengine.config.TesBackendConfig;
import uk.ac.manchester.cs.taskengine.errors.BackendInitException;
import uk.ac.manchester.cs.taskengine.events.TaskEvents;
import uk.ac.manchester.cs.taskengine.runner.docker.ContainerRunner;
import uk.ac.manchester.cs.taskengine.runner.generic.GenericRunner;
import uk.ac.manchester.cs.taskengine.runner.tes.TesRunner;

/**
 * Makes the runner that matches each kind of backend configuration.
 */
public class DefaultRunnerFactory implements RunnerFactory {
	@Override
	public Runner createRunner(BackendConfig config, TaskEvents events)
			throws BackendInitException {
		switch (config.getKind()) {
		case DOCKER:
			return ContainerRunner.connect((DockerBackendConfig) config, events);
		case GENERIC:
			return GenericRunner.create((GenericBackendConfig) config, events);
		case TES:
			return TesRunner.connect((TesBackendConfig) config, events);
		default:
			throw new BackendInitException("unsupported backend kind: "
					+ config.getKind());
		}
	}
}
