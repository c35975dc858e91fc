package uk.ac.manchester.cs.taskengine.runner.docker;

import static java.nio.file.Files.createTempDirectory;
import static org.apache.commons.io.FileUtils.copyFile;
import static org.apache.commons.io.FileUtils.deleteDirectory;
import static org.apache.commons.io.FileUtils.writeByteArrayToFile;
import static org.slf4j.LoggerFactory.getLogger;
import static uk.ac.manchester.cs.taskengine.events.TaskEvent.Type.CONTAINER_CREATED;
import static uk.ac.manchester.cs.taskengine.events.TaskEvent.Type.CONTAINER_EXITED;
import static uk.ac.manchester.cs.taskengine.events.TaskEvent.Type.STDERR;
import static uk.ac.manchester.cs.taskengine.events.TaskEvent.Type.STDOUT;

import java.io.File;
import java.io.IOException;
import java.net.MalformedURLException;
import java.net.URI;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;

import uk.ac.manchester.cs.taskengine.config.DockerBackendConfig;
import uk.ac.manchester.cs.taskengine.docker.ContainerEngine;
import uk.ac.manchester.cs.taskengine.docker.ContainerEngine.OutputListener;
import uk.ac.manchester.cs.taskengine.docker.ContainerOutput;
import uk.ac.manchester.cs.taskengine.docker.ContainerSpec;
import uk.ac.manchester.cs.taskengine.docker.DaemonMode;
import uk.ac.manchester.cs.taskengine.docker.DockerEngineClient;
import uk.ac.manchester.cs.taskengine.docker.DockerEngineException;
import uk.ac.manchester.cs.taskengine.docker.Mount;
import uk.ac.manchester.cs.taskengine.docker.ServiceSpec;
import uk.ac.manchester.cs.taskengine.docker.ServiceTaskStatus;
import uk.ac.manchester.cs.taskengine.engine.Runner;
import uk.ac.manchester.cs.taskengine.errors.BackendInitException;
import uk.ac.manchester.cs.taskengine.errors.ConnectivityException;
import uk.ac.manchester.cs.taskengine.errors.ExecutionFailedException;
import uk.ac.manchester.cs.taskengine.errors.ImageUnavailableException;
import uk.ac.manchester.cs.taskengine.errors.NameConflictException;
import uk.ac.manchester.cs.taskengine.errors.SubmitException;
import uk.ac.manchester.cs.taskengine.errors.TaskCancelledException;
import uk.ac.manchester.cs.taskengine.errors.TaskRunException;
import uk.ac.manchester.cs.taskengine.events.TaskEvents;
import uk.ac.manchester.cs.taskengine.events.TaskEvents.Emitter;
import uk.ac.manchester.cs.taskengine.task.CancellationToken;
import uk.ac.manchester.cs.taskengine.task.CancellationToken.Registration;
import uk.ac.manchester.cs.taskengine.task.Contents;
import uk.ac.manchester.cs.taskengine.task.Execution;
import uk.ac.manchester.cs.taskengine.task.Input;
import uk.ac.manchester.cs.taskengine.task.Outcome;
import uk.ac.manchester.cs.taskengine.task.Resources;
import uk.ac.manchester.cs.taskengine.task.Task;

/**
 * Runs each execution of a task in its own container, one after another. On a
 * swarm manager each execution becomes a single-replica service instead.
 */
public class ContainerRunner implements Runner {
	/** Time (in ms) between looks for a service's task before it exists. */
	static final long UNSCHEDULED_POLL_INTERVAL = 100;
	/** Time (in ms) between looks at a service's task once it exists. */
	static final long SCHEDULED_POLL_INTERVAL = 1000;
	private static final double BYTES_PER_GIB = 1024L * 1024L * 1024L;

	private final Logger log = getLogger(getClass());
	private final DockerBackendConfig config;
	private final ContainerEngine engine;
	private final TaskEvents events;
	private DaemonMode mode;

	/**
	 * Build a runner talking to the configured daemon, checking that the
	 * daemon answers.
	 */
	public static ContainerRunner connect(DockerBackendConfig config,
			TaskEvents events) throws BackendInitException {
		config.validate();
		URL url = config.getUrl();
		if (url == null) {
			try {
				url = DockerEngineClient.endpointFor(System.getenv("DOCKER_HOST"));
			} catch (MalformedURLException e) {
				throw new BackendInitException("backend " + config.getName()
						+ ": cannot use DOCKER_HOST", e);
			}
		}
		ContainerRunner runner = new ContainerRunner(config,
				new DockerEngineClient(url, config.getRetries()), events);
		try {
			DaemonMode mode = runner.daemonMode();
			runner.log.info("backend " + config.getName()
					+ " uses docker daemon at " + url + " (" + mode + ")");
		} catch (IOException e) {
			runner.close();
			throw new BackendInitException("backend " + config.getName()
					+ ": cannot reach docker daemon at " + url, e);
		}
		return runner;
	}

	public ContainerRunner(DockerBackendConfig config, ContainerEngine engine,
			TaskEvents events) {
		this.config = config;
		this.engine = engine;
		this.events = events;
	}

	/** Asks the daemon what it is the first time, then remembers. */
	synchronized DaemonMode daemonMode() throws IOException {
		if (mode == null)
			mode = engine.getDaemonMode();
		return mode;
	}

	private static Long bytes(Double gib) {
		if (gib == null)
			return null;
		return (long) (gib * BYTES_PER_GIB);
	}

	@Override
	public List<Outcome> run(Task task, Resources resources,
			CancellationToken token) throws TaskRunException {
		DaemonMode daemonMode;
		try {
			daemonMode = daemonMode();
		} catch (IOException e) {
			throw new ConnectivityException("cannot reach docker daemon", e);
		}
		if (daemonMode == DaemonMode.SWARM_WORKER)
			throw new SubmitException("backend " + config.getName()
					+ " is a swarm worker; tasks can only be run on a manager");

		Emitter emitter = events.forTask(config.getName(), task.getName());
		File workDir;
		try {
			workDir = createTempDirectory("taskengine-" + task.getName())
					.toFile();
		} catch (IOException e) {
			throw new SubmitException("cannot make working directory for "
					+ task.getName(), e);
		}
		try {
			List<Mount> mounts = materialize(task, workDir);
			List<Execution> executions = task.getExecutions();
			List<Outcome> outcomes = new ArrayList<>();
			for (int i = 0; i < executions.size(); i++) {
				if (token.isCancelled())
					throw new TaskCancelledException("task " + task.getName()
							+ " cancelled");
				String name = executions.size() == 1 ? task.getName() : task
						.getName() + "-" + i;
				Execution execution = executions.get(i);
				ensureImage(execution.getImage());
				if (daemonMode == DaemonMode.STANDALONE)
					outcomes.add(runContainer(name, execution, mounts,
							resources, token, emitter));
				else
					outcomes.add(runService(name, execution, mounts,
							resources, token, emitter));
			}
			return outcomes;
		} finally {
			if (config.isCleanup())
				removeWorkDir(workDir);
			else
				log.info("keeping working directory " + workDir);
		}
	}

	private void removeWorkDir(File workDir) {
		try {
			deleteDirectory(workDir);
		} catch (IOException e) {
			log.warn("failed to remove working directory " + workDir, e);
		}
	}

	private void ensureImage(String image) throws TaskRunException {
		try {
			if (engine.imageExists(image))
				return;
		} catch (IOException e) {
			throw new ConnectivityException("cannot check for image " + image,
					e);
		}
		log.info("pulling image " + image);
		try {
			engine.pullImage(image);
		} catch (IOException e) {
			throw new ImageUnavailableException("cannot pull image " + image, e);
		}
	}

	/**
	 * Makes the host side of every input and shared volume.
	 */
	List<Mount> materialize(Task task, File workDir) throws SubmitException {
		List<Mount> mounts = new ArrayList<>();
		try {
			for (Input input : task.getInputs()) {
				Contents contents = input.getContents();
				switch (contents.getKind()) {
				case PATH:
					mounts.add(new Mount(contents.getPath().getAbsolutePath(),
							input.getPath(), input.isReadOnly()));
					break;
				case LITERAL:
					File literal = File.createTempFile("input", null, workDir);
					writeByteArrayToFile(literal, contents.getLiteral());
					mounts.add(new Mount(literal.getAbsolutePath(), input
							.getPath(), input.isReadOnly()));
					break;
				case URL:
					URI url = contents.getUrl();
					if (!"file".equals(url.getScheme())) {
						log.warn("cannot fetch " + url + " for input "
								+ input.getPath() + "; skipping it");
						break;
					}
					File copy = File.createTempFile("input", null, workDir);
					copyFile(new File(url), copy);
					mounts.add(new Mount(copy.getAbsolutePath(), input
							.getPath(), input.isReadOnly()));
					break;
				}
			}
			for (String volume : task.getVolumes()) {
				File dir = createTempDirectory(workDir.toPath(), "volume")
						.toFile();
				mounts.add(new Mount(dir.getAbsolutePath(), volume, false));
			}
		} catch (IOException | IllegalArgumentException e) {
			throw new SubmitException("cannot prepare inputs of task "
					+ task.getName(), e);
		}
		return mounts;
	}

	private void fill(ContainerSpec spec, String name, Execution execution,
			List<Mount> mounts, Resources resources) {
		if (execution.getStdin() != null || execution.getStdout() != null
				|| execution.getStderr() != null)
			log.warn("backend " + config.getName()
					+ " ignores stream redirection of executions");
		spec.setName(name);
		spec.setImage(execution.getImage());
		spec.setCommand(execution.getCommandLine());
		spec.setWorkDir(execution.getWorkDir());
		spec.setEnv(execution.getEnv());
		for (Mount mount : mounts)
			spec.addMount(mount);
		spec.setCpuLimit(resources.getCpuLimit());
		spec.setMemoryLimit(bytes(resources.getRamLimit()));
	}

	private TaskRunException createFailure(String name, IOException e) {
		if (e instanceof DockerEngineException) {
			if (((DockerEngineException) e).isConflict())
				return new NameConflictException("there is already a "
						+ "container or service called " + name, e);
			return new SubmitException("docker refused to create " + name, e);
		}
		return new ConnectivityException("cannot reach docker daemon", e);
	}

	private TaskRunException runFailure(String name, IOException e) {
		if (e instanceof DockerEngineException)
			return new ExecutionFailedException("docker failed running "
					+ name, e);
		return new ConnectivityException("lost docker daemon while running "
				+ name, e);
	}

	private static TaskCancelledException cancelled(String name,
			Teardown teardown) {
		teardown.run();
		return new TaskCancelledException(name + " was cancelled")
				.withTeardownFailure(teardown.getFailure());
	}

	private Outcome runContainer(String name, Execution execution,
			List<Mount> mounts, Resources resources, CancellationToken token,
			final Emitter emitter) throws TaskRunException {
		ContainerSpec spec = new ContainerSpec();
		fill(spec, name, execution, mounts, resources);
		final String id;
		try {
			id = engine.createContainer(spec);
		} catch (IOException e) {
			throw createFailure(name, e);
		}
		log.debug("created container " + id + " for " + name);
		emitter.send(CONTAINER_CREATED, id);

		Teardown teardown = new Teardown("container " + id) {
			@Override
			void remove() throws IOException {
				engine.removeContainer(id, true);
			}
		};
		try (Registration registration = token.onCancel(teardown)) {
			engine.startContainer(id);
			ContainerOutput output = engine.attachContainer(id,
					new OutputListener() {
						@Override
						public void output(boolean stderr, byte[] chunk) {
							if (emitter.isListening())
								emitter.send(stderr ? STDERR : STDOUT,
										new String(chunk,
												StandardCharsets.UTF_8));
						}
					});
			int status = engine.waitContainer(id);
			if (token.isCancelled())
				throw cancelled(name, teardown);
			emitter.send(CONTAINER_EXITED, Integer.toString(status));
			log.debug("container " + id + " exited with status " + status);
			return new Outcome(status, output.getStdout(), output.getStderr());
		} catch (IOException e) {
			if (token.isCancelled())
				throw cancelled(name, teardown);
			throw runFailure(name, e);
		} finally {
			if (config.isCleanup() && !teardown.isDone())
				teardown.run();
		}
	}

	private Outcome runService(String name, Execution execution,
			List<Mount> mounts, Resources resources, CancellationToken token,
			Emitter emitter) throws TaskRunException {
		ServiceSpec spec = new ServiceSpec();
		fill(spec, name, execution, mounts, resources);
		spec.setCpuReservation(resources.getCpu());
		spec.setMemoryReservation(bytes(resources.getRam()));
		final String id;
		try {
			id = engine.createService(spec);
		} catch (IOException e) {
			throw createFailure(name, e);
		}
		log.debug("created service " + id + " for " + name);
		emitter.send(CONTAINER_CREATED, id);

		Teardown teardown = new Teardown("service " + id) {
			@Override
			void remove() throws IOException {
				engine.removeService(id);
			}
		};
		try (Registration registration = token.onCancel(teardown)) {
			ServiceTaskStatus status = awaitService(id, token);
			if (status == null)
				throw cancelled(name, teardown);
			String containerId = status.getContainerId();
			if (containerId == null)
				throw new ExecutionFailedException("service " + name
						+ " ended (" + status.getState()
						+ ") without running a container: "
						+ status.getMessage());
			int exitCode = status.getExitCode() != null ? status
					.getExitCode() : engine.waitContainer(containerId);
			ContainerOutput output = engine.fetchLogs(containerId);
			emitter.send(CONTAINER_EXITED, Integer.toString(exitCode));
			log.debug("service " + id + " exited with status " + exitCode);
			return new Outcome(exitCode, output.getStdout(),
					output.getStderr());
		} catch (IOException e) {
			if (token.isCancelled())
				throw cancelled(name, teardown);
			throw runFailure(name, e);
		} finally {
			if (config.isCleanup() && !teardown.isDone())
				teardown.run();
		}
	}

	/**
	 * Polls a service until its task ends.
	 * 
	 * @return the final status, or <tt>null</tt> if cancelled first
	 */
	private ServiceTaskStatus awaitService(String id, CancellationToken token)
			throws IOException {
		while (!token.isCancelled()) {
			ServiceTaskStatus status = engine.inspectService(id);
			if (status == null) {
				token.await(UNSCHEDULED_POLL_INTERVAL);
				continue;
			}
			if (status.isTerminal())
				return status;
			log.debug("service " + id + " is " + status
					+ (status.isPending() ? " (pending)" : ""));
			token.await(SCHEDULED_POLL_INTERVAL);
		}
		return null;
	}

	@Override
	public void close() {
		try {
			engine.close();
		} catch (IOException e) {
			log.warn("problem closing docker client", e);
		}
	}
}
