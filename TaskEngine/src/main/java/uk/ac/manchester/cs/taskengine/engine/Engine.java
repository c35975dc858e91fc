package uk.ac.manchester.cs.taskengine.engine;

import static java.util.Collections.unmodifiableList;
import static java.util.Objects.requireNonNull;
import static java.util.concurrent.Executors.newCachedThreadPool;
import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static org.slf4j.LoggerFactory.getLogger;
import static uk.ac.manchester.cs.taskengine.events.TaskEvent.Type.CANCELLED;
import static uk.ac.manchester.cs.taskengine.events.TaskEvent.Type.COMPLETED;
import static uk.ac.manchester.cs.taskengine.events.TaskEvent.Type.CREATED;
import static uk.ac.manchester.cs.taskengine.events.TaskEvent.Type.FAILED;
import static uk.ac.manchester.cs.taskengine.events.TaskEvent.Type.STARTED;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;

import uk.ac.manchester.cs.taskengine.config.BackendConfig;
import uk.ac.manchester.cs.taskengine.errors.BackendInitException;
import uk.ac.manchester.cs.taskengine.errors.DuplicateBackendException;
import uk.ac.manchester.cs.taskengine.errors.ExecutionFailedException;
import uk.ac.manchester.cs.taskengine.errors.ResultExtractionException;
import uk.ac.manchester.cs.taskengine.errors.TaskCancelledException;
import uk.ac.manchester.cs.taskengine.errors.TaskRunException;
import uk.ac.manchester.cs.taskengine.errors.UnknownBackendException;
import uk.ac.manchester.cs.taskengine.events.TaskEventListener;
import uk.ac.manchester.cs.taskengine.events.TaskEvents;
import uk.ac.manchester.cs.taskengine.name.NameGenerator;
import uk.ac.manchester.cs.taskengine.task.CancellationToken;
import uk.ac.manchester.cs.taskengine.task.Outcome;
import uk.ac.manchester.cs.taskengine.task.Resources;
import uk.ac.manchester.cs.taskengine.task.Task;

/**
 * Routes tasks to named backends, running no more of them at once on each
 * backend than it allows.
 */
public class Engine implements AutoCloseable {
	/** Time (in ms) between checks for cancellation while waiting to start. */
	private static final long PERMIT_POLL_INTERVAL = 100;

	private final Logger log = getLogger(getClass());
	private final Map<String, Backend> backends = new LinkedHashMap<>();
	private final TaskEvents events = new TaskEvents();
	private final RunnerFactory runnerFactory;
	private final ThreadGroup threadGroup;
	private final ExecutorService executor;

	public Engine() {
		this(new DefaultRunnerFactory());
	}

	public Engine(RunnerFactory runnerFactory) {
		this.runnerFactory = requireNonNull(runnerFactory);
		threadGroup = new ThreadGroup("TaskEngine");
		final AtomicInteger counter = new AtomicInteger();
		executor = newCachedThreadPool(new ThreadFactory() {
			@Override
			public Thread newThread(Runnable r) {
				Thread t = new Thread(threadGroup, r, "Task ("
						+ counter.incrementAndGet() + ")");
				t.setDaemon(true);
				return t;
			}
		});
	}

	/** A registered backend: its runner, its permits and its names. */
	private static final class Backend {
		final BackendConfig config;
		final Runner runner;
		final Semaphore permits;
		final NameGenerator names = new NameGenerator();

		Backend(BackendConfig config, Runner runner) {
			this.config = config;
			this.runner = runner;
			this.permits = new Semaphore(config.getMaxTasks(), true);
		}
	}

	/**
	 * Build, connect and add a backend.
	 * 
	 * @param config
	 *            The backend's configuration.
	 * @throws BackendInitException
	 *             If the configuration is bad or the backend cannot be reached.
	 * @throws DuplicateBackendException
	 *             If there already is a backend of that name.
	 */
	public void register(BackendConfig config) throws BackendInitException,
			DuplicateBackendException {
		requireNonNull(config);
		config.validate();
		synchronized (backends) {
			if (backends.containsKey(config.getName()))
				throw new DuplicateBackendException("backend "
						+ config.getName() + " is already registered");
			Runner runner = runnerFactory.createRunner(config, events);
			backends.put(config.getName(), new Backend(config, runner));
		}
		log.info("registered " + config);
	}

	/** @return the names of the registered backends, in registration order */
	public List<String> runners() {
		synchronized (backends) {
			return unmodifiableList(new ArrayList<>(backends.keySet()));
		}
	}

	public void addListener(TaskEventListener listener) {
		events.addListener(listener);
	}

	public void removeListener(TaskEventListener listener) {
		events.removeListener(listener);
	}

	/**
	 * Start a task on a backend. This does not wait for the task, nor for a
	 * free slot on the backend.
	 * 
	 * @param backendName
	 *            Where to run the task.
	 * @param task
	 *            What to run. If it has no name, one is made up.
	 * @param token
	 *            Cancels the task.
	 * @return The handle for the task's result.
	 * @throws UnknownBackendException
	 *             If no backend of that name is registered.
	 */
	public TaskHandle spawn(String backendName, Task task,
			CancellationToken token) throws UnknownBackendException {
		requireNonNull(task);
		requireNonNull(token);
		Backend backend;
		synchronized (backends) {
			backend = backends.get(backendName);
		}
		if (backend == null)
			throw new UnknownBackendException("no backend called "
					+ backendName);

		Resources resources = ResourceResolver.resolve(
				backend.config.getDefaults(), task.getResources());
		Task named = task.hasName() ? task : task.withName(backend.names
				.next());
		events.send(CREATED, backendName, named.getName(), null);
		log.debug("spawning " + named + " on " + backendName + " with "
				+ resources);
		try {
			return new TaskHandle(backendName, named.getName(),
					executor.submit(new TaskJob(backend, named, resources,
							token)));
		} catch (RejectedExecutionException e) {
			throw new IllegalStateException("engine has been closed", e);
		}
	}

	/** Runs one task while holding one of its backend's permits. */
	private class TaskJob implements Callable<List<Outcome>> {
		private final Backend backend;
		private final Task task;
		private final Resources resources;
		private final CancellationToken token;

		TaskJob(Backend backend, Task task, Resources resources,
				CancellationToken token) {
			this.backend = backend;
			this.task = task;
			this.resources = resources;
			this.token = token;
		}

		private String backendName() {
			return backend.config.getName();
		}

		@Override
		public List<Outcome> call() throws TaskRunException {
			try {
				claimPermit();
			} catch (TaskCancelledException e) {
				events.send(CANCELLED, backendName(), task.getName(), null);
				throw e;
			}
			try {
				events.send(STARTED, backendName(), task.getName(), null);
				List<Outcome> outcomes = runTask();
				events.send(COMPLETED, backendName(), task.getName(), null);
				return outcomes;
			} catch (TaskCancelledException e) {
				log.info("task " + task.getName() + " on " + backendName()
						+ " was cancelled");
				events.send(CANCELLED, backendName(), task.getName(), null);
				throw e;
			} catch (TaskRunException e) {
				log.info("task " + task.getName() + " on " + backendName()
						+ " failed: " + e.getMessage());
				events.send(FAILED, backendName(), task.getName(),
						e.getMessage());
				throw e;
			} finally {
				backend.permits.release();
			}
		}

		private void claimPermit() throws TaskCancelledException {
			try {
				while (!backend.permits.tryAcquire(PERMIT_POLL_INTERVAL,
						MILLISECONDS))
					if (token.isCancelled())
						throw new TaskCancelledException("task "
								+ task.getName()
								+ " cancelled while waiting to start");
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				throw new TaskCancelledException("task " + task.getName()
						+ " interrupted while waiting to start");
			}
		}

		private List<Outcome> runTask() throws TaskRunException {
			if (token.isCancelled())
				throw new TaskCancelledException("task " + task.getName()
						+ " cancelled before it started");
			List<Outcome> outcomes;
			try {
				outcomes = backend.runner.run(task, resources, token);
			} catch (RuntimeException e) {
				log.error("unexpected failure running " + task.getName(), e);
				throw new ExecutionFailedException("task " + task.getName()
						+ " failed unexpectedly", e);
			}
			int expected = task.getExecutions().size();
			if (outcomes == null || outcomes.size() != expected)
				throw new ResultExtractionException("expected " + expected
						+ " outcome(s) from task " + task.getName()
						+ " but got "
						+ (outcomes == null ? "none" : outcomes.size()));
			return unmodifiableList(new ArrayList<>(outcomes));
		}
	}

	/**
	 * Stop accepting tasks and release the backends. Tasks already running
	 * are left to finish.
	 */
	@Override
	public void close() {
		executor.shutdown();
		synchronized (backends) {
			for (Backend backend : backends.values()) {
				try {
					backend.runner.close();
				} catch (RuntimeException e) {
					log.warn("problem closing backend "
							+ backend.config.getName(), e);
				}
			}
		}
	}
}
