package uk.ac.manchester.cs.taskengine.runner.tes;

import static org.slf4j.LoggerFactory.getLogger;
import static uk.ac.manchester.cs.taskengine.events.TaskEvent.Type.STDERR;
import static uk.ac.manchester.cs.taskengine.events.TaskEvent.Type.STDOUT;
import static uk.ac.manchester.cs.taskengine.rest.utils.RestClientUtils.createBasicClient;
import static uk.ac.manchester.cs.taskengine.rest.utils.RestClientUtils.createBearerClient;
import static uk.ac.manchester.cs.taskengine.rest.utils.RestClientUtils.createUnauthenticatedClient;
import static uk.ac.manchester.cs.taskengine.tes.rest.TaskExecutionService.FULL;

import java.util.ArrayList;
import java.util.List;

import javax.ws.rs.ProcessingException;
import javax.ws.rs.WebApplicationException;

import org.slf4j.Logger;

import uk.ac.manchester.cs.taskengine.config.TesBackendConfig;
import uk.ac.manchester.cs.taskengine.engine.Runner;
import uk.ac.manchester.cs.taskengine.errors.BackendInitException;
import uk.ac.manchester.cs.taskengine.errors.ConnectivityException;
import uk.ac.manchester.cs.taskengine.errors.ExecutionFailedException;
import uk.ac.manchester.cs.taskengine.errors.PollException;
import uk.ac.manchester.cs.taskengine.errors.ResultExtractionException;
import uk.ac.manchester.cs.taskengine.errors.SubmitException;
import uk.ac.manchester.cs.taskengine.errors.TaskCancelledException;
import uk.ac.manchester.cs.taskengine.errors.TaskRunException;
import uk.ac.manchester.cs.taskengine.events.TaskEvents;
import uk.ac.manchester.cs.taskengine.events.TaskEvents.Emitter;
import uk.ac.manchester.cs.taskengine.task.CancellationToken;
import uk.ac.manchester.cs.taskengine.task.Outcome;
import uk.ac.manchester.cs.taskengine.task.Resources;
import uk.ac.manchester.cs.taskengine.task.Task;
import uk.ac.manchester.cs.taskengine.tes.model.CreateTaskResponse;
import uk.ac.manchester.cs.taskengine.tes.model.ServiceInfo;
import uk.ac.manchester.cs.taskengine.tes.model.TesExecutorLog;
import uk.ac.manchester.cs.taskengine.tes.model.TesState;
import uk.ac.manchester.cs.taskengine.tes.model.TesTask;
import uk.ac.manchester.cs.taskengine.tes.model.TesTaskLog;
import uk.ac.manchester.cs.taskengine.tes.rest.TaskExecutionService;

/**
 * Hands tasks to a Task Execution Service and polls them until the service
 * says they are finished.
 */
public class TesRunner implements Runner {
	private final Logger log = getLogger(getClass());
	private final TesBackendConfig config;
	private final TaskExecutionService service;
	private final TaskEvents events;

	/**
	 * Build a runner for the configured service, checking that it answers.
	 */
	public static TesRunner connect(TesBackendConfig config, TaskEvents events)
			throws BackendInitException {
		config.validate();
		TaskExecutionService service;
		switch (config.getAuthType()) {
		case BASIC:
			service = createBasicClient(config.getUrl(), config.getUsername(),
					config.getPassword(), config.getRetries(),
					TaskExecutionService.class);
			break;
		case BEARER:
			service = createBearerClient(config.getUrl(), config.getToken(),
					config.getRetries(), TaskExecutionService.class);
			break;
		default:
			service = createUnauthenticatedClient(config.getUrl(),
					config.getRetries(), TaskExecutionService.class);
			break;
		}
		TesRunner runner = new TesRunner(config, service, events);
		runner.checkService();
		return runner;
	}

	public TesRunner(TesBackendConfig config, TaskExecutionService service,
			TaskEvents events) {
		this.config = config;
		this.service = service;
		this.events = events;
	}

	void checkService() throws BackendInitException {
		try {
			ServiceInfo info = service.getServiceInfo();
			log.info("backend " + config.getName() + " uses TES at "
					+ config.getUrl()
					+ (info == null || info.getName() == null ? "" : " ("
							+ info.getName() + ")"));
		} catch (WebApplicationException | ProcessingException e) {
			throw new BackendInitException("backend " + config.getName()
					+ ": cannot reach TES at " + config.getUrl(), e);
		}
	}

	@Override
	public List<Outcome> run(Task task, Resources resources,
			CancellationToken token) throws TaskRunException {
		TesTask request = TesTaskConverter.convert(task, resources);
		if (token.isCancelled())
			throw new TaskCancelledException("task " + task.getName()
					+ " cancelled before submission");
		String id;
		try {
			CreateTaskResponse response = service.createTask(request);
			id = response == null ? null : response.getId();
		} catch (WebApplicationException e) {
			throw new SubmitException("TES refused task " + task.getName(), e);
		} catch (ProcessingException e) {
			throw new ConnectivityException("cannot reach TES at "
					+ config.getUrl(), e);
		}
		if (id == null)
			throw new SubmitException("TES gave no id for task "
					+ task.getName());
		log.info("task " + task.getName() + " submitted to TES as " + id);

		TesTask finished = poll(task, id, token);
		List<Outcome> outcomes = outcomes(task, id, finished);
		Emitter emitter = events.forTask(config.getName(), task.getName());
		if (emitter.isListening())
			for (Outcome outcome : outcomes) {
				emitter.send(STDOUT, outcome.getStdoutText());
				emitter.send(STDERR, outcome.getStderrText());
			}
		return outcomes;
	}

	/**
	 * Polls until the service reports a terminal state. Cancellation is
	 * requested once and then the service is left to confirm it.
	 */
	private TesTask poll(Task task, String id, CancellationToken token)
			throws TaskRunException {
		TaskCancelledException cancelled = null;
		while (true) {
			if (cancelled == null && token.isCancelled()) {
				cancelled = new TaskCancelledException("task "
						+ task.getName() + " (TES " + id + ") was cancelled");
				log.info("cancelling TES task " + id);
				try {
					service.cancelTask(id);
				} catch (WebApplicationException | ProcessingException e) {
					log.warn("failed to cancel TES task " + id, e);
					throw cancelled.withTeardownFailure(e);
				}
			}
			TesTask current;
			try {
				current = service.getTask(id, FULL);
			} catch (WebApplicationException | ProcessingException e) {
				if (cancelled != null)
					throw cancelled.withTeardownFailure(e);
				throw new PollException("failed to get state of TES task "
						+ id, e);
			}
			TesState state = current == null ? null : current.getState();
			if (state != null && state.isTerminal()) {
				log.debug("TES task " + id + " finished: " + state);
				if (cancelled != null)
					throw cancelled;
				if (state == TesState.CANCELED || state == TesState.PREEMPTED)
					throw new TaskCancelledException("task " + task.getName()
							+ " (TES " + id + ") was " + state
							+ " by the service");
				return current;
			}
			log.debug("TES task " + id + " is " + state);
			if (cancelled == null) {
				token.await(config.getPollInterval());
				continue;
			}
			try {
				Thread.sleep(config.getPollInterval());
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				throw cancelled.withTeardownFailure(e);
			}
		}
	}

	/**
	 * Reads the outcome of each executor from the last attempt's logs. A
	 * system error only fails the task when it left no executor logs.
	 */
	private List<Outcome> outcomes(Task task, String id, TesTask finished)
			throws TaskRunException {
		int expected = task.getExecutions().size();
		boolean systemError = finished.getState() == TesState.SYSTEM_ERROR;
		List<TesTaskLog> attempts = finished.getLogs();
		List<TesExecutorLog> logs = attempts == null || attempts.isEmpty() ? null
				: attempts.get(attempts.size() - 1).getLogs();
		if (systemError && (logs == null || logs.size() < expected))
			throw new ExecutionFailedException("TES task " + id
					+ " failed with a system error"
					+ systemLogs(attempts));
		if (attempts == null || attempts.isEmpty())
			throw new ResultExtractionException("TES task " + id
					+ " (" + finished.getState() + ") has no logs");
		if (systemError)
			log.warn("TES task " + id + " ended with a system error"
					+ systemLogs(attempts));
		if (logs == null || logs.size() < expected)
			throw new ResultExtractionException("TES task " + id + " has "
					+ (logs == null ? 0 : logs.size())
					+ " executor logs, but " + expected + " were expected");
		List<Outcome> outcomes = new ArrayList<>();
		for (int i = 0; i < expected; i++) {
			TesExecutorLog entry = logs.get(i);
			if (entry == null || entry.getExitCode() == null)
				throw new ResultExtractionException("TES task " + id
						+ " has no exit code for executor " + i);
			outcomes.add(new Outcome(entry.getExitCode(),
					nonNull(entry.getStdout()), nonNull(entry.getStderr())));
		}
		return outcomes;
	}

	private static String nonNull(String s) {
		return s == null ? "" : s;
	}

	private static String systemLogs(List<TesTaskLog> attempts) {
		if (attempts == null || attempts.isEmpty())
			return "";
		List<String> logs = attempts.get(attempts.size() - 1).getSystemLogs();
		if (logs == null || logs.isEmpty())
			return "";
		return ": " + String.join("; ", logs);
	}

	@Override
	public void close() {
		// The proxy's connections are pooled and need no closing
	}
}
