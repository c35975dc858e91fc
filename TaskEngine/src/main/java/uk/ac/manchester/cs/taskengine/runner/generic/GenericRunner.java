package uk.ac.manchester.cs.taskengine.runner.generic;

import static org.slf4j.LoggerFactory.getLogger;
import static uk.ac.manchester.cs.taskengine.events.TaskEvent.Type.STDERR;
import static uk.ac.manchester.cs.taskengine.events.TaskEvent.Type.STDOUT;
import static uk.ac.manchester.cs.taskengine.runner.generic.PlaceholderSubstitution.substitute;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;

import uk.ac.manchester.cs.taskengine.config.GenericBackendConfig;
import uk.ac.manchester.cs.taskengine.config.GenericBackendConfig.CommandLocale;
import uk.ac.manchester.cs.taskengine.engine.Runner;
import uk.ac.manchester.cs.taskengine.errors.BackendInitException;
import uk.ac.manchester.cs.taskengine.errors.MonitorException;
import uk.ac.manchester.cs.taskengine.errors.SubmitException;
import uk.ac.manchester.cs.taskengine.errors.TaskCancelledException;
import uk.ac.manchester.cs.taskengine.errors.TaskRunException;
import uk.ac.manchester.cs.taskengine.events.TaskEvents;
import uk.ac.manchester.cs.taskengine.events.TaskEvents.Emitter;
import uk.ac.manchester.cs.taskengine.task.CancellationToken;
import uk.ac.manchester.cs.taskengine.task.Execution;
import uk.ac.manchester.cs.taskengine.task.Outcome;
import uk.ac.manchester.cs.taskengine.task.Resources;
import uk.ac.manchester.cs.taskengine.task.Task;

/**
 * Runs tasks through configured submit, monitor and kill commands.
 * <p>
 * Each execution is submitted in turn. Without a job id pattern the submit
 * command does all the work and its output is the execution's outcome. With
 * one, the job id is picked out of the submit command's output and the
 * monitor command is run until it exits non-zero; the outcome is then the
 * output of that <em>last monitor command</em>, not of the job itself.
 */
public class GenericRunner implements Runner {
	private final Logger log = getLogger(getClass());
	private final GenericBackendConfig config;
	private final CommandDriver driver;
	private final TaskEvents events;
	private final Pattern jobIdPattern;

	/**
	 * Build a runner, connecting to the configured SSH host if there is one.
	 */
	public static GenericRunner create(GenericBackendConfig config,
			TaskEvents events) throws BackendInitException {
		config.validate();
		CommandDriver driver;
		if (config.getLocale() == CommandLocale.SSH)
			driver = new SshDriver(config);
		else
			driver = new LocalDriver(config.getShell());
		return new GenericRunner(config, driver, events);
	}

	public GenericRunner(GenericBackendConfig config, CommandDriver driver,
			TaskEvents events) throws BackendInitException {
		this.config = config;
		this.driver = driver;
		this.events = events;
		this.jobIdPattern = config.compileJobIdRegex();
	}

	/** Formats a number without a needless trailing <tt>.0</tt>. */
	static String format(Double value) {
		return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
	}

	/**
	 * The placeholder values common to every command of a task. Task values
	 * hide configured attributes of the same name.
	 */
	Map<String, String> taskValues(Task task, Resources resources) {
		Map<String, String> values = new HashMap<>(config.getAttributes());
		values.put("task_name", task.getName());
		if (resources.getCpu() != null)
			values.put("cpu", format(resources.getCpu()));
		if (resources.getCpuLimit() != null)
			values.put("cpu_limit", format(resources.getCpuLimit()));
		if (resources.getRam() != null) {
			values.put("ram", format(resources.getRam()));
			values.put("ram_mb", format(resources.getRam() * 1024));
		}
		if (resources.getRamLimit() != null)
			values.put("ram_limit", format(resources.getRamLimit()));
		if (resources.getDisk() != null) {
			values.put("disk", format(resources.getDisk()));
			values.put("disk_mb", format(resources.getDisk() * 1024));
		}
		if (resources.getPreemptible() != null)
			values.put("preemptible", resources.getPreemptible().toString());
		return values;
	}

	@Override
	public List<Outcome> run(Task task, Resources resources,
			CancellationToken token) throws TaskRunException {
		Emitter emitter = events.forTask(config.getName(), task.getName());
		Map<String, String> common = taskValues(task, resources);
		List<Outcome> outcomes = new ArrayList<>();
		for (Execution execution : task.getExecutions()) {
			if (token.isCancelled())
				throw new TaskCancelledException("task " + task.getName()
						+ " cancelled before submission");
			warnAboutIgnored(execution);
			Map<String, String> values = new HashMap<>(common);
			values.put("command", ShellQuoting.join(execution.getCommandLine()));
			if (execution.getWorkDir() != null)
				values.put("cwd", execution.getWorkDir());
			Outcome outcome = runExecution(task, values, token);
			if (emitter.isListening()) {
				emitter.send(STDOUT, outcome.getStdoutText());
				emitter.send(STDERR, outcome.getStderrText());
			}
			outcomes.add(outcome);
		}
		return outcomes;
	}

	private void warnAboutIgnored(Execution execution) {
		log.warn("backend " + config.getName()
				+ " does not use images; ignoring image "
				+ execution.getImage());
		if (execution.getStdin() != null || execution.getStdout() != null
				|| execution.getStderr() != null)
			log.warn("backend " + config.getName()
					+ " ignores stream redirection of executions");
	}

	private Outcome runExecution(Task task, Map<String, String> values,
			CancellationToken token) throws TaskRunException {
		String submit = substitute(config.getSubmit(), values);
		CommandOutput submitted;
		try {
			submitted = driver.run(submit);
		} catch (IOException e) {
			throw new SubmitException("failed to run submit command for task "
					+ task.getName(), e);
		}
		if (jobIdPattern == null) {
			log.debug("task " + task.getName() + " ran synchronously: "
					+ submitted);
			return submitted.toOutcome();
		}

		Matcher m = jobIdPattern.matcher(submitted.getStdoutText());
		if (!m.find() || m.group(1) == null)
			throw new SubmitException("no job id matching "
					+ jobIdPattern.pattern() + " in output of submit command: "
					+ submitted.getStdoutText().trim());
		String jobId = m.group(1);
		values.put("job_id", jobId);
		log.info("task " + task.getName() + " submitted as job " + jobId);
		return monitor(task, jobId, values, token);
	}

	private Outcome monitor(Task task, String jobId,
			Map<String, String> values, CancellationToken token)
			throws TaskRunException {
		String monitor = substitute(config.getMonitor(), values);
		while (true) {
			if (token.isCancelled())
				throw kill(task, jobId, values);
			CommandOutput status;
			try {
				status = driver.run(monitor);
			} catch (IOException e) {
				throw new MonitorException("failed to run monitor command for job "
						+ jobId, e);
			}
			if (status.getExitCode() != 0) {
				log.info("job " + jobId + " of task " + task.getName()
						+ " finished (monitor exit code "
						+ status.getExitCode() + ")");
				return status.toOutcome();
			}
			log.debug("job " + jobId + " is still running");
			if (token.await(config.getMonitorInterval()))
				throw kill(task, jobId, values);
		}
	}

	private TaskCancelledException kill(Task task, String jobId,
			Map<String, String> values) {
		TaskCancelledException cancelled = new TaskCancelledException("task "
				+ task.getName() + " (job " + jobId + ") was cancelled");
		String kill = substitute(config.getKill(), values);
		log.info("killing job " + jobId);
		try {
			CommandOutput output = driver.run(kill);
			if (output.getExitCode() != 0)
				cancelled.withTeardownFailure(new IOException("kill command for job "
						+ jobId + " exited with status " + output.getExitCode()
						+ ": " + new String(output.getStderr(),
								StandardCharsets.UTF_8).trim()));
		} catch (IOException e) {
			log.warn("failed to kill job " + jobId, e);
			cancelled.withTeardownFailure(e);
		}
		return cancelled;
	}

	@Override
	public void close() {
		driver.close();
	}
}
