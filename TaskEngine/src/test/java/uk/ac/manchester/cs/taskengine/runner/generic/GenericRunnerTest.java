package uk.ac.manchester.cs.taskengine.runner.generic;

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.junit.Assume.assumeTrue;

import java.io.File;
import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.junit.Test;

import uk.ac.manchester.cs.taskengine.config.GenericBackendConfig;
import uk.ac.manchester.cs.taskengine.config.GenericBackendConfig.Shell;
import uk.ac.manchester.cs.taskengine.engine.ResourceResolver;
import uk.ac.manchester.cs.taskengine.errors.BackendInitException;
import uk.ac.manchester.cs.taskengine.errors.MonitorException;
import uk.ac.manchester.cs.taskengine.errors.SubmitException;
import uk.ac.manchester.cs.taskengine.errors.TaskCancelledException;
import uk.ac.manchester.cs.taskengine.events.TaskEvents;
import uk.ac.manchester.cs.taskengine.task.CancellationToken;
import uk.ac.manchester.cs.taskengine.task.Execution;
import uk.ac.manchester.cs.taskengine.task.Outcome;
import uk.ac.manchester.cs.taskengine.task.Resources;
import uk.ac.manchester.cs.taskengine.task.Task;

public class GenericRunnerTest {
	/**
	 * Answers commands from a script, by the first word of the command, and
	 * remembers what it was asked to run.
	 */
	static class ScriptedDriver implements CommandDriver {
		final List<String> commands = Collections
				.synchronizedList(new ArrayList<String>());
		final Deque<CommandOutput> monitorReplies = new ArrayDeque<>();
		CommandOutput submitReply = new CommandOutput(0, "JOB-42\n", "");
		CommandOutput killReply = new CommandOutput(0, "", "");
		IOException monitorFailure;

		@Override
		public CommandOutput run(String command) throws IOException {
			commands.add(command);
			if (command.startsWith("submit"))
				return submitReply;
			if (command.startsWith("kill"))
				return killReply;
			if (monitorFailure != null)
				throw monitorFailure;
			synchronized (monitorReplies) {
				if (monitorReplies.isEmpty())
					return new CommandOutput(0, "running", "");
				return monitorReplies.removeFirst();
			}
		}

		int count(String prefix) {
			int n = 0;
			synchronized (commands) {
				for (String c : commands)
					if (c.startsWith(prefix))
						n++;
			}
			return n;
		}

		@Override
		public void close() {
		}
	}

	private static GenericBackendConfig config() {
		GenericBackendConfig config = new GenericBackendConfig();
		config.setName("hpc");
		config.setMaxTasks(1);
		config.setSubmit("submit ~{command} --cpus ~{cpu} --mem ~{ram_mb} ~{site}");
		config.setMonitor("monitor ~{job_id}");
		config.setKill("kill ~{job_id}");
		config.setJobIdRegex("JOB-(\\d+)");
		config.setMonitorInterval(20);
		config.getAttributes().put("site", "manchester");
		return config;
	}

	private static Task task() {
		return Task.builder().name("job")
				.execution(Execution.builder("ignored", "echo")
						.args("hello world").build()).build();
	}

	private static Resources resources() {
		return ResourceResolver.resolve(null, null);
	}

	@Test
	public void monitorsUntilNonZeroAndReturnsMonitorOutput()
			throws Exception {
		ScriptedDriver driver = new ScriptedDriver();
		driver.monitorReplies.add(new CommandOutput(0, "running", ""));
		driver.monitorReplies.add(new CommandOutput(0, "running", ""));
		driver.monitorReplies.add(new CommandOutput(0, "running", ""));
		driver.monitorReplies.add(new CommandOutput(1, "done", "finished"));
		GenericRunner runner = new GenericRunner(config(), driver,
				new TaskEvents());

		long start = System.currentTimeMillis();
		List<Outcome> outcomes = runner.run(task(), resources(),
				new CancellationToken());
		long elapsed = System.currentTimeMillis() - start;

		assertEquals(4, driver.count("monitor"));
		assertEquals("monitor 42", driver.commands.get(1));
		assertEquals(1, outcomes.size());
		assertEquals(1, outcomes.get(0).getStatus());
		assertEquals("done", outcomes.get(0).getStdoutText());
		assertEquals("finished", outcomes.get(0).getStderrText());
		assertTrue("interval not honoured: " + elapsed, elapsed >= 3 * 20);
		assertEquals(0, driver.count("kill"));
	}

	@Test
	public void substitutesTaskValuesAndAttributes() throws Exception {
		ScriptedDriver driver = new ScriptedDriver();
		driver.monitorReplies.add(new CommandOutput(3, "", ""));
		GenericRunner runner = new GenericRunner(config(), driver,
				new TaskEvents());
		runner.run(task(), resources(), new CancellationToken());
		assertEquals(
				"submit echo 'hello world' --cpus 1 --mem 2048 manchester",
				driver.commands.get(0));
	}

	@Test
	public void synchronousWithoutJobIdPattern() throws Exception {
		ScriptedDriver driver = new ScriptedDriver();
		driver.submitReply = new CommandOutput(7, "all done", "");
		GenericBackendConfig config = config();
		config.setJobIdRegex(null);
		GenericRunner runner = new GenericRunner(config, driver,
				new TaskEvents());
		List<Outcome> outcomes = runner.run(task(), resources(),
				new CancellationToken());
		assertEquals(7, outcomes.get(0).getStatus());
		assertEquals("all done", outcomes.get(0).getStdoutText());
		assertEquals(1, driver.commands.size());
	}

	@Test
	public void oneOutcomePerExecutionInOrder() throws Exception {
		ScriptedDriver driver = new ScriptedDriver();
		driver.monitorReplies.add(new CommandOutput(1, "first", ""));
		driver.monitorReplies.add(new CommandOutput(2, "second", ""));
		GenericRunner runner = new GenericRunner(config(), driver,
				new TaskEvents());
		Task task = Task.builder().name("two")
				.execution(Execution.builder("x", "a").build())
				.execution(Execution.builder("x", "b").build()).build();
		List<Outcome> outcomes = runner.run(task, resources(),
				new CancellationToken());
		assertEquals(2, outcomes.size());
		assertEquals("first", outcomes.get(0).getStdoutText());
		assertEquals("second", outcomes.get(1).getStdoutText());
	}

	@Test(expected = SubmitException.class)
	public void noJobIdIsASubmitFailure() throws Exception {
		ScriptedDriver driver = new ScriptedDriver();
		driver.submitReply = new CommandOutput(0, "queue is full", "");
		new GenericRunner(config(), driver, new TaskEvents()).run(task(),
				resources(), new CancellationToken());
	}

	@Test(expected = MonitorException.class)
	public void monitorThatCannotRunIsAMonitorFailure() throws Exception {
		ScriptedDriver driver = new ScriptedDriver();
		driver.monitorFailure = new IOException("connection lost");
		new GenericRunner(config(), driver, new TaskEvents()).run(task(),
				resources(), new CancellationToken());
	}

	@Test
	public void cancellationKillsTheJobExactlyOnce() throws Exception {
		final ScriptedDriver driver = new ScriptedDriver();
		final GenericRunner runner = new GenericRunner(config(), driver,
				new TaskEvents());
		final CancellationToken token = new CancellationToken();
		ExecutorService executor = Executors.newSingleThreadExecutor();
		try {
			Future<List<Outcome>> result = executor
					.submit(new Callable<List<Outcome>>() {
						@Override
						public List<Outcome> call() throws Exception {
							return runner.run(task(), resources(), token);
						}
					});
			for (int i = 0; i < 500 && driver.count("monitor") < 2; i++)
				Thread.sleep(10);
			token.cancel();
			try {
				result.get(10, SECONDS);
				fail("should have been cancelled");
			} catch (java.util.concurrent.ExecutionException e) {
				assertTrue(e.getCause() instanceof TaskCancelledException);
			}
		} finally {
			executor.shutdownNow();
		}
		assertEquals(1, driver.count("kill"));
		assertTrue(driver.commands.contains("kill 42"));
	}

	@Test
	public void failedKillIsAttachedToCancellation() throws Exception {
		final CancellationToken token = new CancellationToken();
		ScriptedDriver driver = new ScriptedDriver() {
			@Override
			public CommandOutput run(String command) throws IOException {
				if (command.startsWith("monitor"))
					token.cancel();
				return super.run(command);
			}
		};
		driver.killReply = new CommandOutput(1, "", "no such job");
		GenericRunner runner = new GenericRunner(config(), driver,
				new TaskEvents());
		try {
			runner.run(task(), resources(), token);
			fail("should have been cancelled");
		} catch (TaskCancelledException e) {
			assertEquals(1, e.getSuppressed().length);
			assertTrue(e.getSuppressed()[0].getMessage().contains(
					"no such job"));
		}
		assertEquals(1, driver.count("kill"));
	}

	@Test
	public void cancelledBeforeSubmissionRunsNothing() throws Exception {
		ScriptedDriver driver = new ScriptedDriver();
		CancellationToken token = new CancellationToken();
		token.cancel();
		try {
			new GenericRunner(config(), driver, new TaskEvents()).run(task(),
					resources(), token);
			fail("should have been cancelled");
		} catch (TaskCancelledException e) {
			assertEquals(0, e.getSuppressed().length);
		}
		assertTrue(driver.commands.isEmpty());
	}

	@Test(expected = BackendInitException.class)
	public void patternWithoutGroupIsRejected() throws Exception {
		GenericBackendConfig config = config();
		config.setJobIdRegex("JOB-\\d+");
		new GenericRunner(config, new ScriptedDriver(), new TaskEvents());
	}

	@Test
	public void numbersLoseNeedlessDecimals() throws Exception {
		assertEquals("2", GenericRunner.format(2.0));
		assertEquals("2.5", GenericRunner.format(2.5));
		assertEquals("2048", GenericRunner.format(2.0 * 1024));
		Map<String, String> values = new GenericRunner(config(),
				new ScriptedDriver(), new TaskEvents()).taskValues(task(),
				resources());
		assertEquals("8192", values.get("disk_mb"));
		assertEquals("false", values.get("preemptible"));
		assertEquals("job", values.get("task_name"));
		assertFalse(values.containsKey("cpu_limit"));
	}

	@Test
	public void endToEndWithLocalShell() throws Exception {
		assumeTrue(new File("/bin/sh").canExecute());
		GenericBackendConfig config = config();
		config.setShell(Shell.SH);
		config.setSubmit("echo JOB-42");
		config.setMonitor("echo done; exit 1");
		config.setKill("true");
		GenericRunner runner = new GenericRunner(config, new LocalDriver(
				Shell.SH), new TaskEvents());
		List<Outcome> outcomes = runner.run(task(), resources(),
				new CancellationToken());
		assertEquals(1, outcomes.get(0).getStatus());
		assertEquals("done\n", outcomes.get(0).getStdoutText());
	}

	@Test
	public void localDriverCapturesBothStreams() throws Exception {
		assumeTrue(new File("/bin/sh").canExecute());
		CommandOutput output = new LocalDriver(Shell.SH)
				.run("echo out; echo err >&2; exit 3");
		assertEquals(3, output.getExitCode());
		assertEquals("out\n", output.getStdoutText());
		assertEquals("err\n", new String(output.getStderr(), "UTF-8"));
	}
}
