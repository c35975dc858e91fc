package uk.ac.manchester.cs.taskengine.engine;

import static java.util.Arrays.asList;
import static java.util.concurrent.TimeUnit.SECONDS;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import uk.ac.manchester.cs.taskengine.config.BackendConfig;
import uk.ac.manchester.cs.taskengine.config.GenericBackendConfig;
import uk.ac.manchester.cs.taskengine.errors.DuplicateBackendException;
import uk.ac.manchester.cs.taskengine.errors.ExecutionFailedException;
import uk.ac.manchester.cs.taskengine.errors.ResultExtractionException;
import uk.ac.manchester.cs.taskengine.errors.TaskCancelledException;
import uk.ac.manchester.cs.taskengine.errors.TaskRunException;
import uk.ac.manchester.cs.taskengine.errors.UnknownBackendException;
import uk.ac.manchester.cs.taskengine.events.TaskEvent;
import uk.ac.manchester.cs.taskengine.events.TaskEventListener;
import uk.ac.manchester.cs.taskengine.events.TaskEvents;
import uk.ac.manchester.cs.taskengine.task.CancellationToken;
import uk.ac.manchester.cs.taskengine.task.Execution;
import uk.ac.manchester.cs.taskengine.task.Outcome;
import uk.ac.manchester.cs.taskengine.task.Resources;
import uk.ac.manchester.cs.taskengine.task.Task;

public class EngineTest {
	/** A runner that holds each task until told to let go. */
	static class BlockingRunner implements Runner {
		final AtomicInteger active = new AtomicInteger();
		final AtomicInteger maxActive = new AtomicInteger();
		final AtomicInteger runs = new AtomicInteger();
		final CountDownLatch release = new CountDownLatch(1);
		final List<String> names = Collections
				.synchronizedList(new ArrayList<String>());
		final List<Resources> resources = Collections
				.synchronizedList(new ArrayList<Resources>());
		int outcomesPerTask = -1;
		RuntimeException failure;

		@Override
		public List<Outcome> run(Task task, Resources resources,
				CancellationToken token) throws TaskRunException {
			runs.incrementAndGet();
			names.add(task.getName());
			this.resources.add(resources);
			int now = active.incrementAndGet();
			synchronized (maxActive) {
				if (now > maxActive.get())
					maxActive.set(now);
			}
			try {
				release.await();
			} catch (InterruptedException e) {
				throw new TaskCancelledException("interrupted");
			} finally {
				active.decrementAndGet();
			}
			if (failure != null)
				throw failure;
			List<Outcome> outcomes = new ArrayList<>();
			int n = outcomesPerTask < 0 ? task.getExecutions().size()
					: outcomesPerTask;
			for (int i = 0; i < n; i++)
				outcomes.add(new Outcome(0, "out" + i, ""));
			return outcomes;
		}

		@Override
		public void close() {
		}
	}

	private BlockingRunner runner;
	private Engine engine;

	@Before
	public void setUp() {
		runner = new BlockingRunner();
		engine = new Engine(new RunnerFactory() {
			@Override
			public Runner createRunner(BackendConfig config, TaskEvents events) {
				return runner;
			}
		});
	}

	@After
	public void tearDown() {
		runner.release.countDown();
		engine.close();
	}

	private static BackendConfig backend(String name, int maxTasks) {
		GenericBackendConfig config = new GenericBackendConfig();
		config.setName(name);
		config.setMaxTasks(maxTasks);
		config.setSubmit("~{command}");
		return config;
	}

	private static Task task(String name) {
		return Task.builder().name(name)
				.execution(Execution.builder("ubuntu", "true").build())
				.build();
	}

	private void waitForActive(int count) throws InterruptedException {
		for (int i = 0; i < 500 && runner.active.get() < count; i++)
			Thread.sleep(10);
		assertEquals(count, runner.active.get());
	}

	@Test
	public void neverRunsMoreThanMaxTasksAtOnce() throws Exception {
		engine.register(backend("capped", 2));
		List<TaskHandle> handles = new ArrayList<>();
		for (int i = 0; i < 5; i++)
			handles.add(engine.spawn("capped", task("t" + i),
					new CancellationToken()));
		waitForActive(2);
		Thread.sleep(200);
		assertEquals(2, runner.active.get());
		assertEquals(2, runner.runs.get());

		runner.release.countDown();
		for (TaskHandle handle : handles)
			assertEquals(1, handle.await(10, SECONDS).size());
		assertEquals(2, runner.maxActive.get());
		assertEquals(5, runner.runs.get());
	}

	@Test
	public void listsBackendsInRegistrationOrder() throws Exception {
		engine.register(backend("b", 1));
		engine.register(backend("a", 1));
		assertEquals(asList("b", "a"), engine.runners());
	}

	@Test(expected = DuplicateBackendException.class)
	public void rejectsDuplicateBackend() throws Exception {
		engine.register(backend("dup", 1));
		engine.register(backend("dup", 3));
	}

	@Test(expected = UnknownBackendException.class)
	public void rejectsUnknownBackend() throws Exception {
		engine.register(backend("known", 1));
		engine.spawn("unknown", task("x"), new CancellationToken());
	}

	@Test
	public void cancelWhileWaitingForPermit() throws Exception {
		engine.register(backend("single", 1));
		TaskHandle first = engine.spawn("single", task("first"),
				new CancellationToken());
		waitForActive(1);
		CancellationToken token = new CancellationToken();
		TaskHandle second = engine.spawn("single", task("second"), token);
		token.cancel();
		try {
			second.await(10, SECONDS);
			fail("second task should have been cancelled");
		} catch (TaskCancelledException e) {
			// expected
		}
		runner.release.countDown();
		first.await(10, SECONDS);
		assertEquals(1, runner.runs.get());
	}

	@Test
	public void namesUnnamedTasks() throws Exception {
		engine.register(backend("naming", 1));
		runner.release.countDown();
		Task unnamed = Task.builder()
				.execution(Execution.builder("ubuntu", "true").build())
				.build();
		TaskHandle handle = engine.spawn("naming", unnamed,
				new CancellationToken());
		handle.await(10, SECONDS);
		assertEquals(12, handle.getTaskName().length());
		assertEquals(handle.getTaskName(), runner.names.get(0));
	}

	@Test
	public void resolvesResourcesBeforeRunning() throws Exception {
		BackendConfig config = backend("res", 1);
		config.setDefaults(Resources.builder().ram(32.0).build());
		engine.register(config);
		runner.release.countDown();
		Task t = Task.builder()
				.execution(Execution.builder("ubuntu", "true").build())
				.resources(Resources.builder().cpu(3.0).build()).build();
		engine.spawn("res", t, new CancellationToken()).await(10, SECONDS);
		Resources used = runner.resources.get(0);
		assertEquals(Double.valueOf(3), used.getCpu());
		assertEquals(Double.valueOf(32), used.getRam());
		assertEquals(Double.valueOf(8), used.getDisk());
	}

	@Test(expected = ResultExtractionException.class)
	public void wrongNumberOfOutcomesIsAnExtractionFailure() throws Exception {
		engine.register(backend("short", 1));
		runner.outcomesPerTask = 0;
		runner.release.countDown();
		engine.spawn("short", task("t"), new CancellationToken()).await(10,
				SECONDS);
	}

	@Test
	public void unexpectedRunnerFailureIsClassified() throws Exception {
		engine.register(backend("broken", 1));
		runner.failure = new IllegalStateException("boom");
		runner.release.countDown();
		try {
			engine.spawn("broken", task("t"), new CancellationToken()).await(
					10, SECONDS);
			fail("should have failed");
		} catch (ExecutionFailedException e) {
			assertTrue(e.getCause() instanceof IllegalStateException);
		}
		// The permit came back
		runner.failure = null;
		engine.spawn("broken", task("u"), new CancellationToken()).await(10,
				SECONDS);
	}

	@Test
	public void sendsLifecycleEvents() throws Exception {
		final List<TaskEvent.Type> types = Collections
				.synchronizedList(new ArrayList<TaskEvent.Type>());
		engine.addListener(new TaskEventListener() {
			@Override
			public void taskEvent(TaskEvent event) {
				if (event.getTaskName().equals("watched"))
					types.add(event.getType());
			}
		});
		engine.register(backend("events", 1));
		runner.release.countDown();
		engine.spawn("events", task("watched"), new CancellationToken())
				.await(10, SECONDS);
		assertEquals(asList(TaskEvent.Type.CREATED, TaskEvent.Type.STARTED,
				TaskEvent.Type.COMPLETED), types);
	}
}
