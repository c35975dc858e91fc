package uk.ac.manchester.cs.taskengine.runner.docker;

import static java.util.Arrays.asList;
import static java.util.concurrent.TimeUnit.SECONDS;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.junit.Before;
import org.junit.Test;

import uk.ac.manchester.cs.taskengine.config.DockerBackendConfig;
import uk.ac.manchester.cs.taskengine.docker.ContainerSpec;
import uk.ac.manchester.cs.taskengine.docker.DaemonMode;
import uk.ac.manchester.cs.taskengine.docker.Mount;
import uk.ac.manchester.cs.taskengine.docker.ServiceSpec;
import uk.ac.manchester.cs.taskengine.docker.ServiceTaskStatus;
import uk.ac.manchester.cs.taskengine.engine.ResourceResolver;
import uk.ac.manchester.cs.taskengine.errors.ExecutionFailedException;
import uk.ac.manchester.cs.taskengine.errors.ImageUnavailableException;
import uk.ac.manchester.cs.taskengine.errors.NameConflictException;
import uk.ac.manchester.cs.taskengine.errors.SubmitException;
import uk.ac.manchester.cs.taskengine.errors.TaskCancelledException;
import uk.ac.manchester.cs.taskengine.events.TaskEvent;
import uk.ac.manchester.cs.taskengine.events.TaskEventListener;
import uk.ac.manchester.cs.taskengine.events.TaskEvents;
import uk.ac.manchester.cs.taskengine.task.CancellationToken;
import uk.ac.manchester.cs.taskengine.task.Contents;
import uk.ac.manchester.cs.taskengine.task.Execution;
import uk.ac.manchester.cs.taskengine.task.Input;
import uk.ac.manchester.cs.taskengine.task.Outcome;
import uk.ac.manchester.cs.taskengine.task.Resources;
import uk.ac.manchester.cs.taskengine.task.Task;

public class ContainerRunnerTest {
	private FakeContainerEngine docker;
	private DockerBackendConfig config;
	private TaskEvents events;

	@Before
	public void setUp() {
		docker = new FakeContainerEngine();
		config = new DockerBackendConfig();
		config.setName("docker");
		config.setMaxTasks(2);
		events = new TaskEvents();
	}

	private ContainerRunner runner() {
		return new ContainerRunner(config, docker, events);
	}

	private static Task echo(String name) {
		return Task.builder().name(name)
				.execution(Execution.builder("alpine:latest", "echo")
						.args("hello").build()).build();
	}

	private static Resources resources() {
		return ResourceResolver.resolve(null, null);
	}

	@Test
	public void echoHelloAndCleanUp() throws Exception {
		final List<TaskEvent.Type> seen = new ArrayList<>();
		events.addListener(new TaskEventListener() {
			@Override
			public void taskEvent(TaskEvent event) {
				seen.add(event.getType());
			}
		});
		List<Outcome> outcomes = runner().run(echo("greeter"), resources(),
				new CancellationToken());
		assertEquals(1, outcomes.size());
		assertTrue(outcomes.get(0).isSuccess());
		assertEquals("hello\n", outcomes.get(0).getStdoutText());
		assertEquals(asList("alpine:latest"), docker.pulled);
		assertEquals(1, docker.removals.size());
		assertFalse(docker.existing.contains("greeter"));
		assertEquals(asList(TaskEvent.Type.CONTAINER_CREATED,
				TaskEvent.Type.STDOUT, TaskEvent.Type.CONTAINER_EXITED), seen);
	}

	@Test
	public void keepsContainerWithoutCleanup() throws Exception {
		config.setCleanup(false);
		docker.images.add("alpine:latest");
		runner().run(echo("kept"), resources(), new CancellationToken());
		assertTrue(docker.removals.isEmpty());
		assertTrue(docker.pulled.isEmpty());
	}

	@Test
	public void nonZeroExitIsAnOutcome() throws Exception {
		docker.exitCode = 2;
		List<Outcome> outcomes = runner().run(echo("fails"), resources(),
				new CancellationToken());
		assertEquals(2, outcomes.get(0).getStatus());
		assertFalse(outcomes.get(0).isSuccess());
	}

	@Test
	public void stepsRunInOrderUnderIndexedNames() throws Exception {
		Task task = Task.builder().name("multi")
				.execution(Execution.builder("alpine", "echo").args("one").build())
				.execution(Execution.builder("alpine", "echo").args("two").build())
				.build();
		List<Outcome> outcomes = runner().run(task, resources(),
				new CancellationToken());
		assertEquals("one\n", outcomes.get(0).getStdoutText());
		assertEquals("two\n", outcomes.get(1).getStdoutText());
		assertEquals("multi-0", docker.created.get(0).getName());
		assertEquals("multi-1", docker.created.get(1).getName());
		assertEquals(1, docker.pulled.size());
	}

	@Test
	public void mapsLimitsAndMountsInputs() throws Exception {
		Task task = Task.builder()
				.name("inputs")
				.execution(Execution.builder("alpine", "cat").args("/in/a").build())
				.input(new Input("/in/a", Contents.literal("text"
						.getBytes(StandardCharsets.UTF_8))))
				.input(new Input("/in/b", Contents.url(java.net.URI
						.create("https://example.org/b"))))
				.volumes("/shared").build();
		Resources resources = ResourceResolver.resolve(null, Resources
				.builder().cpuLimit(1.5).ramLimit(0.5).build());
		runner().run(task, resources, new CancellationToken());
		ContainerSpec spec = docker.created.get(0);
		assertEquals(Double.valueOf(1.5), spec.getCpuLimit());
		assertEquals(Long.valueOf(512L * 1024 * 1024), spec.getMemoryLimit());
		List<Mount> mounts = spec.getMounts();
		assertEquals(2, mounts.size());
		assertEquals("/in/a", mounts.get(0).getTarget());
		assertTrue(mounts.get(0).isReadOnly());
		assertEquals("/shared", mounts.get(1).getTarget());
		assertFalse(mounts.get(1).isReadOnly());
		// The working directory went with the container
		assertFalse(new File(mounts.get(0).getSource()).exists());
	}

	@Test
	public void cancellationForcesRemovalOnce() throws Exception {
		docker.running = new CountDownLatch(1);
		final ContainerRunner runner = runner();
		final CancellationToken token = new CancellationToken();
		ExecutorService executor = Executors.newSingleThreadExecutor();
		try {
			Future<List<Outcome>> result = executor
					.submit(new Callable<List<Outcome>>() {
						@Override
						public List<Outcome> call() throws Exception {
							return runner.run(echo("doomed"), resources(),
									token);
						}
					});
			assertTrue(docker.attached.await(10, SECONDS));
			token.cancel();
			try {
				result.get(10, SECONDS);
				fail("should have been cancelled");
			} catch (ExecutionException e) {
				assertTrue(e.getCause() instanceof TaskCancelledException);
			}
		} finally {
			executor.shutdownNow();
		}
		assertEquals(asList("doomed (forced)"), docker.removals);
	}

	@Test(expected = NameConflictException.class)
	public void nameClashIsAConflict() throws Exception {
		docker.existing.add("taken");
		runner().run(echo("taken"), resources(), new CancellationToken());
	}

	@Test(expected = ImageUnavailableException.class)
	public void pullFailureIsFatal() throws Exception {
		docker.pullFails = true;
		runner().run(echo("nopull"), resources(), new CancellationToken());
	}

	@Test
	public void swarmWorkerRefusesTasks() throws Exception {
		docker.mode = DaemonMode.SWARM_WORKER;
		ContainerRunner runner = runner();
		try {
			runner.run(echo("w"), resources(), new CancellationToken());
			fail("should have refused");
		} catch (SubmitException e) {
			assertTrue(docker.created.isEmpty());
		}
		try {
			runner.run(echo("w"), resources(), new CancellationToken());
			fail("should have refused");
		} catch (SubmitException e) {
			// mode is remembered
			assertEquals(1, docker.modeQueries);
		}
	}

	@Test
	public void swarmManagerRunsAService() throws Exception {
		docker.mode = DaemonMode.SWARM_MANAGER;
		docker.serviceStates.add(new ServiceTaskStatus("pending", null, null,
				null));
		docker.serviceStates.add(new ServiceTaskStatus("running", "c1", null,
				null));
		docker.serviceStates.add(new ServiceTaskStatus("complete", "c1", 0,
				null));
		Task task = Task.builder().name("svc")
				.execution(Execution.builder("alpine", "echo").build())
				.resources(Resources.builder().cpu(2.0).ram(1.0).build())
				.build();
		List<Outcome> outcomes = runner().run(task,
				ResourceResolver.resolve(null, task.getResources()),
				new CancellationToken());
		assertEquals(0, outcomes.get(0).getStatus());
		assertEquals("logs of c1", outcomes.get(0).getStdoutText());
		ServiceSpec spec = (ServiceSpec) docker.created.get(0);
		assertEquals(Double.valueOf(2), spec.getCpuReservation());
		assertEquals(Long.valueOf(1024L * 1024 * 1024),
				spec.getMemoryReservation());
		assertNull(spec.getCpuLimit());
		assertEquals(asList("svc-svc"), docker.removals);
	}

	@Test(expected = ExecutionFailedException.class)
	public void serviceWithoutContainerFails() throws Exception {
		docker.mode = DaemonMode.SWARM_MANAGER;
		docker.serviceStates.add(new ServiceTaskStatus("rejected", null, null,
				"no suitable node"));
		runner().run(echo("lost"), resources(), new CancellationToken());
	}
}
