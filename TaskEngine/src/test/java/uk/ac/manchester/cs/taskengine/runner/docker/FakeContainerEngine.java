package uk.ac.manchester.cs.taskengine.runner.docker;

import static java.nio.charset.StandardCharsets.UTF_8;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;

import uk.ac.manchester.cs.taskengine.docker.ContainerEngine;
import uk.ac.manchester.cs.taskengine.docker.ContainerOutput;
import uk.ac.manchester.cs.taskengine.docker.ContainerSpec;
import uk.ac.manchester.cs.taskengine.docker.DaemonMode;
import uk.ac.manchester.cs.taskengine.docker.DockerEngineException;
import uk.ac.manchester.cs.taskengine.docker.ServiceSpec;
import uk.ac.manchester.cs.taskengine.docker.ServiceTaskStatus;

/**
 * An in-memory daemon whose containers "echo" their arguments.
 */
class FakeContainerEngine implements ContainerEngine {
	DaemonMode mode = DaemonMode.STANDALONE;
	final Set<String> images = new HashSet<>();
	boolean pullFails;
	int modeQueries;
	final List<String> pulled = new ArrayList<>();
	final List<ContainerSpec> created = Collections
			.synchronizedList(new ArrayList<ContainerSpec>());
	final Set<String> existing = Collections
			.synchronizedSet(new HashSet<String>());
	final List<String> removals = Collections
			.synchronizedList(new ArrayList<String>());
	final Deque<ServiceTaskStatus> serviceStates = new ArrayDeque<>();
	/** When set, attaching blocks until the container is removed. */
	CountDownLatch running;
	final CountDownLatch attached = new CountDownLatch(1);
	int exitCode;

	@Override
	public synchronized DaemonMode getDaemonMode() {
		modeQueries++;
		return mode;
	}

	@Override
	public boolean imageExists(String image) {
		return images.contains(image);
	}

	@Override
	public void pullImage(String image) throws IOException {
		if (pullFails)
			throw new DockerEngineException(DockerEngineException.IN_STREAM,
					"manifest unknown");
		pulled.add(image);
		images.add(image);
	}

	@Override
	public String createContainer(ContainerSpec spec) throws IOException {
		if (!existing.add(spec.getName()))
			throw new DockerEngineException(409, "name in use");
		created.add(spec);
		return spec.getName();
	}

	@Override
	public void startContainer(String id) throws IOException {
		if (!existing.contains(id))
			throw new DockerEngineException(404, "no such container");
	}

	private ContainerSpec spec(String id) {
		synchronized (created) {
			for (ContainerSpec spec : created)
				if (spec.getName().equals(id))
					return spec;
		}
		return null;
	}

	@Override
	public ContainerOutput attachContainer(String id, OutputListener listener)
			throws IOException {
		attached.countDown();
		if (running != null)
			try {
				running.await();
			} catch (InterruptedException e) {
				throw new IOException(e);
			}
		List<String> command = spec(id).getCommand();
		StringBuilder sb = new StringBuilder();
		for (String word : command.subList(1, command.size())) {
			if (sb.length() > 0)
				sb.append(' ');
			sb.append(word);
		}
		byte[] out = (sb + "\n").getBytes(UTF_8);
		if (listener != null)
			listener.output(false, out);
		return new ContainerOutput(out, new byte[0]);
	}

	@Override
	public int waitContainer(String id) throws IOException {
		if (!existing.contains(id))
			throw new DockerEngineException(404, "no such container");
		return exitCode;
	}

	@Override
	public void removeContainer(String id, boolean force) throws IOException {
		removals.add(id + (force ? " (forced)" : ""));
		existing.remove(id);
		if (running != null)
			running.countDown();
	}

	@Override
	public String createService(ServiceSpec spec) throws IOException {
		if (!existing.add(spec.getName()))
			throw new DockerEngineException(409, "name in use");
		created.add(spec);
		return "svc-" + spec.getName();
	}

	@Override
	public synchronized ServiceTaskStatus inspectService(String serviceId) {
		if (serviceStates.size() > 1)
			return serviceStates.removeFirst();
		return serviceStates.peekFirst();
	}

	@Override
	public ContainerOutput fetchLogs(String containerId) {
		return new ContainerOutput(("logs of " + containerId).getBytes(UTF_8),
				new byte[0]);
	}

	@Override
	public void removeService(String id) {
		removals.add(id);
	}

	@Override
	public void close() {
	}
}
