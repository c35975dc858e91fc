package uk.ac.manchester.cs.taskengine.docker;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Collections.singletonList;
import static java.util.Collections.singletonMap;
import static org.apache.commons.io.IOUtils.closeQuietly;
import static org.slf4j.LoggerFactory.getLogger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.net.MalformedURLException;
import java.net.URL;
import java.util.ArrayList;
import java.util.List;

import javax.ws.rs.ProcessingException;
import javax.ws.rs.WebApplicationException;
import javax.ws.rs.core.Response;

import org.jboss.resteasy.client.jaxrs.ResteasyClient;
import org.slf4j.Logger;

import uk.ac.manchester.cs.taskengine.docker.model.ContainerCreateRequest;
import uk.ac.manchester.cs.taskengine.docker.model.ContainerStatus;
import uk.ac.manchester.cs.taskengine.docker.model.ContainerWaitResponse;
import uk.ac.manchester.cs.taskengine.docker.model.ErrorResponse;
import uk.ac.manchester.cs.taskengine.docker.model.HostConfig;
import uk.ac.manchester.cs.taskengine.docker.model.ReplicatedMode;
import uk.ac.manchester.cs.taskengine.docker.model.ResourceObject;
import uk.ac.manchester.cs.taskengine.docker.model.ResourceRequirements;
import uk.ac.manchester.cs.taskengine.docker.model.RestartPolicy;
import uk.ac.manchester.cs.taskengine.docker.model.ServiceContainerSpec;
import uk.ac.manchester.cs.taskengine.docker.model.ServiceCreateRequest;
import uk.ac.manchester.cs.taskengine.docker.model.ServiceMode;
import uk.ac.manchester.cs.taskengine.docker.model.ServiceMount;
import uk.ac.manchester.cs.taskengine.docker.model.SwarmInfo;
import uk.ac.manchester.cs.taskengine.docker.model.SwarmTask;
import uk.ac.manchester.cs.taskengine.docker.model.SystemInfo;
import uk.ac.manchester.cs.taskengine.docker.model.TaskTemplate;
import uk.ac.manchester.cs.taskengine.docker.rest.DockerEngineApi;
import uk.ac.manchester.cs.taskengine.rest.utils.CustomJacksonJsonProvider;
import uk.ac.manchester.cs.taskengine.rest.utils.RestClientUtils;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Talks to a Docker daemon over its HTTP API. Only TCP endpoints are
 * supported; a daemon listening on a unix socket must be exposed over TCP (or
 * proxied) first.
 */
public class DockerEngineClient implements ContainerEngine {
	/** Where to look when nothing else is said. */
	public static final String DEFAULT_URL = "http://localhost:2375";
	private static final double NANOS = 1e9;

	private final Logger log = getLogger(getClass());
	private final ObjectMapper mapper = new CustomJacksonJsonProvider()
			.newMapper();
	private final URL url;
	private final ResteasyClient client;
	private final DockerEngineApi api;

	/**
	 * @param url
	 *            The daemon's HTTP endpoint.
	 * @param retries
	 *            How many times a request failing in transport is retried.
	 */
	public DockerEngineClient(URL url, int retries) {
		this.url = url;
		client = RestClientUtils.createRestClient(null, retries);
		api = client.target(url.toString()).proxy(DockerEngineApi.class);
	}

	/**
	 * Work out the daemon's address the way the docker command line does.
	 * 
	 * @param dockerHost
	 *            The value of <tt>DOCKER_HOST</tt>, or <tt>null</tt>.
	 * @return The HTTP endpoint.
	 * @throws MalformedURLException
	 *             If the address is not a TCP one.
	 */
	public static URL endpointFor(String dockerHost)
			throws MalformedURLException {
		if (dockerHost == null || dockerHost.trim().isEmpty())
			return new URL(DEFAULT_URL);
		String host = dockerHost.trim();
		if (host.startsWith("tcp://"))
			return new URL("http://" + host.substring("tcp://".length()));
		if (host.startsWith("http://") || host.startsWith("https://"))
			return new URL(host);
		throw new MalformedURLException("unsupported docker endpoint: " + host
				+ " (only tcp:// endpoints can be used)");
	}

	public URL getUrl() {
		return url;
	}

	private String filter(String key, String value) throws IOException {
		return mapper.writeValueAsString(singletonMap(key,
				singletonList(value)));
	}

	/**
	 * Convert the ways a proxied call can fail into something a caller can
	 * classify.
	 */
	private IOException failure(String action, RuntimeException e) {
		if (e instanceof WebApplicationException) {
			Response response = ((WebApplicationException) e).getResponse();
			return new DockerEngineException(response.getStatus(), action
					+ " failed: " + describe(response), e);
		}
		if (e instanceof ProcessingException)
			return new IOException("could not " + action
					+ " with docker daemon at " + url, e);
		throw e;
	}

	private static String describe(Response response) {
		try {
			ErrorResponse error = response.readEntity(ErrorResponse.class);
			if (error != null && error.getMessage() != null)
				return error.getMessage();
		} catch (RuntimeException e) {
			// Fall through to the status line
		}
		return response.getStatus() + " "
				+ response.getStatusInfo().getReasonPhrase();
	}

	@Override
	public DaemonMode getDaemonMode() throws IOException {
		SystemInfo info;
		try {
			info = api.getInfo();
		} catch (WebApplicationException | ProcessingException e) {
			throw failure("get system information", e);
		}
		SwarmInfo swarm = info.getSwarm();
		if (swarm == null || !"active".equals(swarm.getLocalNodeState()))
			return DaemonMode.STANDALONE;
		if (Boolean.TRUE.equals(swarm.getControlAvailable()))
			return DaemonMode.SWARM_MANAGER;
		return DaemonMode.SWARM_WORKER;
	}

	@Override
	public boolean imageExists(String image) throws IOException {
		try {
			return !api.listImages(filter("reference", image)).isEmpty();
		} catch (WebApplicationException | ProcessingException e) {
			throw failure("list images", e);
		}
	}

	@Override
	public void pullImage(String image) throws IOException {
		InputStream progress;
		try {
			progress = api.createImage(image);
		} catch (WebApplicationException | ProcessingException e) {
			throw failure("pull " + image, e);
		}
		try (BufferedReader reader = new BufferedReader(new InputStreamReader(
				progress, UTF_8))) {
			String line;
			while ((line = reader.readLine()) != null) {
				if (line.trim().isEmpty())
					continue;
				JsonNode node = mapper.readTree(line);
				if (node.hasNonNull("error"))
					throw new DockerEngineException(
							DockerEngineException.IN_STREAM, "pull " + image
									+ " failed: " + node.get("error").asText());
				if (node.hasNonNull("status"))
					log.debug(image + ": " + node.get("status").asText());
			}
		}
	}

	@Override
	public String createContainer(ContainerSpec spec) throws IOException {
		HostConfig host = new HostConfig();
		List<String> binds = new ArrayList<>();
		for (Mount mount : spec.getMounts())
			binds.add(mount.toBind());
		host.setBinds(binds);
		if (spec.getCpuLimit() != null)
			host.setNanoCpus(nanos(spec.getCpuLimit()));
		host.setMemory(spec.getMemoryLimit());

		ContainerCreateRequest request = new ContainerCreateRequest();
		request.setImage(spec.getImage());
		request.setCmd(spec.getCommand());
		request.setWorkingDir(spec.getWorkDir());
		request.setEnv(spec.getEnvList());
		request.setAttachStdout(true);
		request.setAttachStderr(true);
		request.setTty(false);
		request.setHostConfig(host);
		try {
			String id = api.createContainer(spec.getName(), request).getId();
			log.debug("created container " + spec.getName() + " (" + id + ")");
			return id;
		} catch (WebApplicationException | ProcessingException e) {
			throw failure("create container " + spec.getName(), e);
		}
	}

	private static long nanos(double cores) {
		return (long) (cores * NANOS);
	}

	@Override
	public void startContainer(String id) throws IOException {
		try {
			api.startContainer(id);
		} catch (WebApplicationException | ProcessingException e) {
			throw failure("start container " + id, e);
		}
	}

	@Override
	public ContainerOutput attachContainer(String id, OutputListener listener)
			throws IOException {
		return readLogs(id, true, listener);
	}

	@Override
	public ContainerOutput fetchLogs(String containerId) throws IOException {
		return readLogs(containerId, false, null);
	}

	private ContainerOutput readLogs(String id, boolean follow,
			OutputListener listener) throws IOException {
		InputStream stream;
		try {
			stream = api.getContainerLogs(id, follow, true, true);
		} catch (WebApplicationException | ProcessingException e) {
			throw failure("read logs of container " + id, e);
		}
		try {
			return LogStreamDemultiplexer.demultiplex(stream, listener);
		} finally {
			closeQuietly(stream);
		}
	}

	@Override
	public int waitContainer(String id) throws IOException {
		ContainerWaitResponse response;
		try {
			response = api.waitContainer(id);
		} catch (WebApplicationException | ProcessingException e) {
			throw failure("wait for container " + id, e);
		}
		if (response.getError() != null
				&& response.getError().getMessage() != null)
			throw new DockerEngineException(DockerEngineException.IN_STREAM,
					"waiting for container " + id + " failed: "
							+ response.getError().getMessage());
		return response.getStatusCode().intValue();
	}

	@Override
	public void removeContainer(String id, boolean force) throws IOException {
		try {
			api.removeContainer(id, force, true);
			log.debug("removed container " + id);
		} catch (WebApplicationException | ProcessingException e) {
			throw failure("remove container " + id, e);
		}
	}

	@Override
	public String createService(ServiceSpec spec) throws IOException {
		ServiceContainerSpec container = new ServiceContainerSpec();
		container.setImage(spec.getImage());
		container.setArgs(spec.getCommand());
		container.setDir(spec.getWorkDir());
		container.setEnv(spec.getEnvList());
		List<ServiceMount> mounts = new ArrayList<>();
		for (Mount mount : spec.getMounts()) {
			ServiceMount m = new ServiceMount();
			m.setType("bind");
			m.setSource(mount.getSource());
			m.setTarget(mount.getTarget());
			m.setReadOnly(mount.isReadOnly());
			mounts.add(m);
		}
		container.setMounts(mounts);

		ResourceRequirements resources = new ResourceRequirements();
		resources.setLimits(resourceObject(spec.getCpuLimit(),
				spec.getMemoryLimit()));
		resources.setReservations(resourceObject(spec.getCpuReservation(),
				spec.getMemoryReservation()));

		RestartPolicy restart = new RestartPolicy();
		restart.setCondition("none");

		TaskTemplate template = new TaskTemplate();
		template.setContainerSpec(container);
		template.setResources(resources);
		template.setRestartPolicy(restart);

		ReplicatedMode replicated = new ReplicatedMode();
		replicated.setReplicas(1L);
		ServiceMode mode = new ServiceMode();
		mode.setReplicated(replicated);

		ServiceCreateRequest request = new ServiceCreateRequest();
		request.setName(spec.getName());
		request.setTaskTemplate(template);
		request.setMode(mode);
		try {
			String id = api.createService(request).getId();
			log.debug("created service " + spec.getName() + " (" + id + ")");
			return id;
		} catch (WebApplicationException | ProcessingException e) {
			throw failure("create service " + spec.getName(), e);
		}
	}

	private static ResourceObject resourceObject(Double cores, Long bytes) {
		if (cores == null && bytes == null)
			return null;
		ResourceObject resources = new ResourceObject();
		if (cores != null)
			resources.setNanoCpus(nanos(cores));
		resources.setMemoryBytes(bytes);
		return resources;
	}

	@Override
	public ServiceTaskStatus inspectService(String serviceId)
			throws IOException {
		List<SwarmTask> tasks;
		try {
			tasks = api.listTasks(filter("service", serviceId));
		} catch (WebApplicationException | ProcessingException e) {
			throw failure("list tasks of service " + serviceId, e);
		}
		if (tasks == null || tasks.isEmpty() || tasks.get(0).getStatus() == null)
			return null;
		SwarmTask task = tasks.get(0);
		String containerId = null;
		Integer exitCode = null;
		ContainerStatus container = task.getStatus().getContainerStatus();
		if (container != null) {
			containerId = container.getContainerId();
			exitCode = container.getExitCode();
		}
		String message = task.getStatus().getErr() != null ? task.getStatus()
				.getErr() : task.getStatus().getMessage();
		return new ServiceTaskStatus(task.getStatus().getState(),
				containerId, exitCode, message);
	}

	@Override
	public void removeService(String id) throws IOException {
		try {
			api.removeService(id);
			log.debug("removed service " + id);
		} catch (WebApplicationException | ProcessingException e) {
			throw failure("remove service " + id, e);
		}
	}

	@Override
	public void close() {
		client.close();
	}
}
