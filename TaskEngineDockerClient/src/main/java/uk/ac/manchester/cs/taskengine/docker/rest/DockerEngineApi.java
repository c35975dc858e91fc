package uk.ac.manchester.cs.taskengine.docker.rest;

import static javax.ws.rs.core.MediaType.APPLICATION_JSON;
import static javax.ws.rs.core.MediaType.WILDCARD;

import java.io.InputStream;
import java.util.List;

import javax.ws.rs.Consumes;
import javax.ws.rs.DELETE;
import javax.ws.rs.GET;
import javax.ws.rs.POST;
import javax.ws.rs.Path;
import javax.ws.rs.PathParam;
import javax.ws.rs.Produces;
import javax.ws.rs.QueryParam;

import uk.ac.manchester.cs.taskengine.docker.model.ContainerCreateRequest;
import uk.ac.manchester.cs.taskengine.docker.model.ContainerCreateResponse;
import uk.ac.manchester.cs.taskengine.docker.model.ContainerWaitResponse;
import uk.ac.manchester.cs.taskengine.docker.model.ImageSummary;
import uk.ac.manchester.cs.taskengine.docker.model.ServiceCreateRequest;
import uk.ac.manchester.cs.taskengine.docker.model.ServiceCreateResponse;
import uk.ac.manchester.cs.taskengine.docker.model.SwarmTask;
import uk.ac.manchester.cs.taskengine.docker.model.SystemInfo;

/**
 * The Docker Engine HTTP API, as much of it as is needed to run containers and
 * single-shot services.
 */
public interface DockerEngineApi {
	@GET
	@Path("info")
	@Produces(APPLICATION_JSON)
	SystemInfo getInfo();

	/**
	 * @param filters
	 *            JSON-encoded filter map, e.g.
	 *            <tt>{"reference":["alpine:latest"]}</tt>
	 */
	@GET
	@Path("images/json")
	@Produces(APPLICATION_JSON)
	List<ImageSummary> listImages(@QueryParam("filters") String filters);

	/** @return the pull progress, one JSON object per line */
	@POST
	@Path("images/create")
	@Produces(WILDCARD)
	InputStream createImage(@QueryParam("fromImage") String image);

	@POST
	@Path("containers/create")
	@Consumes(APPLICATION_JSON)
	@Produces(APPLICATION_JSON)
	ContainerCreateResponse createContainer(@QueryParam("name") String name,
			ContainerCreateRequest request);

	@POST
	@Path("containers/{id}/start")
	void startContainer(@PathParam("id") String id);

	@POST
	@Path("containers/{id}/wait")
	@Produces(APPLICATION_JSON)
	ContainerWaitResponse waitContainer(@PathParam("id") String id);

	/** @return the multiplexed output stream of the container */
	@GET
	@Path("containers/{id}/logs")
	@Produces(WILDCARD)
	InputStream getContainerLogs(@PathParam("id") String id,
			@QueryParam("follow") boolean follow,
			@QueryParam("stdout") boolean stdout,
			@QueryParam("stderr") boolean stderr);

	@DELETE
	@Path("containers/{id}")
	void removeContainer(@PathParam("id") String id,
			@QueryParam("force") boolean force, @QueryParam("v") boolean volumes);

	@POST
	@Path("services/create")
	@Consumes(APPLICATION_JSON)
	@Produces(APPLICATION_JSON)
	ServiceCreateResponse createService(ServiceCreateRequest request);

	/**
	 * @param filters
	 *            JSON-encoded filter map, e.g. <tt>{"service":["id"]}</tt>
	 */
	@GET
	@Path("tasks")
	@Produces(APPLICATION_JSON)
	List<SwarmTask> listTasks(@QueryParam("filters") String filters);

	@DELETE
	@Path("services/{id}")
	void removeService(@PathParam("id") String id);
}
