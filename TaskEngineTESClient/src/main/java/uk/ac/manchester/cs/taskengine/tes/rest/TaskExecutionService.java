package uk.ac.manchester.cs.taskengine.tes.rest;

import static javax.ws.rs.core.MediaType.APPLICATION_JSON;

import javax.ws.rs.Consumes;
import javax.ws.rs.GET;
import javax.ws.rs.POST;
import javax.ws.rs.Path;
import javax.ws.rs.PathParam;
import javax.ws.rs.Produces;
import javax.ws.rs.QueryParam;

import uk.ac.manchester.cs.taskengine.tes.model.CreateTaskResponse;
import uk.ac.manchester.cs.taskengine.tes.model.ServiceInfo;
import uk.ac.manchester.cs.taskengine.tes.model.TesTask;

/**
 * The parts of the GA4GH Task Execution Service API that the engine uses. The
 * proxy is rooted at the service's base URL (typically ending
 * <tt>/ga4gh/tes/v1</tt>).
 */
public interface TaskExecutionService {
	/** View that includes the logs of the task. */
	String FULL = "FULL";
	/** View with just the id and state. */
	String MINIMAL = "MINIMAL";

	@POST
	@Path("tasks")
	@Consumes(APPLICATION_JSON)
	@Produces(APPLICATION_JSON)
	CreateTaskResponse createTask(TesTask task);

	@GET
	@Path("tasks/{id}")
	@Produces(APPLICATION_JSON)
	TesTask getTask(@PathParam("id") String id, @QueryParam("view") String view);

	@POST
	@Path("tasks/{id}:cancel")
	@Produces(APPLICATION_JSON)
	void cancelTask(@PathParam("id") String id);

	@GET
	@Path("service-info")
	@Produces(APPLICATION_JSON)
	ServiceInfo getServiceInfo();
}
