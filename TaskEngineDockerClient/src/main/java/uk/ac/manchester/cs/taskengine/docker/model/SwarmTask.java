package uk.ac.manchester.cs.taskengine.docker.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One scheduled instance of a service.
 */
public class SwarmTask {
	@JsonProperty("ID")
	private String id;
	@JsonProperty("ServiceID")
	private String serviceId;
	@JsonProperty("DesiredState")
	private String desiredState;
	@JsonProperty("Status")
	private TaskStatus status;

	public String getId() {
		return id;
	}

	public void setId(String id) {
		this.id = id;
	}

	public String getServiceId() {
		return serviceId;
	}

	public void setServiceId(String serviceId) {
		this.serviceId = serviceId;
	}

	public String getDesiredState() {
		return desiredState;
	}

	public void setDesiredState(String desiredState) {
		this.desiredState = desiredState;
	}

	public TaskStatus getStatus() {
		return status;
	}

	public void setStatus(TaskStatus status) {
		this.status = status;
	}
}
