package uk.ac.manchester.cs.taskengine.docker.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public class TaskStatus {
	@JsonProperty("Timestamp")
	private String timestamp;
	@JsonProperty("State")
	private String state;
	@JsonProperty("Message")
	private String message;
	@JsonProperty("Err")
	private String err;
	@JsonProperty("ContainerStatus")
	private ContainerStatus containerStatus;

	public String getTimestamp() {
		return timestamp;
	}

	public void setTimestamp(String timestamp) {
		this.timestamp = timestamp;
	}

	public String getState() {
		return state;
	}

	public void setState(String state) {
		this.state = state;
	}

	public String getMessage() {
		return message;
	}

	public void setMessage(String message) {
		this.message = message;
	}

	public String getErr() {
		return err;
	}

	public void setErr(String err) {
		this.err = err;
	}

	public ContainerStatus getContainerStatus() {
		return containerStatus;
	}

	public void setContainerStatus(ContainerStatus containerStatus) {
		this.containerStatus = containerStatus;
	}
}
