package uk.ac.manchester.cs.taskengine.docker.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public class ContainerWaitResponse {
	@JsonProperty("StatusCode")
	private Long statusCode;
	@JsonProperty("Error")
	private WaitError error;

	public Long getStatusCode() {
		return statusCode;
	}

	public void setStatusCode(Long statusCode) {
		this.statusCode = statusCode;
	}

	public WaitError getError() {
		return error;
	}

	public void setError(WaitError error) {
		this.error = error;
	}
}
