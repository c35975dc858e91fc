package uk.ac.manchester.cs.taskengine.docker.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The body of a failed daemon request.
 */
public class ErrorResponse {
	@JsonProperty("message")
	private String message;

	public String getMessage() {
		return message;
	}

	public void setMessage(String message) {
		this.message = message;
	}
}
