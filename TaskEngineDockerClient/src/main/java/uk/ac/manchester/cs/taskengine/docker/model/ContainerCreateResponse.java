package uk.ac.manchester.cs.taskengine.docker.model;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

public class ContainerCreateResponse {
	@JsonProperty("Id")
	private String id;
	@JsonProperty("Warnings")
	private List<String> warnings;

	public String getId() {
		return id;
	}

	public void setId(String id) {
		this.id = id;
	}

	public List<String> getWarnings() {
		return warnings;
	}

	public void setWarnings(List<String> warnings) {
		this.warnings = warnings;
	}
}
