package uk.ac.manchester.cs.taskengine.docker.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public class ServiceMode {
	@JsonProperty("Replicated")
	private ReplicatedMode replicated;

	public ReplicatedMode getReplicated() {
		return replicated;
	}

	public void setReplicated(ReplicatedMode replicated) {
		this.replicated = replicated;
	}
}
