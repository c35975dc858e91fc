package uk.ac.manchester.cs.taskengine.docker.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public class ReplicatedMode {
	@JsonProperty("Replicas")
	private Long replicas;

	public Long getReplicas() {
		return replicas;
	}

	public void setReplicas(Long replicas) {
		this.replicas = replicas;
	}
}
