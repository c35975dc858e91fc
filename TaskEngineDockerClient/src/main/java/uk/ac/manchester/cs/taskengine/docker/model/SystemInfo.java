package uk.ac.manchester.cs.taskengine.docker.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The part of the daemon's <tt>/info</tt> response that matters here.
 */
public class SystemInfo {
	@JsonProperty("ID")
	private String id;
	@JsonProperty("Swarm")
	private SwarmInfo swarm;

	public String getId() {
		return id;
	}

	public void setId(String id) {
		this.id = id;
	}

	public SwarmInfo getSwarm() {
		return swarm;
	}

	public void setSwarm(SwarmInfo swarm) {
		this.swarm = swarm;
	}
}
