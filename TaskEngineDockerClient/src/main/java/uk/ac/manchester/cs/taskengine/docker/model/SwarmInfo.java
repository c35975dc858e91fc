package uk.ac.manchester.cs.taskengine.docker.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public class SwarmInfo {
	@JsonProperty("LocalNodeState")
	private String localNodeState;
	@JsonProperty("ControlAvailable")
	private Boolean controlAvailable;

	public String getLocalNodeState() {
		return localNodeState;
	}

	public void setLocalNodeState(String localNodeState) {
		this.localNodeState = localNodeState;
	}

	public Boolean getControlAvailable() {
		return controlAvailable;
	}

	public void setControlAvailable(Boolean controlAvailable) {
		this.controlAvailable = controlAvailable;
	}
}
