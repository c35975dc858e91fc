package uk.ac.manchester.cs.taskengine.docker.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public class ContainerStatus {
	@JsonProperty("ContainerID")
	private String containerId;
	@JsonProperty("PID")
	private Integer pid;
	@JsonProperty("ExitCode")
	private Integer exitCode;

	public String getContainerId() {
		return containerId;
	}

	public void setContainerId(String containerId) {
		this.containerId = containerId;
	}

	public Integer getPid() {
		return pid;
	}

	public void setPid(Integer pid) {
		this.pid = pid;
	}

	public Integer getExitCode() {
		return exitCode;
	}

	public void setExitCode(Integer exitCode) {
		this.exitCode = exitCode;
	}
}
