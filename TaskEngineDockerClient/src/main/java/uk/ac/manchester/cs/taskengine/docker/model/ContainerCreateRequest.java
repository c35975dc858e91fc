package uk.ac.manchester.cs.taskengine.docker.model;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

public class ContainerCreateRequest {
	@JsonProperty("Image")
	private String image;
	@JsonProperty("Cmd")
	private List<String> cmd;
	@JsonProperty("WorkingDir")
	private String workingDir;
	@JsonProperty("Env")
	private List<String> env;
	@JsonProperty("AttachStdout")
	private Boolean attachStdout;
	@JsonProperty("AttachStderr")
	private Boolean attachStderr;
	@JsonProperty("Tty")
	private Boolean tty;
	@JsonProperty("HostConfig")
	private HostConfig hostConfig;

	public String getImage() {
		return image;
	}

	public void setImage(String image) {
		this.image = image;
	}

	public List<String> getCmd() {
		return cmd;
	}

	public void setCmd(List<String> cmd) {
		this.cmd = cmd;
	}

	public String getWorkingDir() {
		return workingDir;
	}

	public void setWorkingDir(String workingDir) {
		this.workingDir = workingDir;
	}

	public List<String> getEnv() {
		return env;
	}

	public void setEnv(List<String> env) {
		this.env = env;
	}

	public Boolean getAttachStdout() {
		return attachStdout;
	}

	public void setAttachStdout(Boolean attachStdout) {
		this.attachStdout = attachStdout;
	}

	public Boolean getAttachStderr() {
		return attachStderr;
	}

	public void setAttachStderr(Boolean attachStderr) {
		this.attachStderr = attachStderr;
	}

	public Boolean getTty() {
		return tty;
	}

	public void setTty(Boolean tty) {
		this.tty = tty;
	}

	public HostConfig getHostConfig() {
		return hostConfig;
	}

	public void setHostConfig(HostConfig hostConfig) {
		this.hostConfig = hostConfig;
	}
}
