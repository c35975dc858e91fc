package uk.ac.manchester.cs.taskengine.docker.model;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

public class ServiceContainerSpec {
	@JsonProperty("Image")
	private String image;
	@JsonProperty("Args")
	private List<String> args;
	@JsonProperty("Dir")
	private String dir;
	@JsonProperty("Env")
	private List<String> env;
	@JsonProperty("Mounts")
	private List<ServiceMount> mounts;

	public String getImage() {
		return image;
	}

	public void setImage(String image) {
		this.image = image;
	}

	public List<String> getArgs() {
		return args;
	}

	public void setArgs(List<String> args) {
		this.args = args;
	}

	public String getDir() {
		return dir;
	}

	public void setDir(String dir) {
		this.dir = dir;
	}

	public List<String> getEnv() {
		return env;
	}

	public void setEnv(List<String> env) {
		this.env = env;
	}

	public List<ServiceMount> getMounts() {
		return mounts;
	}

	public void setMounts(List<ServiceMount> mounts) {
		this.mounts = mounts;
	}
}
