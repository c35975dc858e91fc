package uk.ac.manchester.cs.taskengine.docker.model;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Host-side settings of a container.
 */
public class HostConfig {
	@JsonProperty("Binds")
	private List<String> binds;
	@JsonProperty("NanoCpus")
	private Long nanoCpus;
	@JsonProperty("Memory")
	private Long memory;

	public List<String> getBinds() {
		return binds;
	}

	public void setBinds(List<String> binds) {
		this.binds = binds;
	}

	public Long getNanoCpus() {
		return nanoCpus;
	}

	public void setNanoCpus(Long nanoCpus) {
		this.nanoCpus = nanoCpus;
	}

	public Long getMemory() {
		return memory;
	}

	public void setMemory(Long memory) {
		this.memory = memory;
	}
}
