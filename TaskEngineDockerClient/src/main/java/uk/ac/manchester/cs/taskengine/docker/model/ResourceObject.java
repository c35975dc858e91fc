package uk.ac.manchester.cs.taskengine.docker.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public class ResourceObject {
	@JsonProperty("NanoCPUs")
	private Long nanoCpus;
	@JsonProperty("MemoryBytes")
	private Long memoryBytes;

	public Long getNanoCpus() {
		return nanoCpus;
	}

	public void setNanoCpus(Long nanoCpus) {
		this.nanoCpus = nanoCpus;
	}

	public Long getMemoryBytes() {
		return memoryBytes;
	}

	public void setMemoryBytes(Long memoryBytes) {
		this.memoryBytes = memoryBytes;
	}
}
