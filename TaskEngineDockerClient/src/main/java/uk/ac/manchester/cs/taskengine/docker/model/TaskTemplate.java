package uk.ac.manchester.cs.taskengine.docker.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public class TaskTemplate {
	@JsonProperty("ContainerSpec")
	private ServiceContainerSpec containerSpec;
	@JsonProperty("Resources")
	private ResourceRequirements resources;
	@JsonProperty("RestartPolicy")
	private RestartPolicy restartPolicy;

	public ServiceContainerSpec getContainerSpec() {
		return containerSpec;
	}

	public void setContainerSpec(ServiceContainerSpec containerSpec) {
		this.containerSpec = containerSpec;
	}

	public ResourceRequirements getResources() {
		return resources;
	}

	public void setResources(ResourceRequirements resources) {
		this.resources = resources;
	}

	public RestartPolicy getRestartPolicy() {
		return restartPolicy;
	}

	public void setRestartPolicy(RestartPolicy restartPolicy) {
		this.restartPolicy = restartPolicy;
	}
}
