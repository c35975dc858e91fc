package uk.ac.manchester.cs.taskengine.docker.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public class ServiceCreateRequest {
	@JsonProperty("Name")
	private String name;
	@JsonProperty("TaskTemplate")
	private TaskTemplate taskTemplate;
	@JsonProperty("Mode")
	private ServiceMode mode;

	public String getName() {
		return name;
	}

	public void setName(String name) {
		this.name = name;
	}

	public TaskTemplate getTaskTemplate() {
		return taskTemplate;
	}

	public void setTaskTemplate(TaskTemplate taskTemplate) {
		this.taskTemplate = taskTemplate;
	}

	public ServiceMode getMode() {
		return mode;
	}

	public void setMode(ServiceMode mode) {
		this.mode = mode;
	}
}
