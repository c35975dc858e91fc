package uk.ac.manchester.cs.taskengine.tes.model;

import java.util.List;
import java.util.Map;

/**
 * A task, both as submitted and as reported back by the service. Only the
 * full view of a task carries its logs.
 */
public class TesTask {
	private String id;
	private TesState state;
	private String name;
	private String description;
	private List<TesInput> inputs;
	private List<TesOutput> outputs;
	private TesResources resources;
	private List<TesExecutor> executors;
	private List<String> volumes;
	private Map<String, String> tags;
	private List<TesTaskLog> logs;
	private String creationTime;

	public String getId() {
		return id;
	}

	public void setId(String id) {
		this.id = id;
	}

	public TesState getState() {
		return state;
	}

	public void setState(TesState state) {
		this.state = state;
	}

	public String getName() {
		return name;
	}

	public void setName(String name) {
		this.name = name;
	}

	public String getDescription() {
		return description;
	}

	public void setDescription(String description) {
		this.description = description;
	}

	public List<TesInput> getInputs() {
		return inputs;
	}

	public void setInputs(List<TesInput> inputs) {
		this.inputs = inputs;
	}

	public List<TesOutput> getOutputs() {
		return outputs;
	}

	public void setOutputs(List<TesOutput> outputs) {
		this.outputs = outputs;
	}

	public TesResources getResources() {
		return resources;
	}

	public void setResources(TesResources resources) {
		this.resources = resources;
	}

	public List<TesExecutor> getExecutors() {
		return executors;
	}

	public void setExecutors(List<TesExecutor> executors) {
		this.executors = executors;
	}

	public List<String> getVolumes() {
		return volumes;
	}

	public void setVolumes(List<String> volumes) {
		this.volumes = volumes;
	}

	public Map<String, String> getTags() {
		return tags;
	}

	public void setTags(Map<String, String> tags) {
		this.tags = tags;
	}

	public List<TesTaskLog> getLogs() {
		return logs;
	}

	public void setLogs(List<TesTaskLog> logs) {
		this.logs = logs;
	}

	public String getCreationTime() {
		return creationTime;
	}

	public void setCreationTime(String creationTime) {
		this.creationTime = creationTime;
	}
}
