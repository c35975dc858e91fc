package uk.ac.manchester.cs.taskengine.tes.model;

import java.util.List;
import java.util.Map;

/**
 * The record of one attempt at running a task.
 */
public class TesTaskLog {
	private List<TesExecutorLog> logs;
	private Map<String, String> metadata;
	private String startTime;
	private String endTime;
	private List<String> systemLogs;

	public List<TesExecutorLog> getLogs() {
		return logs;
	}

	public void setLogs(List<TesExecutorLog> logs) {
		this.logs = logs;
	}

	public Map<String, String> getMetadata() {
		return metadata;
	}

	public void setMetadata(Map<String, String> metadata) {
		this.metadata = metadata;
	}

	public String getStartTime() {
		return startTime;
	}

	public void setStartTime(String startTime) {
		this.startTime = startTime;
	}

	public String getEndTime() {
		return endTime;
	}

	public void setEndTime(String endTime) {
		this.endTime = endTime;
	}

	public List<String> getSystemLogs() {
		return systemLogs;
	}

	public void setSystemLogs(List<String> systemLogs) {
		this.systemLogs = systemLogs;
	}
}
