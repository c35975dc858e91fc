package uk.ac.manchester.cs.taskengine.docker;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What to run in a container, and under what limits.
 */
public class ContainerSpec {
	private String name;
	private String image;
	private List<String> command = new ArrayList<>();
	private String workDir;
	private Map<String, String> env = new LinkedHashMap<>();
	private List<Mount> mounts = new ArrayList<>();
	private Double cpuLimit;
	private Long memoryLimit;

	public String getName() {
		return name;
	}

	public void setName(String name) {
		this.name = name;
	}

	public String getImage() {
		return image;
	}

	public void setImage(String image) {
		this.image = image;
	}

	/** @return the program and its arguments */
	public List<String> getCommand() {
		return command;
	}

	public void setCommand(List<String> command) {
		this.command = new ArrayList<>(command);
	}

	public String getWorkDir() {
		return workDir;
	}

	public void setWorkDir(String workDir) {
		this.workDir = workDir;
	}

	public Map<String, String> getEnv() {
		return env;
	}

	public void setEnv(Map<String, String> env) {
		this.env = new LinkedHashMap<>(env);
	}

	/** @return the environment in the daemon's <tt>KEY=value</tt> form */
	public List<String> getEnvList() {
		List<String> list = new ArrayList<>();
		for (Map.Entry<String, String> e : env.entrySet())
			list.add(e.getKey() + "=" + e.getValue());
		return list;
	}

	public List<Mount> getMounts() {
		return mounts;
	}

	public void addMount(Mount mount) {
		mounts.add(mount);
	}

	/** @return hard limit in cores, or <tt>null</tt> */
	public Double getCpuLimit() {
		return cpuLimit;
	}

	public void setCpuLimit(Double cpuLimit) {
		this.cpuLimit = cpuLimit;
	}

	/** @return hard limit in bytes, or <tt>null</tt> */
	public Long getMemoryLimit() {
		return memoryLimit;
	}

	public void setMemoryLimit(Long memoryLimit) {
		this.memoryLimit = memoryLimit;
	}
}
