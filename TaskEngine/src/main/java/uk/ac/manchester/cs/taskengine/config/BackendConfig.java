package uk.ac.manchester.cs.taskengine.config;

import static org.apache.commons.lang3.StringUtils.isBlank;

import uk.ac.manchester.cs.taskengine.errors.BackendInitException;
import uk.ac.manchester.cs.taskengine.task.Resources;

/**
 * How to build one named backend.
 */
public abstract class BackendConfig {
	private String name;
	private int maxTasks;
	private Resources defaults;

	public abstract BackendKind getKind();

	/** @return the name tasks are sent to */
	public String getName() {
		return name;
	}

	public void setName(String name) {
		this.name = name;
	}

	/** @return how many tasks may run on this backend at once */
	public int getMaxTasks() {
		return maxTasks;
	}

	public void setMaxTasks(int maxTasks) {
		this.maxTasks = maxTasks;
	}

	/**
	 * @return resource hints used where a task gives none, or <tt>null</tt>
	 */
	public Resources getDefaults() {
		return defaults;
	}

	public void setDefaults(Resources defaults) {
		this.defaults = defaults;
	}

	/**
	 * Check the configuration for things that can never work.
	 * 
	 * @throws BackendInitException
	 *             If something is missing or out of range.
	 */
	public void validate() throws BackendInitException {
		if (isBlank(name))
			throw new BackendInitException("backend name must not be empty");
		if (maxTasks <= 0)
			throw new BackendInitException("backend " + name
					+ ": maxTasks must be greater than zero (was " + maxTasks
					+ ")");
	}

	@Override
	public String toString() {
		return getKind() + " backend " + name + " (maxTasks=" + maxTasks + ")";
	}
}
