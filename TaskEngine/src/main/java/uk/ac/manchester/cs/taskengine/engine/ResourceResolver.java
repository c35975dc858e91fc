package uk.ac.manchester.cs.taskengine.engine;

import uk.ac.manchester.cs.taskengine.task.Resources;

/**
 * Works out the resources a task actually gets. Each field is taken from the
 * task if it says, else from the backend's defaults, else from the built-in
 * defaults.
 */
public abstract class ResourceResolver {
	/** One core, 2 GiB of RAM, 8 GiB of disk, not preemptible. */
	public static final Resources BUILT_IN_DEFAULTS = Resources.builder()
			.cpu(1.0).ram(2.0).disk(8.0).preemptible(false).build();

	private ResourceResolver() {
	}

	/**
	 * @param backendDefaults
	 *            The backend's defaults, or <tt>null</tt>.
	 * @param requested
	 *            What the task asked for, or <tt>null</tt>.
	 * @return The effective resources.
	 */
	public static Resources resolve(Resources backendDefaults,
			Resources requested) {
		return BUILT_IN_DEFAULTS.apply(backendDefaults).apply(requested);
	}
}
