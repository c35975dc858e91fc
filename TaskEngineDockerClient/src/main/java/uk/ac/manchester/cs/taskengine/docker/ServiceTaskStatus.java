package uk.ac.manchester.cs.taskengine.docker;

import static java.util.Arrays.asList;

import java.util.HashSet;
import java.util.Set;

/**
 * Where the single task of a service has got to.
 */
public final class ServiceTaskStatus {
	private static final Set<String> TERMINAL = new HashSet<>(asList(
			"complete", "failed", "shutdown", "rejected", "orphaned", "remove"));
	private static final Set<String> PENDING = new HashSet<>(asList("new",
			"allocated", "pending", "assigned", "accepted", "preparing",
			"ready"));

	private final String state;
	private final String containerId;
	private final Integer exitCode;
	private final String message;

	public ServiceTaskStatus(String state, String containerId,
			Integer exitCode, String message) {
		this.state = state;
		this.containerId = containerId;
		this.exitCode = exitCode;
		this.message = message;
	}

	/** @return the swarm's name for the state, e.g. <tt>running</tt> */
	public String getState() {
		return state;
	}

	/** @return the container running the task, once there is one */
	public String getContainerId() {
		return containerId;
	}

	public Integer getExitCode() {
		return exitCode;
	}

	/** @return the swarm's explanation of the state (or of an error) */
	public String getMessage() {
		return message;
	}

	public boolean isTerminal() {
		return TERMINAL.contains(state);
	}

	/** @return whether the task has yet to get as far as starting */
	public boolean isPending() {
		return PENDING.contains(state);
	}

	@Override
	public String toString() {
		return state + (containerId == null ? "" : " (" + containerId + ")");
	}
}
