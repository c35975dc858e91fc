package uk.ac.manchester.cs.taskengine.docker;

/**
 * How the daemon is deployed. This decides whether work is run as plain
 * containers or as swarm services.
 */
public enum DaemonMode {
	/** Not part of a swarm; run containers directly. */
	STANDALONE,
	/** A swarm manager; run single-replica services. */
	SWARM_MANAGER,
	/** A swarm worker; it can neither run services nor be trusted to run
	 * containers the swarm does not know about. */
	SWARM_WORKER
}
