package uk.ac.manchester.cs.taskengine.config;

import java.util.Locale;

/**
 * The sorts of backend the engine knows how to run.
 */
public enum BackendKind {
	/** Containers on a Docker daemon (or services on a swarm). */
	DOCKER,
	/** User-supplied submit/monitor/kill commands, run locally or over SSH. */
	GENERIC,
	/** A GA4GH Task Execution Service. */
	TES;

	/**
	 * @param value
	 *            The kind as written in configuration, in any case.
	 * @return The kind.
	 * @throws IllegalArgumentException
	 *             If there is no such kind.
	 */
	public static BackendKind parse(String value) {
		return valueOf(value.trim().toUpperCase(Locale.ROOT));
	}
}
