package uk.ac.manchester.cs.taskengine.docker;

import java.io.Closeable;
import java.io.IOException;

/**
 * The container daemon, as the task engine sees it. Implementations must be
 * safe for concurrent use by many tasks.
 * <p>
 * Requests the daemon refuses fail with {@link DockerEngineException}; failures
 * to reach the daemon at all are plain {@link IOException}s.
 */
public interface ContainerEngine extends Closeable {
	/** Receives container output as it arrives. */
	interface OutputListener {
		/**
		 * @param stderr
		 *            Whether the bytes came from standard error.
		 * @param chunk
		 *            The bytes.
		 */
		void output(boolean stderr, byte[] chunk);
	}

	DaemonMode getDaemonMode() throws IOException;

	boolean imageExists(String image) throws IOException;

	void pullImage(String image) throws IOException;

	/** @return the ID of the new container */
	String createContainer(ContainerSpec spec) throws IOException;

	void startContainer(String id) throws IOException;

	/**
	 * Follow the output of a started container until it stops.
	 * 
	 * @param listener
	 *            Told of each chunk of output; may be <tt>null</tt>.
	 */
	ContainerOutput attachContainer(String id, OutputListener listener)
			throws IOException;

	/** @return the exit code of the container, once it has stopped */
	int waitContainer(String id) throws IOException;

	/**
	 * @param force
	 *            Whether to kill the container if it is still running.
	 */
	void removeContainer(String id, boolean force) throws IOException;

	/** @return the ID of the new service */
	String createService(ServiceSpec spec) throws IOException;

	/**
	 * @return The status of the service's task, or <tt>null</tt> if the swarm
	 *         has not yet scheduled one.
	 */
	ServiceTaskStatus inspectService(String serviceId) throws IOException;

	/** @return all the output of a stopped container */
	ContainerOutput fetchLogs(String containerId) throws IOException;

	void removeService(String id) throws IOException;
}
