package uk.ac.manchester.cs.taskengine.config;

import java.net.URL;

/**
 * Settings for a backend that runs tasks on a Docker daemon.
 */
public class DockerBackendConfig extends BackendConfig {
	private URL url;
	private boolean cleanup = true;
	private int retries;

	@Override
	public BackendKind getKind() {
		return BackendKind.DOCKER;
	}

	/**
	 * @return the daemon's HTTP endpoint, or <tt>null</tt> to work it out from
	 *         <tt>DOCKER_HOST</tt>
	 */
	public URL getUrl() {
		return url;
	}

	public void setUrl(URL url) {
		this.url = url;
	}

	/**
	 * @return whether containers and services are removed once their output
	 *         has been collected
	 */
	public boolean isCleanup() {
		return cleanup;
	}

	public void setCleanup(boolean cleanup) {
		this.cleanup = cleanup;
	}

	/** @return retry budget for requests to the daemon */
	public int getRetries() {
		return retries;
	}

	public void setRetries(int retries) {
		this.retries = retries;
	}
}
