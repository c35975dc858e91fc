package uk.ac.manchester.cs.taskengine.config;

import static org.apache.commons.lang3.StringUtils.isBlank;

import java.net.URL;

import uk.ac.manchester.cs.taskengine.errors.BackendInitException;

/**
 * Settings for a backend that hands tasks to a Task Execution Service.
 */
public class TesBackendConfig extends BackendConfig {
	/** How to authenticate to the service. */
	public enum AuthType {
		NONE, BASIC, BEARER
	}

	/** Time (in ms) between polls of a task's state. */
	public static final long DEFAULT_POLL_INTERVAL = 200;
	public static final int DEFAULT_RETRIES = 3;

	private URL url;
	private AuthType authType = AuthType.NONE;
	private String username;
	private String password;
	private String token;
	private long pollInterval = DEFAULT_POLL_INTERVAL;
	private int retries = DEFAULT_RETRIES;

	@Override
	public BackendKind getKind() {
		return BackendKind.TES;
	}

	/** @return the service's base URL */
	public URL getUrl() {
		return url;
	}

	public void setUrl(URL url) {
		this.url = url;
	}

	public AuthType getAuthType() {
		return authType;
	}

	public void setAuthType(AuthType authType) {
		this.authType = authType;
	}

	public String getUsername() {
		return username;
	}

	public void setUsername(String username) {
		this.username = username;
	}

	public String getPassword() {
		return password;
	}

	public void setPassword(String password) {
		this.password = password;
	}

	public String getToken() {
		return token;
	}

	public void setToken(String token) {
		this.token = token;
	}

	/** @return time (in ms) between polls of a task's state */
	public long getPollInterval() {
		return pollInterval;
	}

	public void setPollInterval(long pollInterval) {
		this.pollInterval = pollInterval;
	}

	/** @return how often a request failing in transport is retried */
	public int getRetries() {
		return retries;
	}

	public void setRetries(int retries) {
		this.retries = retries;
	}

	@Override
	public void validate() throws BackendInitException {
		super.validate();
		if (url == null)
			throw new BackendInitException("backend " + getName()
					+ ": a TES url is required");
		if (!url.getProtocol().equals("http")
				&& !url.getProtocol().equals("https"))
			throw new BackendInitException("backend " + getName()
					+ ": TES url must be http or https, not " + url);
		if (pollInterval <= 0)
			throw new BackendInitException("backend " + getName()
					+ ": pollInterval must be positive");
		if (retries < 0)
			throw new BackendInitException("backend " + getName()
					+ ": retries must not be negative");
		switch (authType) {
		case BASIC:
			if (isBlank(username) || password == null)
				throw new BackendInitException("backend " + getName()
						+ ": basic authentication needs username and password");
			break;
		case BEARER:
			if (isBlank(token))
				throw new BackendInitException("backend " + getName()
						+ ": bearer authentication needs a token");
			break;
		default:
			break;
		}
	}
}
