package uk.ac.manchester.cs.taskengine.errors;

/**
 * The transport to the backend (container daemon, SSH, HTTP) failed.
 */
public class ConnectivityException extends TaskRunException {
	private static final long serialVersionUID = 1L;

	public ConnectivityException(String message) {
		super(message);
	}

	public ConnectivityException(String message, Throwable cause) {
		super(message, cause);
	}
}
