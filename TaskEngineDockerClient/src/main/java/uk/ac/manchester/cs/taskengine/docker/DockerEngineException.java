package uk.ac.manchester.cs.taskengine.docker;

import java.io.IOException;

/**
 * The daemon understood a request and refused it.
 */
public class DockerEngineException extends IOException {
	private static final long serialVersionUID = 1L;
	/** Status used when the failure was reported inside a streamed reply. */
	public static final int IN_STREAM = -1;
	private static final int NOT_FOUND = 404;
	private static final int CONFLICT = 409;

	private final int status;

	public DockerEngineException(int status, String message) {
		super(message);
		this.status = status;
	}

	public DockerEngineException(int status, String message, Throwable cause) {
		super(message, cause);
		this.status = status;
	}

	/** @return the HTTP status of the reply, or {@link #IN_STREAM} */
	public int getStatus() {
		return status;
	}

	public boolean isNotFound() {
		return status == NOT_FOUND;
	}

	/** @return whether the request clashed with something already there */
	public boolean isConflict() {
		return status == CONFLICT;
	}
}
