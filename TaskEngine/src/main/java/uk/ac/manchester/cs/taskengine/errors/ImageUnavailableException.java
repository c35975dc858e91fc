package uk.ac.manchester.cs.taskengine.errors;

/**
 * The container image was not present and could not be pulled.
 */
public class ImageUnavailableException extends TaskRunException {
	private static final long serialVersionUID = 1L;

	public ImageUnavailableException(String message) {
		super(message);
	}

	public ImageUnavailableException(String message, Throwable cause) {
		super(message, cause);
	}
}
