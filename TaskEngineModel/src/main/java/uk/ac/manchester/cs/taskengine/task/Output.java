package uk.ac.manchester.cs.taskengine.task;

import static java.util.Objects.requireNonNull;

import java.net.URI;

/**
 * Something to collect from the execution environment once the task is done.
 */
public final class Output {
	private final String name;
	private final String description;
	private final String path;
	private final URI url;
	private final IOType type;

	public Output(String path, URI url) {
		this(null, null, path, url, IOType.FILE);
	}

	public Output(String name, String description, String path, URI url,
			IOType type) {
		this.name = name;
		this.description = description;
		this.path = requireNonNull(path, "output path");
		this.url = url;
		this.type = type == null ? IOType.FILE : type;
	}

	public String getName() {
		return name;
	}

	public String getDescription() {
		return description;
	}

	/** @return the source path inside the execution environment */
	public String getPath() {
		return path;
	}

	/** @return where to put the output, or <tt>null</tt> */
	public URI getUrl() {
		return url;
	}

	public IOType getType() {
		return type;
	}
}
