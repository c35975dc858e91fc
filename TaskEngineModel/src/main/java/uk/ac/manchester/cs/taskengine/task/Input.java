package uk.ac.manchester.cs.taskengine.task;

import static java.util.Objects.requireNonNull;

/**
 * Something to place inside the execution environment before the task runs.
 */
public final class Input {
	private final String name;
	private final String description;
	private final String path;
	private final Contents contents;
	private final IOType type;
	private final boolean readOnly;

	public Input(String path, Contents contents) {
		this(null, null, path, contents, IOType.FILE, true);
	}

	public Input(String name, String description, String path,
			Contents contents, IOType type, boolean readOnly) {
		this.name = name;
		this.description = description;
		this.path = requireNonNull(path, "input path");
		this.contents = requireNonNull(contents, "input contents");
		this.type = type == null ? IOType.FILE : type;
		this.readOnly = readOnly;
	}

	public String getName() {
		return name;
	}

	public String getDescription() {
		return description;
	}

	/** @return the destination path inside the execution environment */
	public String getPath() {
		return path;
	}

	public Contents getContents() {
		return contents;
	}

	public IOType getType() {
		return type;
	}

	public boolean isReadOnly() {
		return readOnly;
	}
}
