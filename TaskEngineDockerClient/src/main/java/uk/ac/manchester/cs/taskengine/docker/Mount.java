package uk.ac.manchester.cs.taskengine.docker;

import static java.util.Objects.requireNonNull;

/**
 * A host path bound into a container.
 */
public final class Mount {
	private final String source;
	private final String target;
	private final boolean readOnly;

	public Mount(String source, String target, boolean readOnly) {
		this.source = requireNonNull(source, "mount source");
		this.target = requireNonNull(target, "mount target");
		this.readOnly = readOnly;
	}

	/** @return the path on the host */
	public String getSource() {
		return source;
	}

	/** @return the path inside the container */
	public String getTarget() {
		return target;
	}

	public boolean isReadOnly() {
		return readOnly;
	}

	/** @return the mount in the daemon's <tt>source:target[:ro]</tt> form */
	public String toBind() {
		return source + ":" + target + (readOnly ? ":ro" : ":rw");
	}

	@Override
	public String toString() {
		return toBind();
	}
}
