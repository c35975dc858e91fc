package uk.ac.manchester.cs.taskengine.task;

import static java.util.Objects.requireNonNull;

import java.io.File;
import java.net.URI;
import java.util.Arrays;

/**
 * Where the contents of an {@link Input} come from. Exactly one of the host
 * path, the literal bytes or the URL is set, as indicated by {@link #getKind()}.
 */
public final class Contents {
	public enum Kind {
		/** A file or directory on the host running the engine. */
		PATH,
		/** Bytes supplied inline with the task. */
		LITERAL,
		/** A remote (or <tt>file:</tt>) location. */
		URL
	}

	private final Kind kind;
	private final File path;
	private final byte[] literal;
	private final URI url;

	private Contents(Kind kind, File path, byte[] literal, URI url) {
		this.kind = kind;
		this.path = path;
		this.literal = literal;
		this.url = url;
	}

	public static Contents path(File path) {
		return new Contents(Kind.PATH, requireNonNull(path), null, null);
	}

	public static Contents literal(byte[] bytes) {
		return new Contents(Kind.LITERAL, null, Arrays.copyOf(
				requireNonNull(bytes), bytes.length), null);
	}

	public static Contents url(URI url) {
		return new Contents(Kind.URL, null, null, requireNonNull(url));
	}

	public Kind getKind() {
		return kind;
	}

	public File getPath() {
		return path;
	}

	/** @return a copy of the inline bytes, or <tt>null</tt> */
	public byte[] getLiteral() {
		return literal == null ? null : Arrays.copyOf(literal, literal.length);
	}

	public URI getUrl() {
		return url;
	}

	@Override
	public String toString() {
		switch (kind) {
		case PATH:
			return "path:" + path;
		case LITERAL:
			return "literal(" + literal.length + " bytes)";
		default:
			return "url:" + url;
		}
	}
}
