package uk.ac.manchester.cs.taskengine.task;

import static java.nio.charset.StandardCharsets.UTF_8;

import java.util.Arrays;

/**
 * What one execution step produced.
 */
public final class Outcome {
	private static final byte[] NOTHING = new byte[0];

	private final int status;
	private final byte[] stdout;
	private final byte[] stderr;

	public Outcome(int status, byte[] stdout, byte[] stderr) {
		this.status = status;
		this.stdout = stdout == null ? NOTHING : stdout.clone();
		this.stderr = stderr == null ? NOTHING : stderr.clone();
	}

	public Outcome(int status, String stdout, String stderr) {
		this(status, stdout == null ? null : stdout.getBytes(UTF_8),
				stderr == null ? null : stderr.getBytes(UTF_8));
	}

	/** @return the exit status of the step */
	public int getStatus() {
		return status;
	}

	public boolean isSuccess() {
		return status == 0;
	}

	public byte[] getStdout() {
		return Arrays.copyOf(stdout, stdout.length);
	}

	public byte[] getStderr() {
		return Arrays.copyOf(stderr, stderr.length);
	}

	/** @return the standard output, decoded as UTF-8 */
	public String getStdoutText() {
		return new String(stdout, UTF_8);
	}

	/** @return the standard error, decoded as UTF-8 */
	public String getStderrText() {
		return new String(stderr, UTF_8);
	}

	@Override
	public String toString() {
		return "Outcome(status=" + status + ", stdout=" + stdout.length
				+ " bytes, stderr=" + stderr.length + " bytes)";
	}
}
