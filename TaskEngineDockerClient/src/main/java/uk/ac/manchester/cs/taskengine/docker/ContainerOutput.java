package uk.ac.manchester.cs.taskengine.docker;

import java.util.Arrays;

/**
 * Everything a container wrote.
 */
public final class ContainerOutput {
	private final byte[] stdout;
	private final byte[] stderr;

	public ContainerOutput(byte[] stdout, byte[] stderr) {
		this.stdout = Arrays.copyOf(stdout, stdout.length);
		this.stderr = Arrays.copyOf(stderr, stderr.length);
	}

	public byte[] getStdout() {
		return Arrays.copyOf(stdout, stdout.length);
	}

	public byte[] getStderr() {
		return Arrays.copyOf(stderr, stderr.length);
	}
}
