package uk.ac.manchester.cs.taskengine.runner.generic;

import static java.nio.charset.StandardCharsets.UTF_8;

import uk.ac.manchester.cs.taskengine.task.Outcome;

/**
 * What one command produced.
 */
public final class CommandOutput {
	private final int exitCode;
	private final byte[] stdout;
	private final byte[] stderr;

	public CommandOutput(int exitCode, byte[] stdout, byte[] stderr) {
		this.exitCode = exitCode;
		this.stdout = stdout;
		this.stderr = stderr;
	}

	public CommandOutput(int exitCode, String stdout, String stderr) {
		this(exitCode, stdout.getBytes(UTF_8), stderr.getBytes(UTF_8));
	}

	public int getExitCode() {
		return exitCode;
	}

	public byte[] getStdout() {
		return stdout;
	}

	public byte[] getStderr() {
		return stderr;
	}

	/** @return standard output, decoded leniently as UTF-8 */
	public String getStdoutText() {
		return new String(stdout, UTF_8);
	}

	public Outcome toOutcome() {
		return new Outcome(exitCode, stdout, stderr);
	}

	@Override
	public String toString() {
		return "CommandOutput(exit=" + exitCode + ", stdout=" + stdout.length
				+ " bytes, stderr=" + stderr.length + " bytes)";
	}
}
