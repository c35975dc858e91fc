package uk.ac.manchester.cs.taskengine.runner.generic;

import static org.slf4j.LoggerFactory.getLogger;

import java.io.IOException;

import org.slf4j.Logger;

import uk.ac.manchester.cs.taskengine.config.GenericBackendConfig.Shell;

/**
 * Runs commands as child processes of this one.
 */
public class LocalDriver implements CommandDriver {
	private final Logger logger = getLogger(getClass());
	private final Shell shell;
	private final ThreadGroup threadGroup = new ThreadGroup("LocalCommand");

	public LocalDriver(Shell shell) {
		this.shell = shell;
	}

	static String[] shellCommand(Shell shell, String command) {
		switch (shell) {
		case SH:
			return new String[] { "sh", "-c", command };
		case BASH:
		default:
			return new String[] { "/usr/bin/env", "bash", "-c", command };
		}
	}

	@Override
	public CommandOutput run(String command) throws IOException {
		logger.debug("running locally: " + command);
		ProcessBuilder builder = new ProcessBuilder(shellCommand(shell, command));
		Process process = builder.start();
		process.getOutputStream().close();
		StreamCollector stdout = new StreamCollector(threadGroup,
				process.getInputStream(), "LocalCommand stdout");
		StreamCollector stderr = new StreamCollector(threadGroup,
				process.getErrorStream(), "LocalCommand stderr");
		stdout.start();
		stderr.start();

		int exitCode;
		try {
			exitCode = process.waitFor();
		} catch (InterruptedException e) {
			process.destroy();
			Thread.currentThread().interrupt();
			throw new IOException("interrupted while running " + command, e);
		}
		CommandOutput output = new CommandOutput(exitCode, stdout.collect(),
				stderr.collect());
		logger.debug("local command finished: " + output);
		return output;
	}

	@Override
	public void close() {
		// Nothing held between commands
	}
}
