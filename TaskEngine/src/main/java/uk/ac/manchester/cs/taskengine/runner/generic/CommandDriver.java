package uk.ac.manchester.cs.taskengine.runner.generic;

import java.io.IOException;

/**
 * Somewhere shell commands can be run. Implementations must allow several
 * commands to run at once.
 */
public interface CommandDriver {
	/**
	 * Run a command to completion.
	 * 
	 * @param command
	 *            The command line, as given to the shell.
	 * @return What the command produced. A non-zero exit code is not a
	 *         failure here.
	 * @throws IOException
	 *             If the command could not be run at all.
	 */
	CommandOutput run(String command) throws IOException;

	/** Release whatever connection the driver holds. */
	void close();
}
