package uk.ac.manchester.cs.taskengine.config;

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.apache.commons.lang3.StringUtils.isBlank;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import uk.ac.manchester.cs.taskengine.errors.BackendInitException;

/**
 * Settings for a backend driven by user-supplied command templates.
 */
public class GenericBackendConfig extends BackendConfig {
	/** Where the commands run. */
	public enum CommandLocale {
		/** As child processes of this one. */
		LOCAL,
		/** Over an SSH connection. */
		SSH
	}

	/** Which shell interprets the commands. */
	public enum Shell {
		BASH, SH
	}

	public static final long DEFAULT_MONITOR_FREQUENCY = 5;
	public static final int DEFAULT_SSH_PORT = 22;
	public static final int DEFAULT_SSH_MAX_ATTEMPTS = 4;

	private String submit;
	private String monitor;
	private String kill;
	private String jobIdRegex;
	private long monitorInterval = SECONDS.toMillis(DEFAULT_MONITOR_FREQUENCY);
	private CommandLocale locale = CommandLocale.LOCAL;
	private Shell shell = Shell.BASH;
	private Map<String, String> attributes = new LinkedHashMap<>();
	private String sshHost;
	private int sshPort = DEFAULT_SSH_PORT;
	private String sshUsername;
	private int sshMaxAttempts = DEFAULT_SSH_MAX_ATTEMPTS;
	private String sshStrictHostKeyChecking = "yes";

	@Override
	public BackendKind getKind() {
		return BackendKind.GENERIC;
	}

	/** @return the template that hands a task to the system */
	public String getSubmit() {
		return submit;
	}

	public void setSubmit(String submit) {
		this.submit = submit;
	}

	/**
	 * @return the template that checks on a job; exit code zero means it is
	 *         still going
	 */
	public String getMonitor() {
		return monitor;
	}

	public void setMonitor(String monitor) {
		this.monitor = monitor;
	}

	/** @return the template that stops a job */
	public String getKill() {
		return kill;
	}

	public void setKill(String kill) {
		this.kill = kill;
	}

	/**
	 * @return the pattern whose first group picks the job id out of the
	 *         submit command's output, or <tt>null</tt> if submission runs the
	 *         task to completion
	 */
	public String getJobIdRegex() {
		return jobIdRegex;
	}

	public void setJobIdRegex(String jobIdRegex) {
		this.jobIdRegex = jobIdRegex;
	}

	/** @return time (in ms) between runs of the monitor command */
	public long getMonitorInterval() {
		return monitorInterval;
	}

	public void setMonitorInterval(long monitorInterval) {
		this.monitorInterval = monitorInterval;
	}

	/** @param seconds time between runs of the monitor command */
	public void setMonitorFrequency(long seconds) {
		this.monitorInterval = SECONDS.toMillis(seconds);
	}

	public CommandLocale getLocale() {
		return locale;
	}

	public void setLocale(CommandLocale locale) {
		this.locale = locale;
	}

	public Shell getShell() {
		return shell;
	}

	public void setShell(Shell shell) {
		this.shell = shell;
	}

	/** @return extra placeholder values available to every template */
	public Map<String, String> getAttributes() {
		return attributes;
	}

	public void setAttributes(Map<String, String> attributes) {
		this.attributes = new LinkedHashMap<>(attributes);
	}

	public String getSshHost() {
		return sshHost;
	}

	public void setSshHost(String sshHost) {
		this.sshHost = sshHost;
	}

	public int getSshPort() {
		return sshPort;
	}

	public void setSshPort(int sshPort) {
		this.sshPort = sshPort;
	}

	/** @return who to log in as, or <tt>null</tt> for the current user */
	public String getSshUsername() {
		return sshUsername;
	}

	public void setSshUsername(String sshUsername) {
		this.sshUsername = sshUsername;
	}

	/** @return how many times to try opening a channel for one command */
	public int getSshMaxAttempts() {
		return sshMaxAttempts;
	}

	public void setSshMaxAttempts(int sshMaxAttempts) {
		this.sshMaxAttempts = sshMaxAttempts;
	}

	/** @return the SSH <tt>StrictHostKeyChecking</tt> setting */
	public String getSshStrictHostKeyChecking() {
		return sshStrictHostKeyChecking;
	}

	public void setSshStrictHostKeyChecking(String sshStrictHostKeyChecking) {
		this.sshStrictHostKeyChecking = sshStrictHostKeyChecking;
	}

	/**
	 * @return the compiled job id pattern, or <tt>null</tt>
	 * @throws BackendInitException
	 *             if the pattern does not compile or has no group
	 */
	public Pattern compileJobIdRegex() throws BackendInitException {
		if (isBlank(jobIdRegex))
			return null;
		Pattern pattern;
		try {
			pattern = Pattern.compile(jobIdRegex);
		} catch (PatternSyntaxException e) {
			throw new BackendInitException("backend " + getName()
					+ ": bad jobIdRegex", e);
		}
		if (pattern.matcher("").groupCount() < 1)
			throw new BackendInitException("backend " + getName()
					+ ": jobIdRegex needs a capture group for the job id");
		return pattern;
	}

	@Override
	public void validate() throws BackendInitException {
		super.validate();
		if (isBlank(submit))
			throw new BackendInitException("backend " + getName()
					+ ": a submit command is required");
		if (compileJobIdRegex() != null) {
			if (isBlank(monitor))
				throw new BackendInitException("backend " + getName()
						+ ": a monitor command is required with jobIdRegex");
			if (isBlank(kill))
				throw new BackendInitException("backend " + getName()
						+ ": a kill command is required with jobIdRegex");
		}
		if (monitorInterval <= 0)
			throw new BackendInitException("backend " + getName()
					+ ": monitor frequency must be positive");
		if (locale == CommandLocale.SSH) {
			if (isBlank(sshHost))
				throw new BackendInitException("backend " + getName()
						+ ": an SSH host is required");
			if (sshMaxAttempts < 1)
				throw new BackendInitException("backend " + getName()
						+ ": SSH maxAttempts must be at least one");
		}
	}
}
