package uk.ac.manchester.cs.taskengine.runner.generic;

import static org.apache.commons.lang3.StringUtils.isBlank;
import static org.slf4j.LoggerFactory.getLogger;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.Random;

import org.slf4j.Logger;

import com.jcraft.jsch.AgentIdentityRepository;
import com.jcraft.jsch.AgentProxyException;
import com.jcraft.jsch.ChannelExec;
import com.jcraft.jsch.IdentityRepository;
import com.jcraft.jsch.JSch;
import com.jcraft.jsch.JSchException;
import com.jcraft.jsch.SSHAgentConnector;
import com.jcraft.jsch.Session;

import uk.ac.manchester.cs.taskengine.config.GenericBackendConfig;
import uk.ac.manchester.cs.taskengine.config.GenericBackendConfig.Shell;
import uk.ac.manchester.cs.taskengine.errors.BackendInitException;

/**
 * Runs commands over one SSH session to a configured host, authenticating
 * with whatever identities the SSH agent holds.
 */
public class SshDriver implements CommandDriver {
	/** Minimum time (in ms) added to the wait between channel attempts. */
	private static final long BACKOFF_FLOOR = 300;
	/** Upper bound (in ms) on the random part of each backoff step. */
	private static final int BACKOFF_JITTER = 150;
	/** Time (in ms) between checks for the remote command finishing. */
	private static final long CLOSE_POLL_INTERVAL = 50;

	private final Logger logger = getLogger(getClass());
	private final ThreadGroup threadGroup = new ThreadGroup("SshCommand");
	private final Random random = new Random();
	private final JSch jsch;
	private final String host;
	private final int port;
	private final String username;
	private final int maxAttempts;
	private final String strictHostKeyChecking;
	private final Shell shell;
	private Session session;

	/**
	 * Connect to the configured host.
	 * 
	 * @throws BackendInitException
	 *             If the agent is unusable or the host cannot be reached.
	 */
	public SshDriver(GenericBackendConfig config) throws BackendInitException {
		host = config.getSshHost();
		port = config.getSshPort();
		username = isBlank(config.getSshUsername()) ? System
				.getProperty("user.name") : config.getSshUsername();
		maxAttempts = config.getSshMaxAttempts();
		strictHostKeyChecking = config.getSshStrictHostKeyChecking();
		shell = config.getShell();
		jsch = new JSch();
		try {
			IdentityRepository agent = new AgentIdentityRepository(
					new SSHAgentConnector());
			if (agent.getIdentities().isEmpty())
				throw new BackendInitException(
						"the SSH agent holds no identities");
			jsch.setIdentityRepository(agent);
			File knownHosts = new File(System.getProperty("user.home"),
					".ssh/known_hosts");
			if (knownHosts.isFile())
				jsch.setKnownHosts(knownHosts.getAbsolutePath());
		} catch (AgentProxyException e) {
			throw new BackendInitException("could not reach the SSH agent", e);
		} catch (JSchException e) {
			throw new BackendInitException("could not read known hosts", e);
		}
		try {
			connectedSession();
		} catch (JSchException e) {
			throw new BackendInitException("could not connect to " + username
					+ "@" + host + ":" + port, e);
		}
	}

	private synchronized Session connectedSession() throws JSchException {
		if (session == null || !session.isConnected()) {
			logger.info("opening SSH session to " + username + "@" + host
					+ ":" + port);
			Session s = jsch.getSession(username, host, port);
			s.setConfig("StrictHostKeyChecking", strictHostKeyChecking);
			s.connect();
			session = s;
		}
		return session;
	}

	/**
	 * Open an exec channel, retrying with a growing pause between attempts.
	 */
	private ChannelExec openChannel() throws IOException {
		long backoff = 0;
		for (int attempt = 1;; attempt++) {
			try {
				return (ChannelExec) connectedSession().openChannel("exec");
			} catch (JSchException e) {
				if (attempt >= maxAttempts)
					throw new IOException("could not open SSH channel to "
							+ host + " after " + attempt + " attempts", e);
				backoff += BACKOFF_FLOOR + random.nextInt(BACKOFF_JITTER + 1);
				logger.debug("failed to open SSH channel (attempt " + attempt
						+ "); retrying in " + backoff + "ms", e);
				try {
					Thread.sleep(backoff);
				} catch (InterruptedException ie) {
					Thread.currentThread().interrupt();
					throw new IOException("interrupted opening SSH channel", ie);
				}
			}
		}
	}

	@Override
	public CommandOutput run(String command) throws IOException {
		String line = shell == Shell.SH ? "sh -c " + ShellQuoting.quote(command)
				: "bash -c " + ShellQuoting.quote(command);
		logger.debug("running on " + host + ": " + line);
		ChannelExec channel = openChannel();
		try {
			channel.setCommand(line);
			channel.setInputStream(null);
			InputStream out = channel.getInputStream();
			InputStream err = channel.getErrStream();
			StreamCollector stdout = new StreamCollector(threadGroup, out,
					"SshCommand stdout");
			StreamCollector stderr = new StreamCollector(threadGroup, err,
					"SshCommand stderr");
			try {
				channel.connect();
			} catch (JSchException e) {
				throw new IOException("could not start command on " + host, e);
			}
			stdout.start();
			stderr.start();
			while (!channel.isClosed()) {
				try {
					Thread.sleep(CLOSE_POLL_INTERVAL);
				} catch (InterruptedException e) {
					Thread.currentThread().interrupt();
					throw new IOException("interrupted while running "
							+ command, e);
				}
			}
			CommandOutput output = new CommandOutput(channel.getExitStatus(),
					stdout.collect(), stderr.collect());
			logger.debug("remote command finished: " + output);
			return output;
		} finally {
			channel.disconnect();
		}
	}

	@Override
	public synchronized void close() {
		if (session != null) {
			session.disconnect();
			session = null;
		}
	}
}
