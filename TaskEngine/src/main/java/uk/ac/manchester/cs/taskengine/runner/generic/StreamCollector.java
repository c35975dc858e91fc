package uk.ac.manchester.cs.taskengine.runner.generic;

import static org.apache.commons.io.IOUtils.closeQuietly;
import static org.apache.commons.io.IOUtils.copy;
import static org.slf4j.LoggerFactory.getLogger;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;

import org.slf4j.Logger;

/**
 * Drains one output stream of a command on its own thread, so that neither of
 * a command's streams can fill up and stall it.
 */
class StreamCollector extends Thread {
	private final InputStream input;
	private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
	private final Logger logger = getLogger(getClass());
	private IOException failure;

	StreamCollector(ThreadGroup threadGroup, InputStream input, String name) {
		super(threadGroup, name);
		this.input = input;
		setDaemon(true);
	}

	@Override
	public void run() {
		try {
			copy(input, buffer);
		} catch (IOException e) {
			logger.debug("stream closed while collecting output", e);
			synchronized (this) {
				failure = e;
			}
		} finally {
			closeQuietly(input);
		}
	}

	/**
	 * Wait for the stream to reach its end.
	 * 
	 * @return Everything read from the stream.
	 * @throws IOException
	 *             If reading failed or the wait was interrupted.
	 */
	byte[] collect() throws IOException {
		try {
			join();
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new IOException("interrupted while collecting output", e);
		}
		synchronized (this) {
			if (failure != null)
				throw failure;
		}
		return buffer.toByteArray();
	}
}
