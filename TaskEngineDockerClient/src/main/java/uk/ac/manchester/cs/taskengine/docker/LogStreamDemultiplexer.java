package uk.ac.manchester.cs.taskengine.docker;

import static org.apache.commons.io.IOUtils.readFully;

import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;

/**
 * Splits the daemon's multiplexed log stream back into standard output and
 * standard error. Each frame is an eight byte header (stream id, three bytes
 * of padding, big-endian payload length) followed by the payload.
 */
public abstract class LogStreamDemultiplexer {
	private static final int HEADER_LENGTH = 8;
	private static final int STDERR = 2;

	private LogStreamDemultiplexer() {
	}

	/**
	 * Read frames until the stream ends.
	 * 
	 * @param stream
	 *            The stream to read. Not closed by this method.
	 * @param listener
	 *            Told of each frame; may be <tt>null</tt>.
	 * @return What was written to each of the streams.
	 * @throws IOException
	 *             If reading fails or a frame is cut short.
	 */
	public static ContainerOutput demultiplex(InputStream stream,
			ContainerEngine.OutputListener listener) throws IOException {
		ByteArrayOutputStream stdout = new ByteArrayOutputStream();
		ByteArrayOutputStream stderr = new ByteArrayOutputStream();
		byte[] header = new byte[HEADER_LENGTH];
		while (readHeader(stream, header)) {
			int length = ((header[4] & 0xff) << 24)
					| ((header[5] & 0xff) << 16) | ((header[6] & 0xff) << 8)
					| (header[7] & 0xff);
			if (length < 0)
				throw new IOException("log frame too large");
			byte[] payload = new byte[length];
			readFully(stream, payload);
			boolean isError = header[0] == STDERR;
			(isError ? stderr : stdout).write(payload);
			if (listener != null)
				listener.output(isError, payload);
		}
		return new ContainerOutput(stdout.toByteArray(), stderr.toByteArray());
	}

	/** @return false at a clean end of stream */
	private static boolean readHeader(InputStream stream, byte[] header)
			throws IOException {
		int got = 0;
		while (got < header.length) {
			int n = stream.read(header, got, header.length - got);
			if (n < 0) {
				if (got == 0)
					return false;
				throw new EOFException("log frame header cut short");
			}
			got += n;
		}
		return true;
	}
}
