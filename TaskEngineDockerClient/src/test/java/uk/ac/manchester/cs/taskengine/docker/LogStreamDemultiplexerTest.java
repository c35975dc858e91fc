package uk.ac.manchester.cs.taskengine.docker;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.Assert.assertEquals;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.junit.Test;

public class LogStreamDemultiplexerTest {
	private static void frame(ByteArrayOutputStream out, int stream,
			String text) {
		byte[] payload = text.getBytes(UTF_8);
		out.write(stream);
		out.write(0);
		out.write(0);
		out.write(0);
		out.write((payload.length >>> 24) & 0xff);
		out.write((payload.length >>> 16) & 0xff);
		out.write((payload.length >>> 8) & 0xff);
		out.write(payload.length & 0xff);
		out.write(payload, 0, payload.length);
	}

	@Test
	public void splitsStreams() throws IOException {
		ByteArrayOutputStream raw = new ByteArrayOutputStream();
		frame(raw, 1, "hel");
		frame(raw, 2, "oops\n");
		frame(raw, 1, "lo\n");
		final List<String> seen = new ArrayList<>();
		ContainerOutput output = LogStreamDemultiplexer.demultiplex(
				new ByteArrayInputStream(raw.toByteArray()),
				new ContainerEngine.OutputListener() {
					@Override
					public void output(boolean stderr, byte[] chunk) {
						seen.add((stderr ? "E:" : "O:")
								+ new String(chunk, UTF_8));
					}
				});
		assertEquals("hello\n", new String(output.getStdout(), UTF_8));
		assertEquals("oops\n", new String(output.getStderr(), UTF_8));
		assertEquals(3, seen.size());
		assertEquals("E:oops\n", seen.get(1));
	}

	@Test
	public void emptyStreamIsEmptyOutput() throws IOException {
		ContainerOutput output = LogStreamDemultiplexer.demultiplex(
				new ByteArrayInputStream(new byte[0]), null);
		assertEquals(0, output.getStdout().length);
		assertEquals(0, output.getStderr().length);
	}

	@Test(expected = EOFException.class)
	public void truncatedPayloadFails() throws IOException {
		ByteArrayOutputStream raw = new ByteArrayOutputStream();
		frame(raw, 1, "hello");
		byte[] bytes = raw.toByteArray();
		byte[] cut = new byte[bytes.length - 2];
		System.arraycopy(bytes, 0, cut, 0, cut.length);
		LogStreamDemultiplexer.demultiplex(new ByteArrayInputStream(cut), null);
	}
}
