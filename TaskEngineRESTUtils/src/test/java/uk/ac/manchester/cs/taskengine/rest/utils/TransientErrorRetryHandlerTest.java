package uk.ac.manchester.cs.taskengine.rest.utils;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketException;
import java.net.UnknownHostException;

import org.apache.http.HttpRequest;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.client.protocol.HttpClientContext;
import org.apache.http.protocol.HttpCoreContext;
import org.junit.Test;

public class TransientErrorRetryHandlerTest {
	private static HttpClientContext context(HttpRequest request, boolean sent) {
		HttpClientContext context = HttpClientContext.create();
		context.setAttribute(HttpCoreContext.HTTP_REQUEST, request);
		context.setAttribute(HttpCoreContext.HTTP_REQ_SENT, sent);
		return context;
	}

	@Test
	public void retriesWithinBudget() {
		TransientErrorRetryHandler handler = new TransientErrorRetryHandler(3);
		HttpClientContext ctx = context(new HttpGet("http://example.org/"),
				true);
		IOException failure = new SocketException("connection reset");
		assertTrue(handler.retryRequest(failure, 1, ctx));
		assertTrue(handler.retryRequest(failure, 3, ctx));
		assertFalse(handler.retryRequest(failure, 4, ctx));
	}

	@Test
	public void zeroBudgetNeverRetries() {
		TransientErrorRetryHandler handler = new TransientErrorRetryHandler(0);
		assertFalse(handler.retryRequest(new IOException("reset"), 1,
				context(new HttpGet("http://example.org/"), false)));
	}

	@Test
	public void sentBodiesAreNotResent() {
		TransientErrorRetryHandler handler = new TransientErrorRetryHandler(3);
		IOException failure = new IOException("connection reset");
		assertFalse(handler.retryRequest(failure, 1,
				context(new HttpPost("http://example.org/tasks"), true)));
		assertTrue(handler.retryRequest(failure, 1,
				context(new HttpPost("http://example.org/tasks"), false)));
	}

	@Test
	public void unknownHostIsNotTransient() {
		TransientErrorRetryHandler handler = new TransientErrorRetryHandler(3);
		assertFalse(handler.retryRequest(new UnknownHostException("nowhere"),
				1, context(new HttpGet("http://nowhere/"), false)));
	}

	@Test
	public void refusedConnectionsAreNotRetried() {
		TransientErrorRetryHandler handler = new TransientErrorRetryHandler(3);
		assertFalse(handler.retryRequest(new ConnectException("refused"), 1,
				context(new HttpGet("http://example.org/"), false)));
	}

	@Test
	public void budgetIsTheRetryCount() {
		assertEquals(3, new TransientErrorRetryHandler(3).getRetryCount());
	}

	@Test(expected = IllegalArgumentException.class)
	public void negativeBudgetIsRejected() {
		new TransientErrorRetryHandler(-1);
	}
}
