package uk.ac.manchester.cs.taskengine.rest.utils;

import static org.slf4j.LoggerFactory.getLogger;

import java.io.IOException;

import org.apache.http.impl.client.DefaultHttpRequestRetryHandler;
import org.apache.http.protocol.HttpContext;
import org.slf4j.Logger;

/**
 * Retries requests that failed in transport, up to a fixed budget per request.
 * A request with a body that was completely sent is never sent again, as the
 * server may already have acted on it.
 */
public class TransientErrorRetryHandler extends DefaultHttpRequestRetryHandler {
	private final Logger log = getLogger(getClass());

	/**
	 * @param retries
	 *            How many times a request may be retried after its first
	 *            attempt.
	 */
	public TransientErrorRetryHandler(int retries) {
		super(checkRetries(retries), false);
	}

	private static int checkRetries(int retries) {
		if (retries < 0)
			throw new IllegalArgumentException("retries must not be negative");
		return retries;
	}

	@Override
	public boolean retryRequest(IOException exception, int executionCount,
			HttpContext context) {
		if (!super.retryRequest(exception, executionCount, context))
			return false;
		log.debug("retrying request (attempt " + (executionCount + 1)
				+ " of " + (getRetryCount() + 1) + ") after " + exception);
		return true;
	}
}
