package uk.ac.manchester.cs.taskengine.rest.utils;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;
import static javax.ws.rs.core.HttpHeaders.AUTHORIZATION;

import java.io.IOException;
import java.util.Base64;

import javax.ws.rs.client.ClientRequestContext;
import javax.ws.rs.client.ClientRequestFilter;
import javax.ws.rs.ext.Provider;

/**
 * Adds a fixed <tt>Authorization</tt> header to every request. The header is
 * computed once, so one filter can serve any number of concurrent requests.
 */
@Provider
public class AuthorizationFilter implements ClientRequestFilter {
	private final String headerValue;

	private AuthorizationFilter(String headerValue) {
		this.headerValue = headerValue;
	}

	/**
	 * @param username
	 *            Who to authenticate as.
	 * @param password
	 *            Their password.
	 * @return A filter for HTTP BASIC authentication.
	 */
	public static AuthorizationFilter basic(String username, String password) {
		String pair = requireNonNull(username) + ":" + requireNonNull(password);
		return new AuthorizationFilter("Basic "
				+ Base64.getEncoder().encodeToString(pair.getBytes(UTF_8)));
	}

	/**
	 * @param token
	 *            The bearer token.
	 * @return A filter for bearer token authentication.
	 */
	public static AuthorizationFilter bearer(String token) {
		return new AuthorizationFilter("Bearer " + requireNonNull(token));
	}

	/** @return The value this filter puts in the header. */
	public String getHeaderValue() {
		return headerValue;
	}

	@Override
	public void filter(ClientRequestContext requestContext)
			throws IOException {
		requestContext.getHeaders().putSingle(AUTHORIZATION, headerValue);
	}
}
