package uk.ac.manchester.cs.taskengine.rest.utils;

import static org.slf4j.LoggerFactory.getLogger;

import java.net.URL;

import javax.ws.rs.client.ClientRequestFilter;

import org.apache.http.client.config.RequestConfig;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.apache.http.impl.conn.PoolingHttpClientConnectionManager;
import org.jboss.resteasy.client.jaxrs.ResteasyClient;
import org.jboss.resteasy.client.jaxrs.ResteasyClientBuilder;
import org.jboss.resteasy.client.jaxrs.engines.ApacheHttpClient4Engine;
import org.slf4j.Logger;

public abstract class RestClientUtils {
	private static Logger log = getLogger(RestClientUtils.class);
	/** Connections kept per client; clients are shared by concurrent tasks. */
	private static final int MAX_CONNECTIONS = 32;
	/** Time (in ms) allowed to establish a connection. */
	private static final int CONNECT_TIMEOUT = 30000;
	/** The retry budget used when the caller does not give one. */
	public static final int DEFAULT_RETRIES = 3;

	private RestClientUtils() {
	}

	/**
	 * Create a REST client with a pooled, retrying HTTP engine. The client is
	 * safe for use by many threads at once.
	 * 
	 * @param authorization
	 *            How to authenticate, or <tt>null</tt> for no authentication
	 * @param retries
	 *            How many times a request failing in transport is retried
	 * @return The client, which the caller must close when finished with it
	 */
	public static ResteasyClient createRestClient(
			ClientRequestFilter authorization, int retries) {
		PoolingHttpClientConnectionManager cm = new PoolingHttpClientConnectionManager();
		cm.setMaxTotal(MAX_CONNECTIONS);
		cm.setDefaultMaxPerRoute(MAX_CONNECTIONS);
		CloseableHttpClient httpClient = HttpClients
				.custom()
				.setConnectionManager(cm)
				.setRetryHandler(new TransientErrorRetryHandler(retries))
				.setDefaultRequestConfig(
						RequestConfig.custom()
								.setConnectTimeout(CONNECT_TIMEOUT).build())
				.build();
		ApacheHttpClient4Engine engine = new ApacheHttpClient4Engine(
				httpClient, true);

		ResteasyClient client = new ResteasyClientBuilder().httpEngine(engine)
				.build();
		client.register(new ErrorCaptureResponseFilter());
		client.register(new CustomJacksonJsonProvider());
		if (authorization != null)
			client.register(authorization);
		log.debug("created REST client with retry budget " + retries);
		return client;
	}

	/**
	 * Create a REST client proxy for a class to the given URL
	 * 
	 * @param url
	 *            The URL of the REST service
	 * @param authorization
	 *            How to authenticate, or <tt>null</tt> for no authentication
	 * @param retries
	 *            How many times a request failing in transport is retried
	 * @param clazz
	 *            The interface to proxy
	 * @param providers
	 *            The objects to register with the underlying client
	 * @return The proxy instance
	 */
	public static <T> T createClient(URL url,
			ClientRequestFilter authorization, int retries, Class<T> clazz,
			Object... providers) {
		ResteasyClient client = createRestClient(authorization, retries);
		for (Object provider : providers)
			client.register(provider);
		return client.target(url.toString()).proxy(clazz);
	}

	/**
	 * Create a new REST client with no authentication.
	 * 
	 * @param url
	 *            The URL of the REST service
	 * @param retries
	 *            How many times a request failing in transport is retried
	 * @param clazz
	 *            The interface to proxy
	 * @return The proxy instance
	 */
	public static <T> T createUnauthenticatedClient(URL url, int retries,
			Class<T> clazz, Object... providers) {
		return createClient(url, null, retries, clazz, providers);
	}

	/**
	 * Create a new REST client with BASIC authentication.
	 * 
	 * @param url
	 *            The URL of the REST service
	 * @param username
	 *            The user name of the user accessing the service
	 * @param password
	 *            The password for authentication
	 * @param retries
	 *            How many times a request failing in transport is retried
	 * @param clazz
	 *            The interface to proxy
	 * @return The proxy instance
	 */
	public static <T> T createBasicClient(URL url, String username,
			String password, int retries, Class<T> clazz, Object... providers) {
		return createClient(url, AuthorizationFilter.basic(username, password),
				retries, clazz, providers);
	}

	/**
	 * Create a new REST client with Bearer authentication.
	 * 
	 * @param url
	 *            The URL of the REST service
	 * @param token
	 *            The Bearer token for authentication
	 * @param retries
	 *            How many times a request failing in transport is retried
	 * @param clazz
	 *            The interface to proxy
	 * @return The proxy instance
	 */
	public static <T> T createBearerClient(URL url, String token, int retries,
			Class<T> clazz, Object... providers) {
		return createClient(url, AuthorizationFilter.bearer(token), retries,
				clazz, providers);
	}
}
