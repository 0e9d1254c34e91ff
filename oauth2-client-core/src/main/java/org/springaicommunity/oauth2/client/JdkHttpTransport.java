package org.springaicommunity.oauth2.client;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

/**
 * {@link HttpTransport} over the Java 11+ {@link HttpClient}.
 *
 * <p>
 * Connection pooling, TLS and redirects are left to the JDK client. The per-request
 * timeout comes from {@link RequestSpec#timeout()}, falling back to the configured
 * default.
 */
public class JdkHttpTransport implements HttpTransport {

	private static final Logger logger = LoggerFactory.getLogger(JdkHttpTransport.class);

	private final HttpClient httpClient;

	private final @Nullable Duration defaultRequestTimeout;

	public JdkHttpTransport() {
		this(new OAuth2ClientProperties());
	}

	public JdkHttpTransport(OAuth2ClientProperties properties) {
		this.httpClient = HttpClient.newBuilder()
			.connectTimeout(Duration.ofSeconds(properties.getConnectTimeoutSeconds()))
			.followRedirects(properties.isFollowRedirects() ? HttpClient.Redirect.NORMAL : HttpClient.Redirect.NEVER)
			.build();
		this.defaultRequestTimeout = properties.getRequestTimeoutSeconds() > 0
				? Duration.ofSeconds(properties.getRequestTimeoutSeconds()) : null;
	}

	@Override
	public RawResponse execute(RequestSpec request) {
		String url = request.targetUrl();
		logger.debug("{} {}", request.method(), request.url());
		long start = System.currentTimeMillis();

		try {
			HttpResponse<byte[]> response = httpClient.send(toHttpRequest(request, url),
					HttpResponse.BodyHandlers.ofByteArray());
			byte[] body = response.body() != null ? response.body() : new byte[0];
			logger.debug("{} {} completed in {}ms with status {} ({} bytes)", request.method(), request.url(),
					System.currentTimeMillis() - start, response.statusCode(), body.length);
			return new RawResponse(response.statusCode(), response.headers().map(), body);
		}
		catch (IOException e) {
			logger.debug("{} {} failed after {}ms: {}", request.method(), request.url(),
					System.currentTimeMillis() - start, e.getMessage());
			throw new TransportException(describe(e), e);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new TransportException("Request interrupted", e);
		}
	}

	// the JDK client leaves the message of a refused connection null
	private static String describe(IOException e) {
		return e.getMessage() != null ? e.getMessage() : e.getClass().getName();
	}

	private HttpRequest toHttpRequest(RequestSpec request, String url) {
		HttpRequest.Builder builder;
		try {
			builder = HttpRequest.newBuilder().uri(URI.create(url));
		}
		catch (IllegalArgumentException e) {
			throw new TransportException("Invalid URL: " + request.url(), e);
		}

		for (Map.Entry<String, String> header : request.headers().entrySet()) {
			builder.header(header.getKey(), header.getValue());
		}

		Duration timeout = request.timeout() != null ? request.timeout() : defaultRequestTimeout;
		if (timeout != null) {
			builder.timeout(timeout);
		}

		if (request.method() == HttpMethod.POST) {
			builder.POST(HttpRequest.BodyPublishers.ofByteArray(request.bodyBytes()));
		}
		else {
			builder.GET();
		}
		return builder.build();
	}

}
