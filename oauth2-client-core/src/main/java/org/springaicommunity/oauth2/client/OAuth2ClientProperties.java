package org.springaicommunity.oauth2.client;

/**
 * Configuration properties for the OAuth2 client transport and headers.
 *
 * <p>
 * Properties can be set directly via setters or passed to {@link OAuth2ClientBuilder}.
 * Defaults suit most providers.
 */
public class OAuth2ClientProperties {

	/**
	 * Value of the {@code User-Agent} header.
	 */
	private String userAgent = HeaderPolicy.DEFAULT_USER_AGENT;

	/**
	 * Connect timeout in seconds.
	 */
	private int connectTimeoutSeconds = 30;

	/**
	 * Default per-request timeout in seconds, 0 to wait indefinitely. A timeout set on
	 * the request itself takes precedence.
	 */
	private int requestTimeoutSeconds = 0;

	/**
	 * Whether the transport follows redirects.
	 */
	private boolean followRedirects = true;

	public String getUserAgent() {
		return userAgent;
	}

	public void setUserAgent(String userAgent) {
		this.userAgent = userAgent;
	}

	/**
	 * Returns the connect timeout in seconds.
	 * @return the connect timeout
	 */
	public int getConnectTimeoutSeconds() {
		return connectTimeoutSeconds;
	}

	public void setConnectTimeoutSeconds(int connectTimeoutSeconds) {
		this.connectTimeoutSeconds = connectTimeoutSeconds;
	}

	/**
	 * Returns the default request timeout in seconds.
	 * @return the request timeout, 0 if none
	 */
	public int getRequestTimeoutSeconds() {
		return requestTimeoutSeconds;
	}

	public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
		this.requestTimeoutSeconds = requestTimeoutSeconds;
	}

	public boolean isFollowRedirects() {
		return followRedirects;
	}

	public void setFollowRedirects(boolean followRedirects) {
		this.followRedirects = followRedirects;
	}

}
