package org.springaicommunity.oauth2.client;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Computes the fixed headers sent with every request and merges them onto a
 * {@link RequestSpec}.
 *
 * <p>
 * The header set is:
 * <ul>
 * <li>{@code Authorization: Bearer <token>}, only when a token is present</li>
 * <li>{@code User-Agent}</li>
 * <li>{@code Accept: application/json}</li>
 * <li>{@code Content-Type: application/json}</li>
 * </ul>
 * These headers come first and replace any header of the same name (case-insensitive)
 * already on the request.
 */
public final class HeaderPolicy {

	public static final String DEFAULT_USER_AGENT = "oauth2-client";

	public static final String AUTHORIZATION = "Authorization";

	public static final String USER_AGENT = "User-Agent";

	public static final String ACCEPT = "Accept";

	public static final String CONTENT_TYPE = "Content-Type";

	public static final String APPLICATION_JSON = "application/json";

	private static final HeaderPolicy DEFAULT = new HeaderPolicy(DEFAULT_USER_AGENT);

	private final String userAgent;

	public HeaderPolicy(String userAgent) {
		this.userAgent = userAgent;
	}

	/**
	 * Returns the policy with the default {@code User-Agent}.
	 * @return default HeaderPolicy
	 */
	public static HeaderPolicy defaults() {
		return DEFAULT;
	}

	public String getUserAgent() {
		return userAgent;
	}

	/**
	 * Compute the policy headers.
	 * @param token the bearer token, if the request is authenticated
	 * @return ordered headers
	 */
	public Map<String, String> headersFor(Optional<AccessToken> token) {
		Map<String, String> headers = new LinkedHashMap<>();
		token.ifPresent(t -> headers.put(AUTHORIZATION, t.bearerHeaderValue()));
		headers.put(USER_AGENT, userAgent);
		headers.put(ACCEPT, APPLICATION_JSON);
		headers.put(CONTENT_TYPE, APPLICATION_JSON);
		return headers;
	}

	/**
	 * Merge the policy headers onto a request. Existing headers with one of the policy
	 * names are dropped; all others are kept after the policy headers in their original
	 * order. An {@code Authorization} header already on the request is dropped even when
	 * no token is given.
	 * @param token the bearer token, if the request is authenticated
	 * @param request the request to decorate
	 * @return a copy of the request carrying the merged headers
	 */
	public RequestSpec apply(Optional<AccessToken> token, RequestSpec request) {
		Map<String, String> merged = headersFor(token);
		for (Map.Entry<String, String> existing : request.headers().entrySet()) {
			if (!isPolicyHeader(existing.getKey())) {
				merged.put(existing.getKey(), existing.getValue());
			}
		}
		return request.withHeaders(merged);
	}

	private static boolean isPolicyHeader(String name) {
		return AUTHORIZATION.equalsIgnoreCase(name) || USER_AGENT.equalsIgnoreCase(name)
				|| ACCEPT.equalsIgnoreCase(name) || CONTENT_TYPE.equalsIgnoreCase(name);
	}

}
