package org.springaicommunity.oauth2.client;

import org.jspecify.annotations.Nullable;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A fully described outgoing request: method, target URL, ordered parameters, body and
 * headers.
 *
 * <p>
 * Instances are immutable. {@link #withHeaders(Map)} and {@link #withTimeout(Duration)}
 * return modified copies. Where the parameters travel depends on {@link #bodyKind()}: in
 * the form body for {@link BodyKind#FORM}, in the query string otherwise.
 *
 * @param method HTTP method
 * @param url target URL as given by the caller, not validated
 * @param parameters ordered form or query parameters
 * @param bodyKind how the body is produced
 * @param rawBody bytes sent verbatim for {@link BodyKind#RAW}, null otherwise
 * @param headers ordered request headers
 * @param timeout per-request timeout passed to the transport, or null for its default
 */
public record RequestSpec(HttpMethod method, String url, List<RequestParameter> parameters, BodyKind bodyKind,
		byte @Nullable [] rawBody, Map<String, String> headers, @Nullable Duration timeout) {

	public RequestSpec {
		parameters = List.copyOf(parameters);
		headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
		rawBody = rawBody != null ? rawBody.clone() : null;
		if (method == HttpMethod.GET && bodyKind != BodyKind.NONE) {
			throw new IllegalArgumentException("A GET request cannot carry a " + bodyKind + " body");
		}
		if (bodyKind == BodyKind.RAW && rawBody == null) {
			throw new IllegalArgumentException("A RAW request requires a body");
		}
	}

	/**
	 * Create a POST request whose parameters form an url-encoded body.
	 * @param url target URL
	 * @param parameters form parameters
	 * @return new RequestSpec
	 */
	public static RequestSpec form(String url, List<RequestParameter> parameters) {
		return new RequestSpec(HttpMethod.POST, url, parameters, BodyKind.FORM, null, Map.of(), null);
	}

	/**
	 * Create a GET request whose parameters are appended to the query string.
	 * @param url target URL
	 * @param parameters query parameters
	 * @return new RequestSpec
	 */
	public static RequestSpec get(String url, List<RequestParameter> parameters) {
		return new RequestSpec(HttpMethod.GET, url, parameters, BodyKind.NONE, null, Map.of(), null);
	}

	@Override
	public byte @Nullable [] rawBody() {
		return rawBody != null ? rawBody.clone() : null;
	}

	/**
	 * Returns the URL the transport should call, including any query parameters.
	 * @return target URL
	 */
	public String targetUrl() {
		if (bodyKind == BodyKind.FORM) {
			return url;
		}
		return FormEncoding.appendQuery(url, parameters);
	}

	/**
	 * Returns the bytes to send as request body.
	 * @return body bytes, empty for {@link BodyKind#NONE}
	 */
	public byte[] bodyBytes() {
		switch (bodyKind) {
			case FORM:
				return FormEncoding.encode(parameters).getBytes(StandardCharsets.UTF_8);
			case RAW:
				return rawBody();
			default:
				return new byte[0];
		}
	}

	/**
	 * Returns the value of a header, matching the name case-insensitively.
	 * @param name header name
	 * @return header value, or null if absent
	 */
	@Nullable
	public String header(String name) {
		for (Map.Entry<String, String> entry : headers.entrySet()) {
			if (entry.getKey().equalsIgnoreCase(name)) {
				return entry.getValue();
			}
		}
		return null;
	}

	/**
	 * Returns a copy of this request with the given headers in place of the current ones.
	 * @param newHeaders ordered headers
	 * @return new RequestSpec
	 */
	public RequestSpec withHeaders(Map<String, String> newHeaders) {
		return new RequestSpec(method, url, parameters, bodyKind, rawBody, newHeaders, timeout);
	}

	/**
	 * Returns a copy of this request with a per-request timeout.
	 * @param newTimeout timeout handed to the transport
	 * @return new RequestSpec
	 */
	public RequestSpec withTimeout(@Nullable Duration newTimeout) {
		return new RequestSpec(method, url, parameters, bodyKind, rawBody, headers, newTimeout);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof RequestSpec)) {
			return false;
		}
		RequestSpec that = (RequestSpec) o;
		return method == that.method && url.equals(that.url) && parameters.equals(that.parameters)
				&& bodyKind == that.bodyKind && Arrays.equals(rawBody, that.rawBody) && headers.equals(that.headers)
				&& Objects.equals(timeout, that.timeout);
	}

	@Override
	public int hashCode() {
		int result = Objects.hash(method, url, parameters, bodyKind, headers, timeout);
		return 31 * result + Arrays.hashCode(rawBody);
	}

	@Override
	public String toString() {
		return "RequestSpec[method=" + method + ", url=" + url + ", parameters=" + parameters.size() + ", bodyKind="
				+ bodyKind + ", headers=" + headers.keySet() + ", timeout=" + timeout + "]";
	}

}
