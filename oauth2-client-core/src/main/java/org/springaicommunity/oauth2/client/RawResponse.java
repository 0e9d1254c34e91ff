package org.springaicommunity.oauth2.client;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Status, headers and body of an HTTP response as delivered by an {@link HttpTransport}.
 *
 * @param statusCode HTTP status code
 * @param headers response headers
 * @param body response body bytes, empty if the response had none
 */
public record RawResponse(int statusCode, Map<String, List<String>> headers, byte[] body) {

	public RawResponse {
		headers = Map.copyOf(headers);
		body = body.clone();
	}

	/**
	 * Create a response without headers.
	 * @param statusCode HTTP status code
	 * @param body body text, encoded as UTF-8
	 * @return new RawResponse
	 */
	public static RawResponse of(int statusCode, String body) {
		return new RawResponse(statusCode, Map.of(), body.getBytes(StandardCharsets.UTF_8));
	}

	@Override
	public byte[] body() {
		return body.clone();
	}

	/**
	 * Returns the body decoded as UTF-8.
	 * @return body text
	 */
	public String bodyAsString() {
		return new String(body, StandardCharsets.UTF_8);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof RawResponse)) {
			return false;
		}
		RawResponse that = (RawResponse) o;
		return statusCode == that.statusCode && headers.equals(that.headers) && Arrays.equals(body, that.body);
	}

	@Override
	public int hashCode() {
		return 31 * Objects.hash(statusCode, headers) + Arrays.hashCode(body);
	}

	@Override
	public String toString() {
		return "RawResponse[statusCode=" + statusCode + ", headers=" + headers.keySet() + ", body=" + body.length
				+ " bytes]";
	}

}
