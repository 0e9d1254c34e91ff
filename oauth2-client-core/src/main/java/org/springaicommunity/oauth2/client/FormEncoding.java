package org.springaicommunity.oauth2.client;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.stream.Collectors;

/**
 * {@code application/x-www-form-urlencoded} encoding of ordered parameters, used both for
 * form bodies and for query strings.
 */
public final class FormEncoding {

	private FormEncoding() {
	}

	/**
	 * Encode parameters as {@code key=value} pairs joined with {@code &}, preserving order.
	 * @param parameters parameters to encode
	 * @return encoded string, empty if there are no parameters
	 */
	public static String encode(List<RequestParameter> parameters) {
		return parameters.stream()
			.map(p -> encodeComponent(p.name()) + "=" + encodeComponent(p.value()))
			.collect(Collectors.joining("&"));
	}

	/**
	 * Append parameters to the query string of a URL, ahead of any fragment. The URL is
	 * not validated.
	 * @param url base URL, with or without an existing query
	 * @param parameters parameters to append
	 * @return the URL with the encoded parameters appended
	 */
	public static String appendQuery(String url, List<RequestParameter> parameters) {
		if (parameters.isEmpty()) {
			return url;
		}
		int hash = url.indexOf('#');
		if (hash >= 0) {
			return appendQuery(url.substring(0, hash), parameters) + url.substring(hash);
		}
		String separator;
		if (!url.contains("?")) {
			separator = "?";
		}
		else if (url.endsWith("?") || url.endsWith("&")) {
			separator = "";
		}
		else {
			separator = "&";
		}
		return url + separator + encode(parameters);
	}

	private static String encodeComponent(String value) {
		return URLEncoder.encode(value, StandardCharsets.UTF_8);
	}

}
