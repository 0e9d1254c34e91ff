package org.springaicommunity.oauth2.client;

/**
 * A single key/value pair of a form body or query string.
 *
 * @param name parameter name
 * @param value parameter value (not yet encoded)
 */
public record RequestParameter(String name, String value) {

	public static RequestParameter of(String name, String value) {
		return new RequestParameter(name, value);
	}

}
