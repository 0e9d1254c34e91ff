package org.springaicommunity.oauth2.client;

/**
 * How the body of a {@link RequestSpec} is produced.
 */
public enum BodyKind {

	/**
	 * No body. Parameters, if any, travel in the query string.
	 */
	NONE,

	/**
	 * Parameters are sent as an {@code application/x-www-form-urlencoded} body.
	 */
	FORM,

	/**
	 * Caller-supplied bytes are sent verbatim. Parameters travel in the query string.
	 */
	RAW

}
