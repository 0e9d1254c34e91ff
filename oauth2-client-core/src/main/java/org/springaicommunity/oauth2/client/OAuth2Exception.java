package org.springaicommunity.oauth2.client;

/**
 * Thrown by {@link Result#orElseThrow()} when a result holds an error.
 */
public class OAuth2Exception extends RuntimeException {

	private final OAuth2Error error;

	public OAuth2Exception(OAuth2Error error) {
		super(error.message(), error.cause());
		this.error = error;
	}

	public OAuth2Error getError() {
		return error;
	}

}
