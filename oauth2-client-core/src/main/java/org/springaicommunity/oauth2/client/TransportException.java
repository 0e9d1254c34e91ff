package org.springaicommunity.oauth2.client;

/**
 * Thrown by an {@link HttpTransport} when no HTTP response could be obtained: connection
 * refused, timeout, TLS failure, interruption or an unusable URL.
 *
 * <p>
 * The message describes the failure without any label; {@link OAuth2Error#transport}
 * adds one.
 */
public class TransportException extends RuntimeException {

	public TransportException(String message, Throwable cause) {
		super(message, cause);
	}

}
