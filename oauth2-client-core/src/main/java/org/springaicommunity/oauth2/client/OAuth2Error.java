package org.springaicommunity.oauth2.client;

import org.jspecify.annotations.Nullable;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * Error branch of a {@link Result}.
 *
 * <p>
 * The payload always carries diagnostic bytes: a fixed label followed by the response
 * body for {@link Kind#HTTP_STATUS} and {@link Kind#DECODE}, or a description of the
 * failure for {@link Kind#TRANSPORT}.
 */
public final class OAuth2Error {

	/**
	 * Prefix of the payload of every non-200 response.
	 */
	public static final String HTTP_STATUS_LABEL = "Gaining token failed: ";

	/**
	 * Prefix of the payload of every 200 response whose body could not be decoded.
	 */
	public static final String DECODE_LABEL = "Could not decode JSON: ";

	/**
	 * Prefix of the payload of every failure to obtain a response.
	 */
	public static final String TRANSPORT_LABEL = "HTTP request failed: ";

	/**
	 * Where the exchange failed.
	 */
	public enum Kind {

		/**
		 * No HTTP response was obtained (connection refused, timeout, TLS failure).
		 */
		TRANSPORT,

		/**
		 * A response was received with a status other than 200.
		 */
		HTTP_STATUS,

		/**
		 * A 200 response whose body did not decode into the expected type.
		 */
		DECODE

	}

	private final Kind kind;

	private final byte[] payload;

	private final int statusCode;

	private final @Nullable Throwable cause;

	private OAuth2Error(Kind kind, byte[] payload, int statusCode, @Nullable Throwable cause) {
		this.kind = kind;
		this.payload = payload;
		this.statusCode = statusCode;
		this.cause = cause;
	}

	/**
	 * Create the error for a response with a status other than 200.
	 * @param statusCode HTTP status code
	 * @param body response body
	 * @return new OAuth2Error with payload {@link #HTTP_STATUS_LABEL} + body
	 */
	public static OAuth2Error httpStatus(int statusCode, byte[] body) {
		return new OAuth2Error(Kind.HTTP_STATUS, labelled(HTTP_STATUS_LABEL, body), statusCode, null);
	}

	/**
	 * Create the error for a body that did not decode.
	 * @param body the offending body
	 * @param cause the decoder failure, if any
	 * @return new OAuth2Error with payload {@link #DECODE_LABEL} + body
	 */
	public static OAuth2Error decode(byte[] body, @Nullable Throwable cause) {
		return new OAuth2Error(Kind.DECODE, labelled(DECODE_LABEL, body), 200, cause);
	}

	/**
	 * Create the error for a request that produced no response.
	 * @param cause the transport failure
	 * @return new OAuth2Error with payload {@link #TRANSPORT_LABEL} + failure message
	 */
	public static OAuth2Error transport(Throwable cause) {
		String detail = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getName();
		return new OAuth2Error(Kind.TRANSPORT, labelled(TRANSPORT_LABEL, detail.getBytes(StandardCharsets.UTF_8)),
				-1, cause);
	}

	private static byte[] labelled(String label, byte[] body) {
		byte[] prefix = label.getBytes(StandardCharsets.UTF_8);
		byte[] result = Arrays.copyOf(prefix, prefix.length + body.length);
		System.arraycopy(body, 0, result, prefix.length, body.length);
		return result;
	}

	public Kind kind() {
		return kind;
	}

	/**
	 * Returns the diagnostic payload.
	 * @return label followed by the response body or failure description
	 */
	public byte[] payload() {
		return payload.clone();
	}

	/**
	 * Returns the payload decoded as UTF-8.
	 * @return diagnostic text
	 */
	public String message() {
		return new String(payload, StandardCharsets.UTF_8);
	}

	/**
	 * Returns the HTTP status of the response, or -1 for {@link Kind#TRANSPORT} errors.
	 * @return status code or -1
	 */
	public int statusCode() {
		return statusCode;
	}

	@Nullable
	public Throwable cause() {
		return cause;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof OAuth2Error)) {
			return false;
		}
		OAuth2Error that = (OAuth2Error) o;
		return kind == that.kind && statusCode == that.statusCode && Arrays.equals(payload, that.payload)
				&& Objects.equals(cause, that.cause);
	}

	@Override
	public int hashCode() {
		return 31 * Objects.hash(kind, statusCode, cause) + Arrays.hashCode(payload);
	}

	@Override
	public String toString() {
		return "OAuth2Error[kind=" + kind + ", statusCode=" + statusCode + ", message=" + message() + "]";
	}

}
