package org.springaicommunity.oauth2.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

/**
 * Access token as returned by a token endpoint (RFC 6749 section 5.1).
 *
 * <p>
 * Only {@code access_token} is required when decoding; unknown fields are ignored. Expiry
 * is informational only, nothing in this library checks it.
 *
 * @param accessToken the bearer token value
 * @param refreshToken the refresh token, if the provider issued one
 * @param expiresIn lifetime in seconds, if the provider reported one
 * @param tokenType the token type, typically {@code bearer}
 * @param scope the granted scope, if the provider reported one
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AccessToken(@JsonProperty("access_token") String accessToken,
		@JsonProperty("refresh_token") @Nullable String refreshToken,
		@JsonProperty("expires_in") @Nullable Long expiresIn, @JsonProperty("token_type") @Nullable String tokenType,
		@JsonProperty("scope") @Nullable String scope) {

	public AccessToken {
		if (accessToken == null || accessToken.isEmpty()) {
			throw new IllegalArgumentException("access_token is required");
		}
	}

	/**
	 * Create a token carrying only the access token value.
	 * @param accessToken the bearer token value
	 * @return new AccessToken
	 */
	public static AccessToken of(String accessToken) {
		return new AccessToken(accessToken, null, null, null, null);
	}

	/**
	 * Returns the value of the {@code Authorization} header for this token.
	 * @return {@code "Bearer " + accessToken}
	 */
	public String bearerHeaderValue() {
		return "Bearer " + accessToken;
	}

}
