package org.springaicommunity.oauth2.client;

import org.jspecify.annotations.Nullable;

/**
 * Client registration data for a single OAuth2 provider.
 *
 * <p>
 * Supplied by the embedding application and never modified by this library.
 *
 * @param clientId the client identifier issued by the provider
 * @param clientSecret the client secret issued by the provider
 * @param authorizeEndpoint the provider's authorization endpoint URL
 * @param accessTokenEndpoint the provider's token endpoint URL
 * @param redirectUri the registered redirect URI, or null to omit {@code redirect_uri}
 * from generated requests
 */
public record OAuth2Config(String clientId, String clientSecret, String authorizeEndpoint,
		String accessTokenEndpoint, @Nullable String redirectUri) {

	/**
	 * Returns true if a redirect URI is configured.
	 * @return true if {@code redirect_uri} should be sent
	 */
	public boolean hasRedirectUri() {
		return redirectUri != null && !redirectUri.isEmpty();
	}

}
