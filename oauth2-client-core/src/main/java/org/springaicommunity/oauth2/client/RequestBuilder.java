package org.springaicommunity.oauth2.client;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds token-exchange and bearer-authenticated requests.
 *
 * <p>
 * All methods are pure: they only assemble a {@link RequestSpec} and never validate the
 * URLs they are given. A malformed URL surfaces as a transport error when the request is
 * executed. Headers are not set here; see {@link HeaderPolicy}.
 */
public final class RequestBuilder {

	public static final String CODE = "code";

	public static final String REFRESH_TOKEN = "refresh_token";

	public static final String GRANT_TYPE = "grant_type";

	public static final String CLIENT_ID = "client_id";

	public static final String CLIENT_SECRET = "client_secret";

	public static final String REDIRECT_URI = "redirect_uri";

	public static final String RESPONSE_TYPE = "response_type";

	public static final String ACCESS_TOKEN = "access_token";

	public static final String GRANT_AUTHORIZATION_CODE = "authorization_code";

	public static final String GRANT_REFRESH_TOKEN = "refresh_token";

	private RequestBuilder() {
	}

	/**
	 * Build the authorization-code exchange request.
	 * @param config client registration
	 * @param code authorization code received on the redirect URI
	 * @return form POST to the token endpoint
	 */
	public static RequestSpec accessTokenRequest(OAuth2Config config, String code) {
		List<RequestParameter> parameters = new ArrayList<>();
		parameters.add(RequestParameter.of(CODE, code));
		if (config.hasRedirectUri()) {
			parameters.add(RequestParameter.of(REDIRECT_URI, config.redirectUri()));
		}
		parameters.add(RequestParameter.of(GRANT_TYPE, GRANT_AUTHORIZATION_CODE));
		parameters.addAll(clientCredentials(config));
		return RequestSpec.form(config.accessTokenEndpoint(), parameters);
	}

	/**
	 * Build the refresh-token request.
	 * @param config client registration
	 * @param refreshToken refresh token from an earlier exchange
	 * @return form POST to the token endpoint
	 */
	public static RequestSpec refreshAccessTokenRequest(OAuth2Config config, String refreshToken) {
		List<RequestParameter> parameters = new ArrayList<>();
		parameters.add(RequestParameter.of(REFRESH_TOKEN, refreshToken));
		parameters.add(RequestParameter.of(GRANT_TYPE, GRANT_REFRESH_TOKEN));
		parameters.addAll(clientCredentials(config));
		return RequestSpec.form(config.accessTokenEndpoint(), parameters);
	}

	/**
	 * Build the URL the resource owner is sent to for consent.
	 * @param config client registration
	 * @param extraParameters further query parameters such as {@code scope} or
	 * {@code state}
	 * @return authorization endpoint URL with its query
	 */
	public static String authorizationUrl(OAuth2Config config, List<RequestParameter> extraParameters) {
		List<RequestParameter> parameters = new ArrayList<>();
		parameters.add(RequestParameter.of(CLIENT_ID, config.clientId()));
		parameters.add(RequestParameter.of(RESPONSE_TYPE, CODE));
		if (config.hasRedirectUri()) {
			parameters.add(RequestParameter.of(REDIRECT_URI, config.redirectUri()));
		}
		parameters.addAll(extraParameters);
		return FormEncoding.appendQuery(config.authorizeEndpoint(), parameters);
	}

	/**
	 * Build an authenticated GET; the token travels as the {@code access_token} query
	 * parameter.
	 * @param token bearer token
	 * @param url resource URL
	 * @return GET request
	 */
	public static RequestSpec authenticatedGet(AccessToken token, String url) {
		return authenticatedRequest(token, HttpMethod.GET, url, List.of(), BodyKind.NONE, null);
	}

	/**
	 * Build an authenticated form POST; the token is appended to the form parameters.
	 * @param token bearer token
	 * @param url resource URL
	 * @param parameters caller form parameters
	 * @return form POST request
	 */
	public static RequestSpec authenticatedPostForm(AccessToken token, String url, List<RequestParameter> parameters) {
		return authenticatedRequest(token, HttpMethod.POST, url, parameters, BodyKind.FORM, null);
	}

	/**
	 * Build an authenticated POST with a raw body; the parameters and the token travel in
	 * the query string.
	 * @param token bearer token
	 * @param url resource URL
	 * @param parameters caller query parameters
	 * @param body bytes sent verbatim
	 * @return raw-body POST request
	 */
	public static RequestSpec authenticatedPostBody(AccessToken token, String url, List<RequestParameter> parameters,
			byte[] body) {
		return authenticatedRequest(token, HttpMethod.POST, url, parameters, BodyKind.RAW, body);
	}

	/**
	 * Build any authenticated request. The {@code access_token} parameter is appended
	 * after the caller parameters, so it lands in the form body for
	 * {@link BodyKind#FORM} and in the query string otherwise.
	 * @param token bearer token
	 * @param method HTTP method
	 * @param url resource URL
	 * @param parameters caller parameters
	 * @param bodyKind how the body is produced
	 * @param body bytes for {@link BodyKind#RAW}, ignored otherwise
	 * @return the request
	 */
	public static RequestSpec authenticatedRequest(AccessToken token, HttpMethod method, String url,
			List<RequestParameter> parameters, BodyKind bodyKind, byte @Nullable [] body) {
		List<RequestParameter> withToken = new ArrayList<>(parameters);
		withToken.add(RequestParameter.of(ACCESS_TOKEN, token.accessToken()));
		byte[] rawBody = bodyKind == BodyKind.RAW ? body : null;
		return new RequestSpec(method, url, withToken, bodyKind, rawBody, Map.of(), null);
	}

	private static List<RequestParameter> clientCredentials(OAuth2Config config) {
		return List.of(RequestParameter.of(CLIENT_ID, config.clientId()),
				RequestParameter.of(CLIENT_SECRET, config.clientSecret()));
	}

}
