package org.springaicommunity.oauth2.client;

import com.fasterxml.jackson.core.type.TypeReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * OAuth2 client: exchanges authorization codes and refresh tokens for access tokens and
 * issues bearer-authenticated requests.
 *
 * <p>
 * Every call is one request/response round trip: the request is built by
 * {@link RequestBuilder}, decorated by {@link HeaderPolicy}, executed by an
 * {@link HttpTransport} and interpreted by {@link ResponseInterpreter}. Failures are
 * returned as {@link Result} errors, never thrown. The client keeps no mutable state and
 * can be shared between threads.
 *
 * <p>
 * Example usage:
 *
 * <pre>
 * {@code
 * OAuth2HttpClient client = OAuth2ClientBuilder.create()
 *     .config(new OAuth2Config(clientId, secret, authorizeUrl, tokenUrl, redirectUri))
 *     .build();
 *
 * Result<AccessToken> token = client.fetchAccessToken(code);
 * Result<Profile> profile = token.flatMap(t -> client.authGetJson(t, profileUrl, Profile.class));
 * }
 * </pre>
 */
public class OAuth2HttpClient {

	private static final Logger logger = LoggerFactory.getLogger(OAuth2HttpClient.class);

	private final OAuth2Config config;

	private final HttpTransport transport;

	private final HeaderPolicy headerPolicy;

	private final ResponseInterpreter interpreter;

	public OAuth2HttpClient(OAuth2Config config, HttpTransport transport, HeaderPolicy headerPolicy,
			ResponseInterpreter interpreter) {
		this.config = config;
		this.transport = transport;
		this.headerPolicy = headerPolicy;
		this.interpreter = interpreter;
	}

	public OAuth2Config getConfig() {
		return config;
	}

	// ========== Token acquisition ==========

	/**
	 * Exchange an authorization code for an access token.
	 * @param code authorization code received on the redirect URI
	 * @return the access token, or the error
	 */
	public Result<AccessToken> fetchAccessToken(String code) {
		logger.debug("Exchanging authorization code at {}", config.accessTokenEndpoint());
		return interpreter.decodeJson(send(Optional.empty(), RequestBuilder.accessTokenRequest(config, code)),
				AccessToken.class);
	}

	/**
	 * Obtain a new access token with a refresh token.
	 * @param refreshToken refresh token from an earlier exchange
	 * @return the new access token, or the error
	 */
	public Result<AccessToken> fetchRefreshToken(String refreshToken) {
		logger.debug("Refreshing access token at {}", config.accessTokenEndpoint());
		return interpreter.decodeJson(
				send(Optional.empty(), RequestBuilder.refreshAccessTokenRequest(config, refreshToken)),
				AccessToken.class);
	}

	/**
	 * Build the authorization URL the resource owner is redirected to.
	 * @param extraParameters further query parameters such as {@code scope} or
	 * {@code state}
	 * @return authorization URL
	 */
	public String authorizationUrl(List<RequestParameter> extraParameters) {
		return RequestBuilder.authorizationUrl(config, extraParameters);
	}

	// ========== Unauthenticated form POST ==========

	/**
	 * POST a form without a token and decode the JSON response.
	 * @param url target URL
	 * @param parameters form parameters
	 * @param type target type
	 * @param <T> target type
	 * @return decoded response, or the error
	 */
	public <T> Result<T> doJsonPostRequest(String url, List<RequestParameter> parameters, Class<T> type) {
		return interpreter.decodeJson(doSimplePostRequest(url, parameters), type);
	}

	/**
	 * POST a form without a token.
	 * @param url target URL
	 * @param parameters form parameters
	 * @return response body, or the error
	 */
	public Result<byte[]> doSimplePostRequest(String url, List<RequestParameter> parameters) {
		return send(Optional.empty(), RequestSpec.form(url, parameters));
	}

	// ========== Authenticated GET ==========

	public <T> Result<T> authGetJson(AccessToken token, String url, Class<T> type) {
		return interpreter.decodeJson(authGetBytes(token, url), type);
	}

	public <T> Result<T> authGetJson(AccessToken token, String url, TypeReference<T> type) {
		return interpreter.decodeJson(authGetBytes(token, url), type);
	}

	/**
	 * GET a resource with the token in the {@code Authorization} header and the
	 * {@code access_token} query parameter.
	 * @param token bearer token
	 * @param url resource URL
	 * @return response body, or the error
	 */
	public Result<byte[]> authGetBytes(AccessToken token, String url) {
		return send(Optional.of(token), RequestBuilder.authenticatedGet(token, url));
	}

	// ========== Authenticated form POST ==========

	public <T> Result<T> authPostJson(AccessToken token, String url, List<RequestParameter> parameters,
			Class<T> type) {
		return interpreter.decodeJson(authPostBytes(token, url, parameters), type);
	}

	public <T> Result<T> authPostJson(AccessToken token, String url, List<RequestParameter> parameters,
			TypeReference<T> type) {
		return interpreter.decodeJson(authPostBytes(token, url, parameters), type);
	}

	/**
	 * POST a form with the token appended to the form parameters.
	 * @param token bearer token
	 * @param url resource URL
	 * @param parameters form parameters
	 * @return response body, or the error
	 */
	public Result<byte[]> authPostBytes(AccessToken token, String url, List<RequestParameter> parameters) {
		return send(Optional.of(token), RequestBuilder.authenticatedPostForm(token, url, parameters));
	}

	// ========== Authenticated raw-body POST ==========

	public <T> Result<T> authPostJsonWithBody(AccessToken token, String url, List<RequestParameter> parameters,
			byte[] body, Class<T> type) {
		return interpreter.decodeJson(authPostBytesWithBody(token, url, parameters, body), type);
	}

	public <T> Result<T> authPostJsonWithBody(AccessToken token, String url, List<RequestParameter> parameters,
			byte[] body, TypeReference<T> type) {
		return interpreter.decodeJson(authPostBytesWithBody(token, url, parameters, body), type);
	}

	/**
	 * POST caller-supplied bytes; the parameters and the token go into the query string.
	 * @param token bearer token
	 * @param url resource URL
	 * @param parameters query parameters
	 * @param body request body, sent verbatim
	 * @return response body, or the error
	 */
	public Result<byte[]> authPostBytesWithBody(AccessToken token, String url, List<RequestParameter> parameters,
			byte[] body) {
		return send(Optional.of(token), RequestBuilder.authenticatedPostBody(token, url, parameters, body));
	}

	// ========== Execution ==========

	/**
	 * Decorate, execute and classify a request. Callers building their own
	 * {@link RequestSpec}, for example to set a timeout, go through here.
	 * @param token bearer token, if the request is authenticated
	 * @param request the request
	 * @return response body on status 200, or the error
	 */
	public Result<byte[]> send(Optional<AccessToken> token, RequestSpec request) {
		RequestSpec decorated = headerPolicy.apply(token, request);
		RawResponse response;
		try {
			response = transport.execute(decorated);
		}
		catch (TransportException e) {
			return Result.failure(OAuth2Error.transport(e));
		}
		return interpreter.classify(response);
	}

}
