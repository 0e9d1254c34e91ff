package org.springaicommunity.oauth2.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring configuration exposing the OAuth2 client and its collaborators as beans.
 *
 * <p>
 * The registration is read from the {@code OAUTH2_*} properties, the same names
 * {@link OAuth2ClientBuilder#configFromEnv()} reads.
 */
@Configuration
public class OAuth2ClientConfiguration {

	@Value("${OAUTH2_CLIENT_ID}")
	private String clientId;

	@Value("${OAUTH2_CLIENT_SECRET}")
	private String clientSecret;

	@Value("${OAUTH2_AUTHORIZE_ENDPOINT}")
	private String authorizeEndpoint;

	@Value("${OAUTH2_TOKEN_ENDPOINT}")
	private String tokenEndpoint;

	@Value("${OAUTH2_REDIRECT_URI:}")
	private String redirectUri;

	@Bean
	public OAuth2Config oauth2Config() {
		return new OAuth2Config(clientId, clientSecret, authorizeEndpoint, tokenEndpoint,
				redirectUri.isEmpty() ? null : redirectUri);
	}

	@Bean
	public OAuth2ClientProperties oauth2ClientProperties() {
		return new OAuth2ClientProperties();
	}

	@Bean
	public ObjectMapper objectMapper() {
		return ObjectMapperFactory.create();
	}

	@Bean
	public HttpTransport httpTransport(OAuth2ClientProperties properties) {
		return new JdkHttpTransport(properties);
	}

	@Bean
	public OAuth2HttpClient oauth2HttpClient(OAuth2Config config, HttpTransport transport,
			OAuth2ClientProperties properties, ObjectMapper objectMapper) {
		return new OAuth2HttpClient(config, transport, new HeaderPolicy(properties.getUserAgent()),
				new ResponseInterpreter(objectMapper));
	}

}
