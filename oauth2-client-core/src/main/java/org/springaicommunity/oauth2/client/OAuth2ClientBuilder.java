package org.springaicommunity.oauth2.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

/**
 * Builder for creating an {@link OAuth2HttpClient} without Spring.
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>
 * {@code
 * // Registration read from OAUTH2_* environment variables or a .env file
 * OAuth2HttpClient client = OAuth2ClientBuilder.create()
 *     .configFromEnv()
 *     .build();
 *
 * // With explicit registration and properties
 * OAuth2ClientProperties props = new OAuth2ClientProperties();
 * props.setRequestTimeoutSeconds(10);
 *
 * OAuth2HttpClient client = OAuth2ClientBuilder.create()
 *     .config(new OAuth2Config("id", "secret", authorizeUrl, tokenUrl, redirectUri))
 *     .properties(props)
 *     .build();
 *
 * // For testing with a mock transport
 * HttpTransport mockTransport = mock(HttpTransport.class);
 * OAuth2HttpClient testClient = OAuth2ClientBuilder.create()
 *     .config(config)
 *     .transport(mockTransport)
 *     .build();
 * }
 * </pre>
 */
public class OAuth2ClientBuilder {

	private @Nullable OAuth2Config config;

	private OAuth2ClientProperties properties;

	private @Nullable ObjectMapper objectMapper;

	private @Nullable HttpTransport transport;

	private OAuth2ClientBuilder() {
		this.properties = new OAuth2ClientProperties();
	}

	/**
	 * Create a new builder instance.
	 * @return new OAuth2ClientBuilder
	 */
	public static OAuth2ClientBuilder create() {
		return new OAuth2ClientBuilder();
	}

	/**
	 * Set the client registration.
	 * @param config client registration
	 * @return this builder
	 */
	public OAuth2ClientBuilder config(OAuth2Config config) {
		this.config = config;
		return this;
	}

	/**
	 * Read the client registration from {@code OAUTH2_CLIENT_ID},
	 * {@code OAUTH2_CLIENT_SECRET}, {@code OAUTH2_AUTHORIZE_ENDPOINT},
	 * {@code OAUTH2_TOKEN_ENDPOINT} and the optional {@code OAUTH2_REDIRECT_URI}.
	 * @return this builder
	 * @throws IllegalStateException if a required variable is not set
	 */
	public OAuth2ClientBuilder configFromEnv() {
		this.config = new OAuth2Config(EnvironmentSupport.require(EnvironmentSupport.CLIENT_ID),
				EnvironmentSupport.require(EnvironmentSupport.CLIENT_SECRET),
				EnvironmentSupport.require(EnvironmentSupport.AUTHORIZE_ENDPOINT),
				EnvironmentSupport.require(EnvironmentSupport.TOKEN_ENDPOINT),
				EnvironmentSupport.get(EnvironmentSupport.REDIRECT_URI));
		return this;
	}

	/**
	 * Set client properties.
	 * @param properties configuration properties (null to use defaults)
	 * @return this builder
	 */
	public OAuth2ClientBuilder properties(@Nullable OAuth2ClientProperties properties) {
		if (properties != null) {
			this.properties = properties;
		}
		return this;
	}

	/**
	 * Set a custom ObjectMapper used for decoding responses.
	 * @param objectMapper Jackson ObjectMapper (null to use default)
	 * @return this builder
	 */
	public OAuth2ClientBuilder objectMapper(@Nullable ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
		return this;
	}

	/**
	 * Set a custom HttpTransport implementation. Useful for testing with mocks or for
	 * plugging in another HTTP library.
	 * @param transport custom transport (null to use {@link JdkHttpTransport})
	 * @return this builder
	 */
	public OAuth2ClientBuilder transport(@Nullable HttpTransport transport) {
		this.transport = transport;
		return this;
	}

	/**
	 * Build the client.
	 * @return configured OAuth2HttpClient
	 * @throws IllegalStateException if no client registration was set
	 */
	public OAuth2HttpClient build() {
		if (config == null) {
			throw new IllegalStateException("An OAuth2Config is required. Call config() or configFromEnv() first.");
		}
		ObjectMapper mapper = objectMapper != null ? objectMapper : ObjectMapperFactory.create();
		HttpTransport httpTransport = transport != null ? transport : new JdkHttpTransport(properties);
		return new OAuth2HttpClient(config, httpTransport, new HeaderPolicy(properties.getUserAgent()),
				new ResponseInterpreter(mapper));
	}

}
