package org.springaicommunity.oauth2.client;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link RequestBuilder} and {@link FormEncoding}.
 */
@DisplayName("RequestBuilder Tests")
class RequestBuilderTest {

	private static final OAuth2Config CONFIG = new OAuth2Config("client-1", "s3cret",
			"https://example.com/authorize", "https://example.com/token", "https://app.example.com/callback");

	private static final OAuth2Config CONFIG_WITHOUT_REDIRECT = new OAuth2Config("client-1", "s3cret",
			"https://example.com/authorize", "https://example.com/token", null);

	private static final AccessToken TOKEN = AccessToken.of("tok1");

	@Nested
	@DisplayName("Token Exchange Requests")
	class TokenExchangeTest {

		@Test
		@DisplayName("Should POST the authorization code to the token endpoint")
		void shouldBuildAccessTokenRequest() {
			RequestSpec request = RequestBuilder.accessTokenRequest(CONFIG, "abc123");

			assertThat(request.method()).isEqualTo(HttpMethod.POST);
			assertThat(request.url()).isEqualTo("https://example.com/token");
			assertThat(request.targetUrl()).isEqualTo("https://example.com/token");
			assertThat(request.bodyKind()).isEqualTo(BodyKind.FORM);
			assertThat(request.parameters()).containsExactly(RequestParameter.of("code", "abc123"),
					RequestParameter.of("redirect_uri", "https://app.example.com/callback"),
					RequestParameter.of("grant_type", "authorization_code"), RequestParameter.of("client_id", "client-1"),
					RequestParameter.of("client_secret", "s3cret"));
		}

		@Test
		@DisplayName("Should form-encode the exchange body")
		void shouldFormEncodeExchangeBody() {
			RequestSpec request = RequestBuilder.accessTokenRequest(CONFIG, "abc123");

			assertThat(new String(request.bodyBytes(), StandardCharsets.UTF_8)).isEqualTo(
					"code=abc123&redirect_uri=https%3A%2F%2Fapp.example.com%2Fcallback&grant_type=authorization_code"
							+ "&client_id=client-1&client_secret=s3cret");
		}

		@Test
		@DisplayName("Should omit redirect_uri when none is configured")
		void shouldOmitRedirectUri() {
			RequestSpec request = RequestBuilder.accessTokenRequest(CONFIG_WITHOUT_REDIRECT, "abc123");

			assertThat(request.parameters()).extracting(RequestParameter::name)
				.containsExactly("code", "grant_type", "client_id", "client_secret");
		}

		@Test
		@DisplayName("Should POST the refresh token with the refresh grant")
		void shouldBuildRefreshRequest() {
			RequestSpec request = RequestBuilder.refreshAccessTokenRequest(CONFIG, "r-1");

			assertThat(request.method()).isEqualTo(HttpMethod.POST);
			assertThat(request.url()).isEqualTo("https://example.com/token");
			assertThat(request.parameters()).containsExactly(RequestParameter.of("refresh_token", "r-1"),
					RequestParameter.of("grant_type", "refresh_token"), RequestParameter.of("client_id", "client-1"),
					RequestParameter.of("client_secret", "s3cret"));
		}

		@Test
		@DisplayName("Should not validate the token endpoint URL")
		void shouldNotValidateUrl() {
			OAuth2Config broken = new OAuth2Config("id", "secret", "::", "not a url", null);

			RequestSpec request = RequestBuilder.accessTokenRequest(broken, "abc123");

			assertThat(request.url()).isEqualTo("not a url");
		}

		@Test
		@DisplayName("Should carry no headers before the header policy is applied")
		void shouldCarryNoHeaders() {
			assertThat(RequestBuilder.accessTokenRequest(CONFIG, "abc123").headers()).isEmpty();
		}

	}

	@Nested
	@DisplayName("Authorization URL")
	class AuthorizationUrlTest {

		@Test
		@DisplayName("Should append client_id, response_type, redirect_uri and extras")
		void shouldBuildAuthorizationUrl() {
			String url = RequestBuilder.authorizationUrl(CONFIG,
					List.of(RequestParameter.of("scope", "read write"), RequestParameter.of("state", "xyz")));

			assertThat(url).isEqualTo("https://example.com/authorize?client_id=client-1&response_type=code"
					+ "&redirect_uri=https%3A%2F%2Fapp.example.com%2Fcallback&scope=read+write&state=xyz");
		}

		@Test
		@DisplayName("Should extend an existing query")
		void shouldExtendExistingQuery() {
			OAuth2Config config = new OAuth2Config("c", "s", "https://example.com/authorize?prompt=consent",
					"https://example.com/token", null);

			String url = RequestBuilder.authorizationUrl(config, List.of());

			assertThat(url).isEqualTo("https://example.com/authorize?prompt=consent&client_id=c&response_type=code");
		}

	}

	@Nested
	@DisplayName("Authenticated Requests")
	class AuthenticatedRequestTest {

		@Test
		@DisplayName("Should append the token as a query parameter on GET")
		void shouldAppendTokenToGetQuery() {
			RequestSpec request = RequestBuilder.authenticatedGet(TOKEN, "https://api.example.com/me");

			assertThat(request.method()).isEqualTo(HttpMethod.GET);
			assertThat(request.bodyKind()).isEqualTo(BodyKind.NONE);
			assertThat(request.targetUrl()).isEqualTo("https://api.example.com/me?access_token=tok1");
			assertThat(request.bodyBytes()).isEmpty();
		}

		@Test
		@DisplayName("Should keep an existing query on GET")
		void shouldKeepExistingQueryOnGet() {
			RequestSpec request = RequestBuilder.authenticatedGet(TOKEN, "https://api.example.com/items?page=2");

			assertThat(request.targetUrl()).isEqualTo("https://api.example.com/items?page=2&access_token=tok1");
		}

		@Test
		@DisplayName("Should merge the token into the POST form body")
		void shouldMergeTokenIntoForm() {
			RequestSpec request = RequestBuilder.authenticatedPostForm(TOKEN, "https://api.example.com/items",
					List.of(RequestParameter.of("name", "a b")));

			assertThat(request.method()).isEqualTo(HttpMethod.POST);
			assertThat(request.targetUrl()).isEqualTo("https://api.example.com/items");
			assertThat(new String(request.bodyBytes(), StandardCharsets.UTF_8)).isEqualTo("name=a+b&access_token=tok1");
		}

		@Test
		@DisplayName("Should send the raw body verbatim and fold parameters into the query")
		void shouldSendRawBody() {
			byte[] body = "{\"name\":\"a\"}".getBytes(StandardCharsets.UTF_8);

			RequestSpec request = RequestBuilder.authenticatedPostBody(TOKEN, "https://api.example.com/items",
					List.of(RequestParameter.of("dry_run", "true")), body);

			assertThat(request.bodyKind()).isEqualTo(BodyKind.RAW);
			assertThat(request.bodyBytes()).isEqualTo(body);
			assertThat(request.targetUrl())
				.isEqualTo("https://api.example.com/items?dry_run=true&access_token=tok1");
		}

		@Test
		@DisplayName("Should copy the raw body so later changes do not leak in")
		void shouldCopyRawBody() {
			byte[] body = "abc".getBytes(StandardCharsets.UTF_8);
			RequestSpec request = RequestBuilder.authenticatedPostBody(TOKEN, "https://api.example.com", List.of(),
					body);

			body[0] = 'x';

			assertThat(new String(request.bodyBytes(), StandardCharsets.UTF_8)).isEqualTo("abc");
		}

		@Test
		@DisplayName("Should ignore a body for non-RAW kinds")
		void shouldIgnoreBodyForForm() {
			RequestSpec request = RequestBuilder.authenticatedRequest(TOKEN, HttpMethod.POST,
					"https://api.example.com", List.of(), BodyKind.FORM, new byte[] { 1, 2 });

			assertThat(request.rawBody()).isNull();
			assertThat(new String(request.bodyBytes(), StandardCharsets.UTF_8)).isEqualTo("access_token=tok1");
		}

		@Test
		@DisplayName("Should reject a RAW request without body")
		void shouldRejectRawWithoutBody() {
			assertThatThrownBy(() -> RequestBuilder.authenticatedRequest(TOKEN, HttpMethod.POST,
					"https://api.example.com", List.of(), BodyKind.RAW, null))
				.isInstanceOf(IllegalArgumentException.class);
		}

		@ParameterizedTest
		@EnumSource(value = BodyKind.class, names = { "FORM", "RAW" })
		@DisplayName("Should reject a GET that would carry a body")
		void shouldRejectGetWithBody(BodyKind bodyKind) {
			assertThatThrownBy(() -> RequestBuilder.authenticatedRequest(TOKEN, HttpMethod.GET,
					"https://api.example.com", List.of(RequestParameter.of("q", "x")), bodyKind, new byte[] { 1 }))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("GET");
		}

	}

	@Nested
	@DisplayName("Form Encoding")
	class FormEncodingTest {

		@Test
		@DisplayName("Should encode reserved characters")
		void shouldEncodeReservedCharacters() {
			String encoded = FormEncoding
				.encode(List.of(RequestParameter.of("q", "a&b=c"), RequestParameter.of("ü", "100%")));

			assertThat(encoded).isEqualTo("q=a%26b%3Dc&%C3%BC=100%25");
		}

		@Test
		@DisplayName("Should leave the URL untouched without parameters")
		void shouldLeaveUrlWithoutParameters() {
			assertThat(FormEncoding.appendQuery("https://example.com/x?y=1", List.of()))
				.isEqualTo("https://example.com/x?y=1");
		}

		@Test
		@DisplayName("Should not double the separator after a trailing question mark")
		void shouldHandleTrailingQuestionMark() {
			assertThat(FormEncoding.appendQuery("https://example.com/x?", List.of(RequestParameter.of("a", "1"))))
				.isEqualTo("https://example.com/x?a=1");
		}

		@Test
		@DisplayName("Should insert the query ahead of a fragment")
		void shouldKeepFragmentLast() {
			List<RequestParameter> parameters = List.of(RequestParameter.of("a", "1"));

			assertThat(FormEncoding.appendQuery("https://example.com/x#top", parameters))
				.isEqualTo("https://example.com/x?a=1#top");
			assertThat(FormEncoding.appendQuery("https://example.com/x?y=2#top", parameters))
				.isEqualTo("https://example.com/x?y=2&a=1#top");
		}

		@Test
		@DisplayName("Should put the access token ahead of a fragment on GET")
		void shouldKeepFragmentLastOnGet() {
			RequestSpec request = RequestBuilder.authenticatedGet(TOKEN, "https://api.example.com/page#section");

			assertThat(request.targetUrl()).isEqualTo("https://api.example.com/page?access_token=tok1#section");
		}

	}

}
