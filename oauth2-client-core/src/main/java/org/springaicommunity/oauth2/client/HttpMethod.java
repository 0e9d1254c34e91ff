package org.springaicommunity.oauth2.client;

/**
 * HTTP methods issued by this library.
 */
public enum HttpMethod {

	GET, POST

}
