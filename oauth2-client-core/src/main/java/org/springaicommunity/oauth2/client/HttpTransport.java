package org.springaicommunity.oauth2.client;

/**
 * Interface for executing a built request against the network.
 *
 * <p>
 * Any HTTP response, whatever its status, is a successful call. Only a failure to obtain
 * a response is reported, as a {@link TransportException}. Implementations do not retry.
 */
public interface HttpTransport {

	/**
	 * Execute a request.
	 * @param request fully built request, headers included
	 * @return status, headers and body of the response
	 * @throws TransportException if no response could be obtained
	 */
	RawResponse execute(RequestSpec request);

}
