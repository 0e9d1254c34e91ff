package org.springaicommunity.oauth2.client;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;

/**
 * Turns raw responses into {@link Result}s in two composable stages.
 *
 * <ol>
 * <li>{@link #classify(RawResponse)}: status 200 is a success carrying the body verbatim,
 * any other status is an {@link OAuth2Error.Kind#HTTP_STATUS} error.</li>
 * <li>{@link #decodeJson(Result, Class)}: decodes a successful body with Jackson, passing
 * errors through untouched. A body with anything after its first JSON value does not
 * decode, whatever the configuration of the supplied mapper.</li>
 * </ol>
 * Callers needing raw bytes stop after the first stage.
 */
public class ResponseInterpreter {

	private final ObjectMapper objectMapper;

	public ResponseInterpreter(ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
	}

	/**
	 * Classify a response by its status code.
	 * @param response the raw response
	 * @return the body on status 200, an HTTP_STATUS error otherwise
	 */
	public Result<byte[]> classify(RawResponse response) {
		if (response.statusCode() == 200) {
			return Result.success(response.body());
		}
		return Result.failure(OAuth2Error.httpStatus(response.statusCode(), response.body()));
	}

	/**
	 * Decode a classified body into a type.
	 * @param body output of {@link #classify(RawResponse)}
	 * @param type target type
	 * @param <T> target type
	 * @return the decoded value, the incoming error unchanged, or a DECODE error
	 */
	public <T> Result<T> decodeJson(Result<byte[]> body, Class<T> type) {
		return decodeJson(body, objectMapper.constructType(type));
	}

	/**
	 * Decode a classified body into a generic type.
	 * @param body output of {@link #classify(RawResponse)}
	 * @param type target type
	 * @param <T> target type
	 * @return the decoded value, the incoming error unchanged, or a DECODE error
	 */
	public <T> Result<T> decodeJson(Result<byte[]> body, TypeReference<T> type) {
		return decodeJson(body, objectMapper.constructType(type));
	}

	/**
	 * Classify and decode in one step.
	 * @param response the raw response
	 * @param type target type
	 * @param <T> target type
	 * @return decoded value or error
	 */
	public <T> Result<T> interpret(RawResponse response, Class<T> type) {
		return decodeJson(classify(response), type);
	}

	private <T> Result<T> decodeJson(Result<byte[]> body, JavaType type) {
		return body.flatMap(bytes -> decode(bytes, type));
	}

	private <T> Result<T> decode(byte[] bytes, JavaType type) {
		try {
			T value = objectMapper.readerFor(type).with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS).readValue(bytes);
			if (value == null) {
				return Result.failure(OAuth2Error.decode(bytes, null));
			}
			return Result.success(value);
		}
		catch (IOException e) {
			return Result.failure(OAuth2Error.decode(bytes, e));
		}
	}

}
