package org.springaicommunity.oauth2.client;

import org.jspecify.annotations.Nullable;

import java.util.Arrays;
import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of an OAuth2 exchange: either a decoded value or an {@link OAuth2Error}, never
 * both.
 *
 * <p>
 * {@link #flatMap(Function)} and {@link #map(Function)} apply the next stage only to a
 * success and pass an error through unchanged, which is how status classification and
 * JSON decoding are chained:
 *
 * <pre>
 * {@code
 * Result<AccessToken> token = interpreter.classify(response)
 *     .flatMap(body -> interpreter.decode(body, AccessToken.class));
 * }
 * </pre>
 *
 * @param <T> type of the success value
 */
public final class Result<T> {

	private final @Nullable T value;

	private final @Nullable OAuth2Error error;

	private Result(@Nullable T value, @Nullable OAuth2Error error) {
		this.value = value;
		this.error = error;
	}

	/**
	 * Create a successful result.
	 * @param value the success value
	 * @param <T> value type
	 * @return new Result
	 */
	public static <T> Result<T> success(T value) {
		return new Result<>(Objects.requireNonNull(value, "value"), null);
	}

	/**
	 * Create a failed result.
	 * @param error the error
	 * @param <T> value type
	 * @return new Result
	 */
	public static <T> Result<T> failure(OAuth2Error error) {
		return new Result<>(null, Objects.requireNonNull(error, "error"));
	}

	public boolean isSuccess() {
		return error == null;
	}

	public boolean isFailure() {
		return error != null;
	}

	/**
	 * Returns the success value.
	 * @return the value
	 * @throws IllegalStateException if this result is a failure
	 */
	public T value() {
		if (error != null) {
			throw new IllegalStateException("Result is a failure: " + error);
		}
		return value;
	}

	/**
	 * Returns the error.
	 * @return the error
	 * @throws IllegalStateException if this result is a success
	 */
	public OAuth2Error error() {
		if (error == null) {
			throw new IllegalStateException("Result is a success");
		}
		return error;
	}

	/**
	 * Transform the success value; errors pass through.
	 * @param mapper function applied to the success value
	 * @param <R> new value type
	 * @return mapped result
	 */
	public <R> Result<R> map(Function<? super T, ? extends R> mapper) {
		if (error != null) {
			return propagate();
		}
		return success(mapper.apply(value));
	}

	/**
	 * Chain the next stage; errors pass through without calling it.
	 * @param next stage applied to the success value
	 * @param <R> new value type
	 * @return the next stage's result, or this error
	 */
	public <R> Result<R> flatMap(Function<? super T, Result<R>> next) {
		if (error != null) {
			return propagate();
		}
		return next.apply(value);
	}

	// a failure holds no T, so the same instance serves for any value type
	@SuppressWarnings("unchecked")
	private <R> Result<R> propagate() {
		return (Result<R>) this;
	}

	/**
	 * Collapse both branches into a single value.
	 * @param onSuccess applied to the success value
	 * @param onFailure applied to the error
	 * @param <R> result type
	 * @return the result of whichever function applies
	 */
	public <R> R fold(Function<? super T, ? extends R> onSuccess, Function<? super OAuth2Error, ? extends R> onFailure) {
		if (error != null) {
			return onFailure.apply(error);
		}
		return onSuccess.apply(value);
	}

	/**
	 * Returns the success value or throws the error.
	 * @return the value
	 * @throws OAuth2Exception if this result is a failure
	 */
	public T orElseThrow() {
		if (error != null) {
			throw new OAuth2Exception(error);
		}
		return value;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Result)) {
			return false;
		}
		Result<?> that = (Result<?>) o;
		return Objects.deepEquals(value, that.value) && Objects.equals(error, that.error);
	}

	@Override
	public int hashCode() {
		return Arrays.deepHashCode(new Object[] { value, error });
	}

	@Override
	public String toString() {
		return error != null ? "Result.failure(" + error + ")" : "Result.success(" + value + ")";
	}

}
