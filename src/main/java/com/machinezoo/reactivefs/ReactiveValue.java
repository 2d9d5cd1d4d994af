// Part of ReactiveFS
package com.machinezoo.reactivefs;

import java.util.*;
import java.util.concurrent.*;
import java.util.function.*;
import com.machinezoo.stagean.*;

/*
 * Tracked computations communicate their output like methods, i.e. via return value or exception.
 * Streams need to hold that output for a while before handing it to the consumer,
 * so we need an explicit representation of "returned X" or "threw Y".
 */
/**
 * Output of a tracked computation consisting of return value or exception.
 * {@code ReactiveValue} is immutable.
 * Conversion between the explicit and implicit representation is performed by {@link #capture(Supplier)} and {@link #get()}.
 *
 * @param <T>
 *            type of the result carried by this {@code ReactiveValue}
 *
 * @see Tracked
 * @see ReactiveStream
 */
@DraftDocs("link to stream documentation")
public class ReactiveValue<T> {
	private final T result;
	/**
	 * Gets the return value component of this {@code ReactiveValue}.
	 *
	 * @return return value, or {@code null} if the computation threw
	 */
	public T result() {
		return result;
	}
	private final Throwable exception;
	/**
	 * Gets the exception component of this {@code ReactiveValue}.
	 *
	 * @return exception thrown by the computation, or {@code null} if it returned normally
	 */
	public Throwable exception() {
		return exception;
	}
	private ReactiveValue(T result, Throwable exception) {
		this.result = result;
		this.exception = exception;
	}
	public static <T> ReactiveValue<T> of(T result) {
		return new ReactiveValue<>(result, null);
	}
	public static <T> ReactiveValue<T> failed(Throwable exception) {
		Objects.requireNonNull(exception);
		return new ReactiveValue<>(null, exception);
	}
	/**
	 * Unpacks this {@code ReactiveValue}.
	 * If {@link #exception()} is not {@code null}, it is thrown wrapped in {@link CompletionException}.
	 * Otherwise {@link #result()} is returned.
	 *
	 * @return value of {@link #result()}
	 * @throws CompletionException
	 *             if {@link #exception()} is not {@code null}
	 */
	public T get() {
		if (exception != null) {
			/*
			 * Don't double-wrap. Async computations already report failures as CompletionException.
			 */
			if (exception instanceof CompletionException)
				throw (CompletionException)exception;
			throw new CompletionException(exception);
		}
		return result;
	}
	/*
	 * Errors are captured too. A computation that runs out of stack is still just a failed computation,
	 * and letting the error escape would kill the thread that happens to run it.
	 */
	public static <T> ReactiveValue<T> capture(Supplier<T> supplier) {
		Objects.requireNonNull(supplier);
		try {
			return of(supplier.get());
		} catch (Throwable ex) {
			return failed(ex);
		}
	}
	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof ReactiveValue))
			return false;
		ReactiveValue<?> other = (ReactiveValue<?>)obj;
		return Objects.equals(result, other.result) && Objects.equals(exception, other.exception);
	}
	@Override
	public int hashCode() {
		return Objects.hash(result, exception);
	}
	@Override
	public String toString() {
		if (exception != null)
			return "exception: " + exception;
		return Objects.toString(result);
	}
}
