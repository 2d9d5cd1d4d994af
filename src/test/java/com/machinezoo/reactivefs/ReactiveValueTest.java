// Part of ReactiveFS
package com.machinezoo.reactivefs;

import static org.junit.jupiter.api.Assertions.*;
import java.util.concurrent.*;
import org.junit.jupiter.api.*;

public class ReactiveValueTest {
	@Test
	public void result() {
		ReactiveValue<String> v = ReactiveValue.of("hello");
		assertEquals("hello", v.result());
		assertNull(v.exception());
		assertEquals("hello", v.get());
		assertEquals(ReactiveValue.of("hello"), v);
		assertNotEquals(ReactiveValue.of("world"), v);
	}
	@Test
	public void exception() {
		IllegalStateException ex = new IllegalStateException();
		ReactiveValue<String> v = ReactiveValue.failed(ex);
		assertSame(ex, v.exception());
		CompletionException ce = assertThrows(CompletionException.class, v::get);
		assertSame(ex, ce.getCause());
		// Exceptions that are already wrapped are not wrapped again.
		CompletionException wrapped = new CompletionException(ex);
		assertSame(wrapped, assertThrows(CompletionException.class, () -> ReactiveValue.failed(wrapped).get()));
	}
	@Test
	public void capture() {
		assertEquals(ReactiveValue.of(1), ReactiveValue.capture(() -> 1));
		// Errors are captured too.
		StackOverflowError error = new StackOverflowError();
		assertSame(error, ReactiveValue.<Integer>capture(() -> {
			throw error;
		}).exception());
	}
}
