// Part of ReactiveFS
package com.machinezoo.reactivefs;

import java.util.concurrent.*;
import java.util.function.*;
import com.machinezoo.stagean.*;

/*
 * Code performing tracked reads can run outside of any scope, for example in tests or one-shot reads.
 * These helpers fall back to plain behavior when there is no current scope, so callers don't have to check for null.
 */
/**
 * Convenience methods to access current {@link ReactiveScope}.
 * All calls are forwarded to {@link ReactiveScope#current()} if it is not {@code null}.
 * If there's no current scope, the methods return their input unchanged.
 *
 * @see ReactiveScope
 */
@DraftDocs("async computation examples")
public class CurrentReactiveScope {
	/**
	 * Returns {@code true} if the calling code runs inside {@link ReactiveScope}.
	 *
	 * @return {@code true} if reads are currently tracked
	 */
	public static boolean tracking() {
		ReactiveScope current = ReactiveScope.current();
		return current != null && !current.sealed();
	}
	/**
	 * Wraps {@code executor}, so that tasks submitted to it run in the current {@link ReactiveScope}.
	 * This is how dependency tracking survives thread hops in async computations.
	 *
	 * @param executor
	 *            executor to wrap
	 * @return propagating executor or {@code executor} itself if there's no current scope
	 */
	public static Executor executor(Executor executor) {
		ReactiveScope current = ReactiveScope.current();
		return current != null ? current.executor(executor) : executor;
	}
	public static Runnable wrap(Runnable runnable) {
		ReactiveScope current = ReactiveScope.current();
		return current != null ? current.wrap(runnable) : runnable;
	}
	public static <T> Supplier<T> wrap(Supplier<T> supplier) {
		ReactiveScope current = ReactiveScope.current();
		return current != null ? current.wrap(supplier) : supplier;
	}
}
