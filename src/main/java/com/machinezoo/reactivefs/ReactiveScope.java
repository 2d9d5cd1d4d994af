// Part of ReactiveFS
package com.machinezoo.reactivefs;

import java.util.*;
import java.util.concurrent.*;
import java.util.function.*;
import com.machinezoo.closeablescope.*;
import com.machinezoo.reactivefs.util.*;
import com.machinezoo.stagean.*;
import it.unimi.dsi.fastutil.objects.*;

/*
 * This is the context object that makes implicit dependency collection possible.
 * Any computation running within the scope records every cell it reads, without declaring its dependencies up front.
 *
 * The scope is found through a thread-local variable, but a scope is not tied to a thread.
 * It belongs to one logical task. Async computations hop between threads, so the scope
 * has to be carried along explicitly by wrapping continuations via wrap() or executor().
 * Unrelated computations running concurrently on the same pool have their own scopes
 * and their reads therefore never leak into this one.
 *
 * Since continuations of one task may run in parallel, dependency recording is synchronized.
 * The lock is uncontended in the common single-threaded case.
 */
/**
 * Context that collects cell reads of a tracked computation into a dependency set.
 *
 * @see CurrentReactiveScope
 * @see ReactiveCell#read()
 */
@StubDocs
public class ReactiveScope {
	public ReactiveScope() {
		OwnerTrace.of(this).alias("scope");
	}
	private static final ThreadLocal<ReactiveScope> current = new ThreadLocal<ReactiveScope>();
	public static ReactiveScope current() {
		return current.get();
	}
	/*
	 * Designed for try-with-resources. Scopes nest. Entering restores whatever scope was active before.
	 * The same scope may be entered on several threads at once (by its continuations),
	 * so the outer scope is remembered in the closure rather than in a field.
	 */
	public CloseableScope enter() {
		ReactiveScope outer = current.get();
		current.set(this);
		return () -> {
			if (outer != null)
				current.set(outer);
			else
				current.remove();
		};
	}
	/*
	 * Code that reads cells for its own purposes (diagnostics, logging) can suppress dependency recording.
	 */
	public static CloseableScope ignore() {
		ReactiveScope outer = current.get();
		current.remove();
		return () -> {
			if (outer != null)
				current.set(outer);
		};
	}
	/*
	 * We can only depend on one version of every cell. Map from cell to the earliest observed version.
	 */
	private final Object2LongMap<ReactiveCell<?>> dependencies = new Object2LongOpenHashMap<>();
	{
		dependencies.defaultReturnValue(-1);
	}
	/*
	 * Sealed scope ignores further reads. Stray continuations that outlive the computation
	 * must not modify a dependency set that has already been handed to a trigger.
	 */
	private boolean sealed;
	public synchronized void seal() {
		sealed = true;
	}
	public synchronized boolean sealed() {
		return sealed;
	}
	/*
	 * If the same cell is read twice, we keep the earlier version.
	 * If it changed in between, the computation has seen two different values and it must be re-run.
	 */
	public synchronized void watch(ReactiveCell<?> cell, long version) {
		Objects.requireNonNull(cell);
		if (sealed)
			return;
		long previous = dependencies.getLong(cell);
		if (previous < 0 || version < previous)
			dependencies.put(cell, version);
	}
	public void watch(ReactiveCell<?> cell) {
		watch(cell, cell.version());
	}
	public synchronized List<Dependency> dependencies() {
		List<Dependency> list = new ArrayList<>(dependencies.size());
		for (Object2LongMap.Entry<ReactiveCell<?>> entry : dependencies.object2LongEntrySet())
			list.add(new Dependency(entry.getKey(), entry.getLongValue()));
		return Collections.unmodifiableList(list);
	}
	/*
	 * Explicit propagation of the scope to continuations running on other threads.
	 */
	public Runnable wrap(Runnable runnable) {
		Objects.requireNonNull(runnable);
		return () -> {
			try (CloseableScope computation = enter()) {
				runnable.run();
			}
		};
	}
	public <T> Supplier<T> wrap(Supplier<T> supplier) {
		Objects.requireNonNull(supplier);
		return () -> {
			try (CloseableScope computation = enter()) {
				return supplier.get();
			}
		};
	}
	public Executor executor(Executor executor) {
		Objects.requireNonNull(executor);
		return runnable -> executor.execute(wrap(runnable));
	}
	/**
	 * Runs {@code computation} in a fresh scope and returns its output together with all cells it read.
	 * Exceptions thrown by {@code computation} are captured in the returned {@link Tracked} object.
	 *
	 * @param <T>
	 *            type of the result
	 * @param computation
	 *            computation to track
	 * @return result (or exception) and dependency set
	 */
	public static <T> Tracked<T> runTracked(Supplier<T> computation) {
		Objects.requireNonNull(computation);
		ReactiveScope scope = new ReactiveScope();
		ReactiveValue<T> value;
		try (CloseableScope active = scope.enter()) {
			value = ReactiveValue.capture(computation);
		}
		scope.seal();
		return new Tracked<>(value, scope.dependencies());
	}
	/**
	 * Async variant of {@link #runTracked(Supplier)}.
	 * The scope stays open until the returned stage completes. Continuations record reads
	 * as long as they run through {@link CurrentReactiveScope#executor(Executor)} or {@link CurrentReactiveScope#wrap(Supplier)}.
	 *
	 * @param <T>
	 *            type of the result
	 * @param computation
	 *            supplier of the async computation
	 * @return future completing with result (or exception) and dependency set, never completing exceptionally
	 */
	public static <T> CompletableFuture<Tracked<T>> runTrackedAsync(Supplier<? extends CompletionStage<T>> computation) {
		Objects.requireNonNull(computation);
		ReactiveScope scope = OwnerTrace.of(new ReactiveScope())
			.tag("async", true)
			.target();
		CompletionStage<T> stage;
		try (CloseableScope active = scope.enter()) {
			stage = computation.get();
			Objects.requireNonNull(stage, "Async computation returned null.");
		} catch (Throwable ex) {
			scope.seal();
			return CompletableFuture.completedFuture(new Tracked<>(ReactiveValue.failed(ex), scope.dependencies()));
		}
		return stage.handle((result, ex) -> {
			scope.seal();
			ReactiveValue<T> value = ex != null ? ReactiveValue.failed(ex) : ReactiveValue.of(result);
			return new Tracked<>(value, scope.dependencies());
		}).toCompletableFuture();
	}
	@Override
	public String toString() {
		return OwnerTrace.of(this).toString();
	}
}
