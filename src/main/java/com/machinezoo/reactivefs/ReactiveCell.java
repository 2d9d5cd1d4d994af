// Part of ReactiveFS
package com.machinezoo.reactivefs;

import java.util.*;
import java.util.concurrent.*;
import java.util.function.*;
import com.machinezoo.reactivefs.util.*;
import com.machinezoo.stagean.*;
import io.opentracing.*;
import io.opentracing.util.*;

/**
 * Invalidatable cell holding a lazily computed value and a version number.
 * Reading the cell inside {@link ReactiveScope} records the cell and its current version as a dependency.
 * Changes can be observed by arming {@link ReactiveTrigger} with the recorded {@link Dependency} list,
 * which is what {@link ReactiveStream} does.
 * <p>
 * The version starts at 0 and it is incremented on every {@link #invalidate()} and {@link #set(Object)}.
 * Reading never changes the version.
 * <p>
 * {@link ReactiveCell} is thread-safe. All methods are safe to call concurrently from multiple threads.
 *
 * @param <T>
 *            type of the cached value
 *
 * @see ReactiveScope
 * @see ReactiveTrigger
 */
@DraftDocs("link to path cache docs")
public class ReactiveCell<T> {
	/*
	 * Sentinel for "nothing cached". We cannot use null for that, because null may be a legitimate computed value.
	 */
	private static final Object EMPTY = new Object();
	private final Supplier<T> compute;
	/**
	 * Creates new cell that computes its value on first {@link #read()} by calling {@code compute}.
	 *
	 * @param compute
	 *            function that computes the value of the cell
	 * @throws NullPointerException
	 *             if {@code compute} is {@code null}
	 */
	public ReactiveCell(Supplier<T> compute) {
		Objects.requireNonNull(compute);
		this.compute = compute;
		OwnerTrace.of(this).alias("cell");
	}
	/**
	 * Creates new cell holding {@code value}. It has no compute function, so {@link #read()} after {@link #invalidate()} returns {@code null}.
	 *
	 * @param value
	 *            initial value
	 */
	public static <T> ReactiveCell<T> of(T value) {
		ReactiveCell<T> cell = new ReactiveCell<>(() -> null);
		cell.value = value;
		return cell;
	}
	private volatile long version;
	/**
	 * Returns current version of this cell without creating reactive dependency.
	 *
	 * @return current version, starting at 0
	 */
	public long version() {
		return version;
	}
	/*
	 * Volatile, so that cache hits don't need locking.
	 */
	private volatile Object value = EMPTY;
	/**
	 * Returns {@code true} if this cell currently holds a value, i.e. {@link #read()} would not call the compute function.
	 * This method does not create reactive dependency.
	 *
	 * @return {@code true} if a value is cached
	 */
	public boolean cached() {
		return value != EMPTY;
	}
	/*
	 * Triggers are held weakly. Strong references go only from consumers (streams) to their sources (cells).
	 * Consumers keep their triggers alive for as long as they are interested in changes.
	 */
	private Set<ReactiveTrigger> triggers = newTriggerSet();
	private static Set<ReactiveTrigger> newTriggerSet() {
		return Collections.newSetFromMap(new WeakHashMap<ReactiveTrigger, Boolean>());
	}
	synchronized void subscribe(ReactiveTrigger trigger) {
		Objects.requireNonNull(trigger);
		triggers.add(trigger);
	}
	synchronized void unsubscribe(ReactiveTrigger trigger) {
		triggers.remove(trigger);
	}
	/**
	 * Returns the value of this cell and records dependency in {@link ReactiveScope#current()}.
	 * If there is no cached value, the compute function is invoked and its result is cached.
	 * If the compute function throws, nothing is cached and the exception propagates.
	 *
	 * @return value of the cell
	 */
	@SuppressWarnings("unchecked")
	public T read() {
		/*
		 * Record the dependency before reading the value. If there is a concurrent invalidation,
		 * the recorded version is the old one and the trigger will notice when it is armed.
		 */
		long observed = version;
		ReactiveScope current = ReactiveScope.current();
		if (current != null)
			current.watch(this, observed);
		Object cached = value;
		if (cached != EMPTY)
			return (T)cached;
		/*
		 * I/O runs outside of the lock. Two racing readers may both compute. Last writer wins,
		 * which is fine, because computations are read-only and deterministic.
		 */
		T computed = compute.get();
		synchronized (this) {
			/*
			 * If the cell was invalidated while we were computing, the computed value may already be stale.
			 * We return it, because the reader has recorded the old version and it will be invalidated anyway,
			 * but we don't cache it, so that the next reader computes afresh.
			 */
			if (version == observed)
				value = computed;
		}
		return computed;
	}
	/**
	 * Discards the cached value and increments {@link #version()}. Does not recompute.
	 * Dependent computations are notified via their triggers.
	 */
	public void invalidate() {
		change(EMPTY);
	}
	/**
	 * Stores {@code value} directly, bypassing the compute function, and increments {@link #version()}.
	 * Dependent computations are notified via their triggers.
	 *
	 * @param value
	 *            new value of the cell
	 */
	public void set(T value) {
		change(value);
	}
	private void change(Object next) {
		Set<ReactiveTrigger> notified = null;
		synchronized (this) {
			value = next;
			++version;
			if (!triggers.isEmpty()) {
				notified = triggers;
				triggers = newTriggerSet();
			}
		}
		/*
		 * Fire outside of the synchronized block. Trigger callbacks may read this cell again.
		 * Span is created only when some trigger fires, because unobserved changes are not interesting.
		 */
		if (notified != null) {
			Span span = GlobalTracer.get().buildSpan("reactivefs.change")
				.withTag("component", "reactivefs")
				.start();
			OwnerTrace.of(this).fill(span);
			try (Scope trace = GlobalTracer.get().activateSpan(span)) {
				for (ReactiveTrigger trigger : notified)
					trigger.fire();
			} finally {
				span.finish();
			}
		}
	}
	private final int hashCode = ThreadLocalRandom.current().nextInt();
	/*
	 * Cells are hashed on every read in scope's dependency map. Precomputed identity hash is faster.
	 */
	@Override
	public int hashCode() {
		return hashCode;
	}
	@Override
	public String toString() {
		Object cached = value;
		return OwnerTrace.of(this) + "@" + version + (cached == EMPTY ? " (empty)" : " = " + cached);
	}
}
