// Part of ReactiveFS
package com.machinezoo.reactivefs;

import java.util.*;
import java.util.concurrent.*;
import java.util.function.*;
import com.machinezoo.closeablescope.*;
import com.machinezoo.reactivefs.util.*;
import com.machinezoo.stagean.*;
import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.Timer;

/*
 * Stream is the driver that turns a tracked computation into a live sequence of results.
 * It runs the computation, hands out the result, arms a trigger with the collected dependencies,
 * and when the trigger fires, it runs the computation again on the next pull.
 *
 * Computation runs on the consumer's thread inside hasNext(). This gives us several guarantees for free:
 * - results are delivered in the order they were computed
 * - two runs of the same stream never overlap
 * - nothing is computed that nobody asked for
 *
 * Trigger is one-shot. Any number of invalidations that arrive before the consumer pulls again
 * (or while the previous computation is still running) result in exactly one re-run.
 *
 * The sequence is infinite until cancelled, closed, or until the computation throws.
 * It cannot be restarted. Consumers must create a new stream to resume watching.
 */
/**
 * Infinite sequence of results of a tracked computation, re-run whenever its dependencies change.
 *
 * @param <T>
 *            type of the computation result
 */
@StubDocs
@DraftApi("async consumers might want nextAsync() instead of parking a thread in hasNext()")
public class ReactiveStream<T> implements Iterator<T>, AutoCloseable {
	private final Supplier<T> computation;
	private final CloseableScope registration;
	private ReactiveStream(Supplier<T> computation, Cancellation cancellation) {
		Objects.requireNonNull(computation);
		Objects.requireNonNull(cancellation);
		OwnerTrace.of(this).alias("stream");
		this.computation = computation;
		registration = cancellation.onCancel(this::close);
	}
	public static <T> ReactiveStream<T> of(Supplier<T> computation, Cancellation cancellation) {
		return new ReactiveStream<>(computation, cancellation);
	}
	public static <T> ReactiveStream<T> of(Supplier<T> computation) {
		return new ReactiveStream<>(computation, new Cancellation());
	}
	private boolean started;
	private boolean terminated;
	/*
	 * Result waiting to be returned by next(). Null if there is none.
	 */
	private ReactiveValue<T> pending;
	private ReactiveTrigger trigger;
	/*
	 * Completed when the trigger fires or the stream terminates. Consumer parks on it in hasNext().
	 */
	private CompletableFuture<Void> wakeup;
	private static final Timer timer = Metrics.timer("reactivefs.stream.computations");
	@Override
	public boolean hasNext() {
		while (true) {
			CompletableFuture<Void> signal = null;
			synchronized (this) {
				if (pending != null)
					return true;
				if (terminated)
					return false;
				if (started)
					signal = wakeup;
				started = true;
			}
			if (signal != null) {
				try {
					signal.get();
				} catch (InterruptedException ex) {
					Thread.currentThread().interrupt();
					close();
					return false;
				} catch (ExecutionException ex) {
					throw new IllegalStateException(ex);
				}
			}
			iterate();
		}
	}
	@SuppressWarnings("resource")
	private void iterate() {
		synchronized (this) {
			if (terminated)
				return;
		}
		Tracked<T> tracked = timer.record(() -> ReactiveScope.runTracked(computation));
		synchronized (this) {
			/*
			 * Cancelled while computing. Drop the result.
			 */
			if (terminated)
				return;
			pending = tracked.value();
			/*
			 * Failed computation terminates the stream once the failure is delivered.
			 */
			if (tracked.value().exception() != null)
				return;
			wakeup = new CompletableFuture<>();
			trigger = OwnerTrace
				.of(new ReactiveTrigger()
					.callback(this::invalidate))
				.parent(this)
				.target();
			/*
			 * Arming may fire immediately if a dependency changed during computation.
			 * The callback only completes the wakeup future, so it is safe to run it while holding the lock.
			 * Empty dependency set means the trigger never fires and we wait until cancellation.
			 */
			trigger.arm(tracked.dependencies());
		}
	}
	private synchronized void invalidate() {
		if (terminated)
			return;
		trigger.close();
		trigger = null;
		wakeup.complete(null);
	}
	@Override
	public T next() {
		if (!hasNext())
			throw new NoSuchElementException();
		ReactiveValue<T> value;
		synchronized (this) {
			value = pending;
			pending = null;
		}
		if (value.exception() != null)
			close();
		return value.get();
	}
	public synchronized boolean terminated() {
		return terminated;
	}
	/**
	 * Abandons the stream. Pending wait in {@link #hasNext()} returns {@code false} immediately
	 * and no further invalidation causes a re-run. Closing twice is harmless.
	 */
	@Override
	public void close() {
		CompletableFuture<Void> signal;
		synchronized (this) {
			if (terminated)
				return;
			terminated = true;
			/*
			 * Undelivered failure is kept, so that the consumer still sees why the stream ended.
			 */
			if (pending != null && pending.exception() == null)
				pending = null;
			if (trigger != null) {
				trigger.close();
				trigger = null;
			}
			signal = wakeup;
		}
		if (signal != null)
			signal.complete(null);
		/*
		 * Null when the cancellation was already signaled during construction.
		 */
		if (registration != null)
			registration.close();
	}
	@Override
	public String toString() {
		return OwnerTrace.of(this).toString();
	}
}
