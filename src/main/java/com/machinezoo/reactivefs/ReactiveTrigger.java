// Part of ReactiveFS
package com.machinezoo.reactivefs;

import java.util.*;
import java.util.concurrent.*;
import org.slf4j.*;
import com.machinezoo.noexception.slf4j.*;
import com.machinezoo.reactivefs.util.*;
import com.machinezoo.stagean.*;
import io.opentracing.*;
import io.opentracing.util.*;

/*
 * Trigger is the one-shot waiter that turns a dependency set into a single callback.
 * It subscribes to every cell in the set and fires the first time any of them changes.
 * Further changes are ignored, which is what coalesces a burst of invalidations into one re-run.
 *
 * The standard sequence of calls is: arm(), fire(), close(). Methods fire() and close() may be called repeatedly.
 */
/**
 * One-shot callback for changes in {@link ReactiveCell}s.
 */
@StubDocs
public class ReactiveTrigger implements AutoCloseable {
	public ReactiveTrigger() {
		OwnerTrace.of(this).alias("trigger");
	}
	/*
	 * Null with 'armed' flag set means that subscription is still in progress.
	 */
	private ReactiveCell<?>[] cells;
	private boolean armed;
	public synchronized boolean armed() {
		return armed;
	}
	/*
	 * Arming detects outdated versions and it might call fire() immediately.
	 * Callers must be ready to receive the callback before they call arm().
	 */
	public void arm(Collection<Dependency> dependencies) {
		Objects.requireNonNull(dependencies);
		synchronized (this) {
			if (armed)
				throw new IllegalStateException("Cannot arm the trigger twice.");
			if (closed)
				throw new IllegalStateException("Trigger was already closed.");
			armed = true;
		}
		List<ReactiveCell<?>> subscribed = new ArrayList<>();
		for (Dependency dependency : dependencies) {
			dependency.cell().subscribe(this);
			subscribed.add(dependency.cell());
			/*
			 * Version check must come after subscription, otherwise a change in between would be lost.
			 */
			if (dependency.stale()) {
				fire();
				break;
			}
		}
		ReactiveCell<?>[] compact = subscribed.toArray(new ReactiveCell<?>[subscribed.size()]);
		ReactiveCell<?>[] unsubscribed = null;
		synchronized (this) {
			if (closed)
				unsubscribed = compact;
			else
				cells = compact;
		}
		if (unsubscribed != null)
			unsubscribe(unsubscribed);
	}
	private final int hashCode = ThreadLocalRandom.current().nextInt();
	@Override
	public int hashCode() {
		return hashCode;
	}
	private Runnable callback;
	public synchronized ReactiveTrigger callback(Runnable callback) {
		this.callback = callback;
		return this;
	}
	private static final Logger logger = LoggerFactory.getLogger(ReactiveTrigger.class);
	private boolean fired;
	public synchronized boolean fired() {
		return fired;
	}
	public void fire() {
		Runnable callback = null;
		synchronized (this) {
			/*
			 * Closed trigger stays silent. Cells may fire it concurrently with close() without knowing about it.
			 */
			if (!fired && !closed) {
				fired = true;
				callback = this.callback;
			}
		}
		if (callback != null) {
			Span span = GlobalTracer.get().buildSpan("reactivefs.fire")
				.withTag("component", "reactivefs")
				.start();
			OwnerTrace.of(this).fill(span);
			try (Scope trace = GlobalTracer.get().activateSpan(span)) {
				/*
				 * Callbacks run on whatever thread invalidated the cell, typically the watcher's flush.
				 * They must not break the invalidation loop, so exceptions are logged here.
				 */
				ExceptionLogging.log(logger).run(callback);
			} finally {
				span.finish();
			}
		}
	}
	/*
	 * Cells hold triggers weakly. Owners must keep a reference and close() the trigger when done,
	 * otherwise the trigger may be collected and the callback silently lost.
	 */
	private boolean closed;
	public synchronized boolean closed() {
		return closed;
	}
	@Override
	public void close() {
		ReactiveCell<?>[] unsubscribed = null;
		synchronized (this) {
			if (!closed) {
				closed = true;
				if (cells != null) {
					unsubscribed = cells;
					cells = null;
				}
			}
		}
		if (unsubscribed != null)
			unsubscribe(unsubscribed);
	}
	private void unsubscribe(ReactiveCell<?>[] unsubscribed) {
		for (ReactiveCell<?> cell : unsubscribed)
			cell.unsubscribe(this);
	}
	@Override
	public String toString() {
		return OwnerTrace.of(this).toString();
	}
}
