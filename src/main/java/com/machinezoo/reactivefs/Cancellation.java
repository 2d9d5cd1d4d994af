// Part of ReactiveFS
package com.machinezoo.reactivefs;

import java.util.*;
import java.util.concurrent.*;
import org.slf4j.*;
import com.machinezoo.closeablescope.*;
import com.machinezoo.noexception.slf4j.*;
import com.machinezoo.reactivefs.util.*;

/**
 * Cancellation signal for {@link ReactiveStream}s.
 * One signal can cancel any number of streams. Cancellation is permanent.
 */
public class Cancellation {
	public Cancellation() {
		OwnerTrace.of(this).alias("cancellation");
	}
	/*
	 * Listeners are keyed by private tokens, so that the same Runnable can be registered twice
	 * and each registration can be removed independently.
	 */
	private final Map<Object, Runnable> listeners = new ConcurrentHashMap<>();
	private volatile boolean cancelled;
	public boolean cancelled() {
		return cancelled;
	}
	private static final Logger logger = LoggerFactory.getLogger(Cancellation.class);
	public void cancel() {
		synchronized (this) {
			if (cancelled)
				return;
			cancelled = true;
		}
		for (Object token : new ArrayList<>(listeners.keySet())) {
			Runnable listener = listeners.remove(token);
			if (listener != null)
				ExceptionLogging.log(logger).run(listener);
		}
	}
	/**
	 * Registers {@code listener} to be run on cancellation. If already cancelled, the listener runs immediately.
	 *
	 * @param listener
	 *            code to run on cancellation
	 * @return handle that deregisters the listener when closed
	 */
	public CloseableScope onCancel(Runnable listener) {
		Objects.requireNonNull(listener);
		Object token = new Object();
		listeners.put(token, listener);
		/*
		 * Double-check after registration. Concurrent cancel() might have missed our listener.
		 */
		if (cancelled) {
			Runnable pending = listeners.remove(token);
			if (pending != null)
				pending.run();
		}
		return () -> listeners.remove(token);
	}
	@Override
	public String toString() {
		return OwnerTrace.of(this) + (cancelled ? " (cancelled)" : "");
	}
}
