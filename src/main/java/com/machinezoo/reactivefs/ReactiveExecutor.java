// Part of ReactiveFS
package com.machinezoo.reactivefs;

import java.util.concurrent.*;
import com.google.common.util.concurrent.*;
import com.machinezoo.stagean.*;
import io.micrometer.core.instrument.*;

/*
 * Shared thread pools for background work that must not run on the consumer's thread:
 * watcher initialization (which walks the whole directory tree), debounce timers, and recovery timers.
 *
 * Tracked computations themselves run on the consumer's thread when it pulls from a stream.
 * Their async continuations may use any executor wrapped by CurrentReactiveScope.executor().
 */
/**
 * Shared executors for background work.
 */
@StubDocs
public class ReactiveExecutor {
	/*
	 * Daemon threads. Background watching must not prevent process termination.
	 */
	private static final ExecutorService common = Executors.newCachedThreadPool(new ThreadFactoryBuilder()
		.setDaemon(true)
		.setNameFormat("reactivefs-%d")
		.build());
	/*
	 * Single timer thread is enough. Timer tasks only flush event buffers or schedule more work on the common pool.
	 */
	private static final ScheduledThreadPoolExecutor timer = new ScheduledThreadPoolExecutor(1, new ThreadFactoryBuilder()
		.setDaemon(true)
		.setNameFormat("reactivefs-timer")
		.build());
	static {
		/*
		 * Cancelled debounce timers would otherwise linger in the queue until their deadline.
		 */
		timer.setRemoveOnCancelPolicy(true);
		Metrics.gauge("reactivefs.executor.timers", timer, x -> x.getQueue().size());
	}
	public static Executor common() {
		return common;
	}
	public static ScheduledExecutorService timer() {
		return timer;
	}
}
