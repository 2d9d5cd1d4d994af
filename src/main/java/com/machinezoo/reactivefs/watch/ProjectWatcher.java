// Part of ReactiveFS
package com.machinezoo.reactivefs.watch;

import java.io.*;
import java.nio.file.*;
import java.time.*;
import java.util.*;
import java.util.concurrent.*;
import java.util.function.*;
import org.slf4j.*;
import com.machinezoo.closeablescope.*;
import com.machinezoo.closeablescope.CloseableScope;
import com.machinezoo.noexception.*;
import com.machinezoo.noexception.slf4j.*;
import com.machinezoo.reactivefs.*;
import com.machinezoo.reactivefs.util.*;
import com.machinezoo.stagean.*;
import io.micrometer.core.instrument.*;

/*
 * One OS-level recursive watch per project root, fanned out to any number of path subscriptions.
 *
 * Raw events are filtered through ignore rules and buffered. Every new event restarts the debounce timer.
 * When the timer expires, the whole buffer is flushed in one pass and every subscription receives
 * the events it matches as one batch, in arrival order.
 *
 * Every OS subscription is tagged with a private session token. Events and failures from a session
 * that is no longer current (because the watcher was closed or reopened) are ignored.
 */
/**
 * Recursive watcher of one project root directory.
 */
@DraftDocs("subscription matching examples")
public class ProjectWatcher implements AutoCloseable {
	private final Path root;
	public Path root() {
		return root;
	}
	private final FileEventSource source;
	private final Executor executor;
	private final Duration debounce;
	private final IgnoreRules ignore;
	/**
	 * Checks whether events for {@code path} are filtered out by ignore rules.
	 * Subscribers of ignored paths never receive any events.
	 */
	public boolean ignored(Path path) {
		return ignore.ignored(path.toAbsolutePath().normalize());
	}
	/*
	 * Receives drop and error notifications. Null for standalone watchers, which only log them.
	 */
	private final FileEventListener failures;
	public ProjectWatcher(Path root, WatcherOptions options) {
		this(root, options, null);
	}
	ProjectWatcher(Path root, WatcherOptions options, FileEventListener failures) {
		Objects.requireNonNull(root);
		Objects.requireNonNull(options);
		this.root = RealPaths.resolve(root);
		source = options.source();
		executor = options.executor();
		debounce = options.debounce();
		ignore = new IgnoreRules(this.root, options.ignore());
		this.failures = failures;
		OwnerTrace.of(this)
			.alias("watcher")
			.tag("root", this.root);
	}
	private static final Logger logger = LoggerFactory.getLogger(ProjectWatcher.class);
	private static final Counter eventCounter = Metrics.counter("reactivefs.watcher.events");
	private static final Counter batchCounter = Metrics.counter("reactivefs.watcher.batches");
	private WatcherState state = WatcherState.UNINITIALIZED;
	public synchronized WatcherState state() {
		return state;
	}
	public synchronized boolean initialized() {
		return state == WatcherState.INITIALIZED;
	}
	/*
	 * Shared by all concurrent init() calls. Reset on failure and on close(), so that init() can be retried.
	 */
	private CompletableFuture<Void> initializing;
	private Object session;
	private Closeable handle;
	/**
	 * Starts watching the root directory. The returned future completes when the OS watch is established.
	 * Concurrent calls share one initialization. Calling this method on an initialized watcher is a no-op.
	 * If initialization fails, the watcher returns to {@link WatcherState#UNINITIALIZED} and a later call retries.
	 *
	 * @return future completing when the watcher is initialized
	 */
	public CompletableFuture<Void> init() {
		Object token = new Object();
		CompletableFuture<Void> future;
		synchronized (this) {
			if (initializing != null)
				return initializing;
			state = WatcherState.INITIALIZING;
			session = token;
			future = new CompletableFuture<>();
			initializing = future;
		}
		executor.execute(() -> open(token, future));
		return future;
	}
	private void open(Object token, CompletableFuture<Void> future) {
		Closeable opened;
		try {
			opened = source.subscribe(root, new SessionListener(token));
		} catch (Throwable ex) {
			synchronized (this) {
				if (session == token) {
					state = WatcherState.UNINITIALIZED;
					session = null;
					initializing = null;
				}
			}
			logger.debug("Failed to start watching {}.", root, ex);
			future.completeExceptionally(ex);
			return;
		}
		boolean current;
		synchronized (this) {
			current = session == token;
			if (current) {
				handle = opened;
				state = WatcherState.INITIALIZED;
			}
		}
		if (!current) {
			release(opened);
			future.completeExceptionally(new CancellationException("Watcher was closed during initialization."));
			return;
		}
		logger.debug("Watching {}.", root);
		future.complete(null);
	}
	private class SessionListener implements FileEventListener {
		final Object token;
		SessionListener(Object token) {
			this.token = token;
		}
		@Override
		public void onEvents(List<WatchEvent> events) {
			receive(token, events);
		}
		@Override
		public void onDropped() {
			if (!current(token))
				return;
			logger.warn("Watcher for {} dropped events.", root);
			if (failures != null)
				failures.onDropped();
		}
		@Override
		public void onError(Throwable exception) {
			if (!current(token))
				return;
			logger.warn("Watcher for {} failed.", root, exception);
			if (failures != null)
				failures.onError(exception);
		}
	}
	private synchronized boolean current(Object token) {
		return session == token;
	}
	private static class PathSubscription {
		final Path path;
		final Consumer<List<WatchEvent>> callback;
		final boolean watchChildren;
		PathSubscription(Path path, Consumer<List<WatchEvent>> callback, boolean watchChildren) {
			this.path = path;
			this.callback = callback;
			this.watchChildren = watchChildren;
		}
		/*
		 * Without watchChildren, the subscription sees the path itself and its direct children,
		 * which is what a file read or directory listing depends on.
		 */
		boolean matches(WatchEvent event) {
			Path changed = event.path();
			if (changed.equals(path))
				return true;
			if (watchChildren)
				return changed.startsWith(path);
			return path.equals(changed.getParent());
		}
	}
	private final Map<Object, PathSubscription> subscriptions = new LinkedHashMap<>();
	public synchronized int subscriptionCount() {
		return subscriptions.size();
	}
	/**
	 * Registers {@code callback} for changes of {@code path} on an already initialized watcher.
	 *
	 * @param path
	 *            file or directory under the root
	 * @param callback
	 *            receiver of matching event batches, called on the timer thread
	 * @param watchChildren
	 *            {@code true} to receive events for all descendants, {@code false} for the path and its direct children only
	 * @return handle that cancels the subscription when closed, idempotent
	 * @throws IllegalStateException
	 *             if the watcher is not initialized
	 * @throws IllegalArgumentException
	 *             if {@code path} is not under the root
	 */
	public CloseableScope subscribeSync(Path path, Consumer<List<WatchEvent>> callback, boolean watchChildren) {
		Objects.requireNonNull(path);
		Objects.requireNonNull(callback);
		Path resolved = RealPaths.resolve(path);
		if (!resolved.startsWith(root))
			throw new IllegalArgumentException("Path " + resolved + " is outside of watched root " + root + ".");
		Object token = new Object();
		synchronized (this) {
			if (state != WatcherState.INITIALIZED)
				throw new IllegalStateException("Watcher for " + root + " is not initialized.");
			subscriptions.put(token, new PathSubscription(resolved, callback, watchChildren));
		}
		return () -> {
			synchronized (ProjectWatcher.this) {
				subscriptions.remove(token);
			}
		};
	}
	/**
	 * Initializes the watcher if necessary and then registers {@code callback} like {@link #subscribeSync(Path, Consumer, boolean)}.
	 *
	 * @param path
	 *            file or directory under the root
	 * @param callback
	 *            receiver of matching event batches
	 * @param watchChildren
	 *            {@code true} to receive events for all descendants
	 * @return future of the cancel handle
	 */
	public CompletableFuture<CloseableScope> subscribe(Path path, Consumer<List<WatchEvent>> callback, boolean watchChildren) {
		Objects.requireNonNull(path);
		Objects.requireNonNull(callback);
		return init().thenApply(nothing -> subscribeSync(path, callback, watchChildren));
	}
	private List<WatchEvent> buffer = new ArrayList<>();
	private ScheduledFuture<?> flush;
	private void receive(Object token, List<WatchEvent> events) {
		List<WatchEvent> accepted = new ArrayList<>();
		for (WatchEvent event : events) {
			Path path = event.path().toAbsolutePath().normalize();
			if (!ignore.ignored(path))
				accepted.add(path.equals(event.path()) ? event : new WatchEvent(event.kind(), path));
		}
		if (accepted.isEmpty())
			return;
		synchronized (this) {
			if (session != token)
				return;
			buffer.addAll(accepted);
			if (flush != null)
				flush.cancel(false);
			flush = ReactiveExecutor.timer().schedule(this::flush, debounce.toNanos(), TimeUnit.NANOSECONDS);
		}
	}
	private void flush() {
		List<WatchEvent> events;
		List<PathSubscription> targets;
		synchronized (this) {
			events = buffer;
			buffer = new ArrayList<>();
			flush = null;
			targets = new ArrayList<>(subscriptions.values());
		}
		if (events.isEmpty())
			return;
		eventCounter.increment(events.size());
		batchCounter.increment();
		logger.trace("Dispatching {} events under {} to {} subscriptions.", events.size(), root, targets.size());
		for (PathSubscription subscription : targets) {
			List<WatchEvent> matched = new ArrayList<>();
			for (WatchEvent event : events)
				if (subscription.matches(event))
					matched.add(event);
			if (!matched.isEmpty()) {
				List<WatchEvent> batch = Collections.unmodifiableList(matched);
				/*
				 * One failing subscriber must not prevent delivery to the others.
				 */
				ExceptionLogging.log(logger).run(() -> subscription.callback.accept(batch));
			}
		}
	}
	/**
	 * Stops watching, drops all subscriptions and buffered events, and cancels the debounce timer.
	 * The watcher returns to {@link WatcherState#UNINITIALIZED} and it can be initialized again.
	 */
	@Override
	public void close() {
		Closeable closed;
		synchronized (this) {
			state = WatcherState.UNINITIALIZED;
			session = null;
			initializing = null;
			closed = handle;
			handle = null;
			subscriptions.clear();
			buffer = new ArrayList<>();
			if (flush != null) {
				flush.cancel(false);
				flush = null;
			}
		}
		if (closed != null) {
			release(closed);
			logger.debug("Stopped watching {}.", root);
		}
	}
	private static void release(Closeable closeable) {
		ExceptionLogging.log(logger).run(Exceptions.sneak().runnable(closeable::close));
	}
	@Override
	public String toString() {
		return OwnerTrace.of(this) + " (" + state().name().toLowerCase() + ")";
	}
}
