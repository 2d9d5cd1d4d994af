// Part of ReactiveFS
package com.machinezoo.reactivefs.watch;

import java.io.*;
import java.nio.file.*;
import java.nio.file.attribute.*;
import java.time.*;
import java.util.*;
import java.util.concurrent.*;
import java.util.function.*;
import org.slf4j.*;
import com.machinezoo.closeablescope.*;
import com.machinezoo.noexception.slf4j.*;
import com.machinezoo.reactivefs.*;
import com.machinezoo.reactivefs.util.*;
import com.machinezoo.stagean.*;
import io.micrometer.core.instrument.*;

/*
 * Pool owns one ProjectWatcher per project root and replaces it when it cannot be trusted anymore:
 * - the OS dropped events (queue overflow)
 * - the OS watch failed
 * - the root directory disappeared (liveness check)
 * - the root directory was replaced by a different directory at the same path (liveness check or init() with a new target)
 * - reinitialize() was called
 *
 * Automatic reinitialization is delayed. Failures arriving within the delay are coalesced and the latest reason wins.
 * If the root is missing when the delay expires, the pool keeps waiting for it to reappear.
 *
 * Every watcher that starts successfully gets a new generation number. Generation listeners are notified
 * after the new watcher is running, so that they can resubscribe and refresh state that may have missed events.
 * Coverage during the gap between the failure and the restart cannot be guaranteed, which is why listeners
 * are expected to drop everything they have cached under the root.
 *
 * Lock order is pool, then watcher. Listeners and watcher initialization run outside of the pool lock.
 */
/**
 * Registry of {@link ProjectWatcher}s with automatic failure recovery.
 */
@DraftDocs("recovery walkthrough")
public class WatcherPool implements AutoCloseable {
	private final WatcherOptions options;
	private final Duration recovery;
	private final Duration liveness;
	public WatcherPool(WatcherOptions options) {
		Objects.requireNonNull(options);
		this.options = options;
		recovery = options.recovery();
		liveness = options.liveness();
		OwnerTrace.of(this).alias("pool");
	}
	public WatcherPool() {
		this(new WatcherOptions());
	}
	public WatcherOptions options() {
		return options;
	}
	private static final Logger logger = LoggerFactory.getLogger(WatcherPool.class);
	private static class Root {
		final Path requested;
		Path resolved;
		ProjectWatcher watcher;
		/*
		 * Non-null while a watcher is being initialized.
		 */
		CompletableFuture<Void> starting;
		long generation;
		int reinitializeCount;
		ReinitializeReason lastReason;
		final EnumMap<ReinitializeReason, Integer> counts = new EnumMap<>(ReinitializeReason.class);
		Throwable failure;
		/*
		 * Identity of the root directory observed when the current watcher started.
		 */
		Object fingerprint;
		ReinitializeReason pending;
		ScheduledFuture<?> recovery;
		ScheduledFuture<?> liveness;
		boolean closed;
		Root(Path requested, Path resolved) {
			this.requested = requested;
			this.resolved = resolved;
		}
	}
	/*
	 * Keyed by normalized requested path. Several spellings of the same root share one entry.
	 */
	private final Map<Path, Root> roots = new LinkedHashMap<>();
	private Set<Root> distinct() {
		Set<Root> set = Collections.newSetFromMap(new IdentityHashMap<>());
		set.addAll(roots.values());
		return set;
	}
	private Root find(Path path) {
		Path requested = path.toAbsolutePath().normalize();
		Root entry = roots.get(requested);
		if (entry != null)
			return entry;
		Path resolved = RealPaths.resolve(requested);
		for (Root other : roots.values())
			if (other.resolved.equals(resolved))
				return other;
		return null;
	}
	/**
	 * Starts watching {@code root}. Repeated calls for the same directory share one watcher.
	 * If {@code root} now resolves to a different directory than before (for example a retargeted symlink),
	 * the old watcher is closed and replaced with reason {@link ReinitializeReason#PROJECT_DIRECTORY_REPLACED}.
	 * Failure is reported through the returned future and recorded in {@link #status(Path)}. It is not retried automatically.
	 *
	 * @param root
	 *            project root directory
	 * @return future completing when the watcher is running
	 */
	public CompletableFuture<Void> init(Path root) {
		Objects.requireNonNull(root);
		Path requested = root.toAbsolutePath().normalize();
		Path resolved = RealPaths.resolve(requested);
		Restart restart;
		synchronized (this) {
			Root entry = roots.get(requested);
			if (entry == null) {
				for (Root other : roots.values()) {
					if (other.resolved.equals(resolved)) {
						entry = other;
						roots.put(requested, entry);
						break;
					}
				}
			}
			ReinitializeReason reason;
			if (entry == null) {
				entry = new Root(requested, resolved);
				roots.put(requested, entry);
				reason = null;
			} else if (!entry.resolved.equals(resolved)) {
				logger.info("Project root {} now resolves to {} instead of {}.", requested, resolved, entry.resolved);
				entry.resolved = resolved;
				reason = ReinitializeReason.PROJECT_DIRECTORY_REPLACED;
			} else {
				if (entry.starting != null)
					return entry.starting;
				if (entry.watcher != null && entry.watcher.initialized())
					return CompletableFuture.completedFuture(null);
				/*
				 * Earlier initialization failed or the pool is waiting for the root to reappear. Try now.
				 */
				if (entry.generation == 0)
					reason = null;
				else
					reason = entry.pending != null ? entry.pending : ReinitializeReason.MANUAL;
			}
			restart = prepare(entry, reason);
		}
		return restart.run();
	}
	private ProjectWatcher newWatcher(Root entry) {
		return new ProjectWatcher(entry.resolved, options, new FailureListener(entry));
	}
	private class FailureListener implements FileEventListener {
		final Root entry;
		FailureListener(Root entry) {
			this.entry = entry;
		}
		@Override
		public void onEvents(List<WatchEvent> events) {
		}
		@Override
		public void onDropped() {
			scheduleRecovery(entry, ReinitializeReason.DROP_EVENTS);
		}
		@Override
		public void onError(Throwable exception) {
			scheduleRecovery(entry, ReinitializeReason.WATCHER_ERROR);
		}
	}
	/*
	 * Completion is handled on the common pool, so that no pool callback runs on the thread that called init().
	 */
	private void launch(Root entry, ProjectWatcher watcher, ReinitializeReason reason, CompletableFuture<Void> future) {
		watcher.init().whenCompleteAsync((nothing, exception) -> {
			if (exception != null)
				failed(entry, watcher, reason, exception, future);
			else
				started(entry, watcher, reason, future);
		}, ReactiveExecutor.common());
	}
	private void started(Root entry, ProjectWatcher watcher, ReinitializeReason reason, CompletableFuture<Void> future) {
		Object fingerprint = fingerprint(watcher.root());
		long generation = 0;
		boolean stale = false;
		synchronized (this) {
			if (entry.closed || entry.watcher != watcher)
				stale = true;
			else {
				entry.starting = null;
				entry.failure = null;
				entry.fingerprint = fingerprint;
				generation = ++entry.generation;
				if (reason != null) {
					++entry.reinitializeCount;
					entry.lastReason = reason;
					entry.counts.merge(reason, 1, Integer::sum);
				}
				if (entry.liveness == null && !liveness.isZero()) {
					entry.liveness = ReactiveExecutor.timer().scheduleWithFixedDelay(
						() -> ExceptionLogging.log(logger).run(() -> checkLiveness(entry)),
						liveness.toNanos(), liveness.toNanos(), TimeUnit.NANOSECONDS);
				}
			}
		}
		if (stale) {
			watcher.close();
			future.completeExceptionally(new CancellationException("Watcher was replaced or closed during initialization."));
			return;
		}
		if (reason != null) {
			Metrics.counter("reactivefs.watcher.reinitializations", "reason", reason.label()).increment();
			logger.info("Reinitialized watcher for {} ({}), generation {}.", watcher.root(), reason.label(), generation);
		} else
			logger.debug("Started watcher for {}, generation {}.", watcher.root(), generation);
		for (BiConsumer<Path, ReinitializeReason> listener : listeners.values())
			ExceptionLogging.log(logger).run(() -> listener.accept(watcher.root(), reason));
		future.complete(null);
	}
	private void failed(Root entry, ProjectWatcher watcher, ReinitializeReason reason, Throwable exception, CompletableFuture<Void> future) {
		Throwable cause = exception instanceof CompletionException && exception.getCause() != null ? exception.getCause() : exception;
		boolean current;
		synchronized (this) {
			current = !entry.closed && entry.watcher == watcher;
			if (current) {
				entry.starting = null;
				entry.failure = cause;
			}
		}
		if (!current)
			logger.debug("Replaced watcher for {} failed to start.", watcher.root(), cause);
		else if (reason != null) {
			logger.warn("Failed to reinitialize watcher for {} ({}). Retrying.", watcher.root(), reason.label(), cause);
			scheduleRecovery(entry, reason);
		} else
			logger.warn("Failed to start watcher for {}.", watcher.root(), cause);
		future.completeExceptionally(cause);
	}
	private void scheduleRecovery(Root entry, ReinitializeReason reason) {
		boolean fresh;
		synchronized (this) {
			if (entry.closed)
				return;
			fresh = entry.pending == null;
			entry.pending = reason;
			if (entry.recovery != null)
				return;
			entry.recovery = ReactiveExecutor.timer().schedule(
				() -> ExceptionLogging.log(logger).run(() -> recover(entry)),
				recovery.toNanos(), TimeUnit.NANOSECONDS);
		}
		if (fresh)
			logger.info("Scheduled reinitialization of watcher for {} ({}).", entry.resolved, reason.label());
	}
	private void recover(Root entry) {
		Path root;
		ReinitializeReason reason;
		synchronized (this) {
			entry.recovery = null;
			if (entry.closed || entry.pending == null)
				return;
			root = entry.resolved;
			reason = entry.pending;
		}
		if (!Files.isDirectory(root)) {
			ProjectWatcher dead;
			synchronized (this) {
				dead = entry.watcher;
				entry.watcher = null;
			}
			if (dead != null) {
				dead.close();
				logger.warn("Project root {} is missing. Waiting for it to reappear.", root);
			}
			scheduleRecovery(entry, reason);
			return;
		}
		restart(entry, reason);
	}
	private class Restart {
		final Root entry;
		final ReinitializeReason reason;
		final ProjectWatcher old;
		final ProjectWatcher watcher;
		final CompletableFuture<Void> future;
		Restart(Root entry, ReinitializeReason reason, ProjectWatcher old, ProjectWatcher watcher, CompletableFuture<Void> future) {
			this.entry = entry;
			this.reason = reason;
			this.old = old;
			this.watcher = watcher;
			this.future = future;
		}
		/*
		 * Runs outside of the pool lock.
		 */
		CompletableFuture<Void> run() {
			if (old != null)
				old.close();
			launch(entry, watcher, reason, future);
			return future;
		}
	}
	/*
	 * Swaps in a new watcher. Must be called while holding the pool lock.
	 */
	private Restart prepare(Root entry, ReinitializeReason reason) {
		if (entry.recovery != null) {
			entry.recovery.cancel(false);
			entry.recovery = null;
		}
		entry.pending = null;
		ProjectWatcher old = entry.watcher;
		ProjectWatcher watcher = entry.watcher = newWatcher(entry);
		CompletableFuture<Void> future = entry.starting = new CompletableFuture<>();
		return new Restart(entry, reason, old, watcher, future);
	}
	private CompletableFuture<Void> restart(Root entry, ReinitializeReason reason) {
		Restart restart;
		synchronized (this) {
			if (entry.closed)
				return CompletableFuture.failedFuture(new IllegalStateException("Watcher was closed."));
			restart = prepare(entry, reason);
		}
		return restart.run();
	}
	/**
	 * Replaces the watcher of {@code root} immediately, without waiting for the recovery delay.
	 *
	 * @param root
	 *            project root passed to {@link #init(Path)}
	 * @param reason
	 *            reason recorded in {@link #status(Path)}
	 * @return future completing when the new watcher is running
	 * @throws IllegalArgumentException
	 *             if {@code root} was never initialized
	 */
	public CompletableFuture<Void> reinitialize(Path root, ReinitializeReason reason) {
		Objects.requireNonNull(root);
		Objects.requireNonNull(reason);
		Root entry;
		synchronized (this) {
			entry = find(root);
		}
		if (entry == null)
			throw new IllegalArgumentException("Project root " + root + " is not watched.");
		return restart(entry, reason);
	}
	private void checkLiveness(Root entry) {
		Path root;
		Object expected;
		synchronized (this) {
			if (entry.closed || entry.recovery != null || entry.starting != null || entry.watcher == null)
				return;
			root = entry.resolved;
			expected = entry.fingerprint;
		}
		Object actual = fingerprint(root);
		if (actual == null)
			scheduleRecovery(entry, ReinitializeReason.MISSING_PROJECT_DIRECTORY);
		else if (expected != null && !actual.equals(expected))
			scheduleRecovery(entry, ReinitializeReason.PROJECT_DIRECTORY_REPLACED);
	}
	/*
	 * File key (inode on Unix) identifies the directory. Creation time is a fallback for file systems without file keys.
	 * Returns null if the root is missing or is no longer a directory.
	 */
	private static Object fingerprint(Path root) {
		try {
			BasicFileAttributes attributes = Files.readAttributes(root, BasicFileAttributes.class);
			if (!attributes.isDirectory())
				return null;
			return attributes.fileKey() != null ? attributes.fileKey() : attributes.creationTime();
		} catch (NoSuchFileException ex) {
			return null;
		} catch (IOException ex) {
			logger.debug("Cannot read attributes of {}.", root, ex);
			return null;
		}
	}
	/**
	 * Returns initialized watcher whose root contains {@code path}. The deepest root wins if several match.
	 *
	 * @param path
	 *            file or directory to watch
	 * @return initialized watcher
	 * @throws WatcherUnavailableException
	 *             if no initialized watcher covers {@code path}
	 */
	public synchronized ProjectWatcher acquireWatcher(Path path) {
		Objects.requireNonNull(path);
		Path resolved = RealPaths.resolve(path);
		Root best = null;
		for (Root entry : distinct()) {
			if (entry.watcher == null || !entry.watcher.initialized() || !resolved.startsWith(entry.resolved))
				continue;
			if (best == null || entry.resolved.getNameCount() > best.resolved.getNameCount())
				best = entry;
		}
		if (best == null)
			throw new WatcherUnavailableException(resolved);
		return best.watcher;
	}
	public synchronized boolean initialized() {
		for (Root entry : roots.values())
			if (entry.watcher != null && entry.watcher.initialized())
				return true;
		return false;
	}
	public synchronized int activeSubscriptionCount() {
		int count = 0;
		for (Root entry : distinct())
			if (entry.watcher != null)
				count += entry.watcher.subscriptionCount();
		return count;
	}
	/**
	 * Returns resolved root of the watcher that covers {@code path}.
	 *
	 * @param path
	 *            file or directory
	 * @return watched root or empty if no initialized watcher covers {@code path}
	 */
	public Optional<Path> watchedRoot(Path path) {
		try {
			return Optional.of(acquireWatcher(path).root());
		} catch (WatcherUnavailableException ex) {
			return Optional.empty();
		}
	}
	public synchronized WatcherStatus status(Path root) {
		Objects.requireNonNull(root);
		Root entry = find(root);
		if (entry == null)
			return new WatcherStatus(RealPaths.resolve(root), false, 0, 0, 0, null, new EnumMap<>(ReinitializeReason.class), null);
		boolean initialized = entry.watcher != null && entry.watcher.initialized();
		int subscriptions = entry.watcher != null ? entry.watcher.subscriptionCount() : 0;
		return new WatcherStatus(entry.resolved, initialized, subscriptions, entry.generation, entry.reinitializeCount, entry.lastReason, entry.counts, entry.failure);
	}
	private final Map<Object, BiConsumer<Path, ReinitializeReason>> listeners = new ConcurrentHashMap<>();
	/**
	 * Registers {@code listener} that is called every time a watcher starts.
	 * Arguments are the resolved root and the reinitialization reason, which is {@code null} for the first watcher of the root.
	 *
	 * @param listener
	 *            callback, run on a background thread
	 * @return handle that removes the listener when closed
	 */
	public CloseableScope onGeneration(BiConsumer<Path, ReinitializeReason> listener) {
		Objects.requireNonNull(listener);
		Object token = new Object();
		listeners.put(token, listener);
		return () -> listeners.remove(token);
	}
	/**
	 * Closes all watchers, cancels pending recovery and liveness timers, and forgets all roots.
	 * The pool can be used again afterwards.
	 */
	public void closeAllWatchers() {
		List<ProjectWatcher> closing = new ArrayList<>();
		synchronized (this) {
			for (Root entry : distinct()) {
				entry.closed = true;
				if (entry.recovery != null)
					entry.recovery.cancel(false);
				if (entry.liveness != null)
					entry.liveness.cancel(false);
				entry.recovery = null;
				entry.liveness = null;
				if (entry.watcher != null)
					closing.add(entry.watcher);
				entry.watcher = null;
				if (entry.starting != null)
					entry.starting.completeExceptionally(new CancellationException("Watcher pool was closed."));
				entry.starting = null;
			}
			roots.clear();
		}
		for (ProjectWatcher watcher : closing)
			watcher.close();
		if (!closing.isEmpty())
			logger.debug("Closed {} watchers.", closing.size());
	}
	@Override
	public void close() {
		closeAllWatchers();
	}
	@Override
	public String toString() {
		return OwnerTrace.of(this).toString();
	}
}
