// Part of ReactiveFS
package com.machinezoo.reactivefs.fs;

import java.io.*;
import java.nio.charset.*;
import java.nio.file.*;
import java.nio.file.attribute.*;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.*;
import java.util.function.*;
import org.slf4j.*;
import com.machinezoo.closeablescope.*;
import com.machinezoo.noexception.slf4j.*;
import com.machinezoo.reactivefs.*;
import com.machinezoo.reactivefs.util.*;
import com.machinezoo.reactivefs.watch.*;
import com.machinezoo.reactivefs.watch.WatchEvent;
import com.machinezoo.stagean.*;
import io.micrometer.core.instrument.*;

/*
 * Path cache maps (path, operation) to a cell whose compute function performs the actual I/O.
 * Reads inside a tracked computation therefore make the computation depend on the file system state they observed.
 * Filtered directory listings get a cell per combination of listing options.
 *
 * The first cell for a path subscribes the path with the watcher that covers it. Subscriptions see the path itself
 * and its direct children, which is all that any of the four operations depends on. Events invalidate:
 * - all cells of the changed path
 * - listings of the parent directory if a child was created or deleted
 * - all cells under a deleted path
 * Content updates of a nested file do not invalidate listings of its ancestors.
 *
 * When no initialized watcher covers the path or the path is ignored by the watcher, reads go straight
 * to the file system and nothing is cached, because there would be nothing to invalidate the cached value.
 *
 * Every read also depends on the coverage cell, which is invalidated whenever a watcher starts.
 * Unwatched reads thus switch to watched reads once watching begins. Reads that raced with a watcher restart
 * may have landed in a cell whose path is no longer subscribed. Coverage makes them re-run too.
 *
 * Reads that raced with cache clearing may have landed in a cell that was already removed from the map.
 * No event would ever reach such a cell, so the read is repeated until it hits a cell that is still in the map.
 *
 * When a watcher is replaced, it might have missed events. All cells under its root are invalidated and dropped
 * and all subscriptions under the root are forgotten, so that the next read hits the disk and subscribes again.
 */
/**
 * Reactive cache of file contents, directory listings, and file metadata.
 */
@DraftDocs("usage example with ReactiveStream")
public class PathCache implements AutoCloseable {
	private final WatcherPool pool;
	private final CloseableScope generations;
	public PathCache(WatcherPool pool) {
		Objects.requireNonNull(pool);
		this.pool = pool;
		OwnerTrace.of(this).alias("cache");
		generations = pool.onGeneration(this::restarted);
	}
	public WatcherPool pool() {
		return pool;
	}
	private static final Logger logger = LoggerFactory.getLogger(PathCache.class);
	private static final AtomicInteger liveCells = Metrics.gauge("reactivefs.cache.cells", new AtomicInteger());
	private static class PathKey {
		final Path path;
		final PathOperation operation;
		/*
		 * Null for everything except filtered listings.
		 */
		final ListingOptions listing;
		PathKey(Path path, PathOperation operation, ListingOptions listing) {
			this.path = path;
			this.operation = operation;
			this.listing = listing;
		}
		PathKey(Path path, PathOperation operation) {
			this(path, operation, null);
		}
		@Override
		public boolean equals(Object obj) {
			if (!(obj instanceof PathKey))
				return false;
			PathKey other = (PathKey)obj;
			return path.equals(other.path) && operation == other.operation && Objects.equals(listing, other.listing);
		}
		@Override
		public int hashCode() {
			return 31 * (31 * path.hashCode() + operation.hashCode()) + Objects.hashCode(listing);
		}
	}
	private final Map<PathKey, ReactiveCell<?>> cells = new ConcurrentHashMap<>();
	/*
	 * Filtered listings per directory, so that events can find them without scanning all cells.
	 */
	private final Map<Path, Set<ListingOptions>> listings = new ConcurrentHashMap<>();
	private final Map<Path, CloseableScope> watched = new ConcurrentHashMap<>();
	/*
	 * Incremented whenever subscriptions are forgotten. Subscriptions created across the increment are discarded.
	 */
	private final AtomicLong epoch = new AtomicLong();
	private final ReactiveCell<Boolean> coverage = OwnerTrace.of(new ReactiveCell<>(() -> true))
		.parent(this)
		.tag("role", "coverage")
		.target();
	/**
	 * Reads text content of a file.
	 *
	 * @param path
	 *            file to read
	 * @return UTF-8 decoded content or empty if the file doesn't exist or it is a directory
	 * @throws UncheckedIOException
	 *             if the file exists but cannot be read
	 */
	public Optional<String> readFile(Path path) {
		return read(new PathKey(RealPaths.resolve(path), PathOperation.READ), PathCache::readFileNow);
	}
	/**
	 * Lists immediate children of a directory, sorted by name. Hidden entries are included.
	 *
	 * @param path
	 *            directory to list
	 * @return sorted entries or empty if the directory doesn't exist or it is not a directory
	 * @throws UncheckedIOException
	 *             if the directory exists but cannot be listed
	 */
	public Optional<List<DirectoryEntry>> readDir(Path path) {
		return read(new PathKey(RealPaths.resolve(path), PathOperation.LIST), PathCache::readDirNow);
	}
	/**
	 * Lists immediate children of a directory that pass the given filter, sorted by name.
	 *
	 * @param path
	 *            directory to list
	 * @param options
	 *            filter applied to the entries
	 * @return sorted entries or empty if the directory doesn't exist or it is not a directory
	 * @throws UncheckedIOException
	 *             if the directory exists but cannot be listed
	 */
	public Optional<List<DirectoryEntry>> readDir(Path path, ListingOptions options) {
		Objects.requireNonNull(options);
		if (options.equals(ListingOptions.ALL))
			return readDir(path);
		return read(new PathKey(RealPaths.resolve(path), PathOperation.LIST, options), p -> readDirNow(p).map(options::apply));
	}
	public boolean exists(Path path) {
		return read(new PathKey(RealPaths.resolve(path), PathOperation.EXISTS), Files::exists);
	}
	public Optional<FileStat> stat(Path path) {
		return read(new PathKey(RealPaths.resolve(path), PathOperation.STAT), PathCache::statNow);
	}
	private <T> T read(PathKey key, Function<Path, T> io) {
		Metrics.counter("reactivefs.cache.reads", "operation", key.operation.name().toLowerCase()).increment();
		/*
		 * Coverage must be read before the subscription is checked. Restarts invalidate coverage after forgetting subscriptions.
		 */
		coverage.read();
		if (!watch(key.path))
			return io.apply(key.path);
		while (true) {
			@SuppressWarnings("unchecked")
			ReactiveCell<T> cell = (ReactiveCell<T>)cells.computeIfAbsent(key, k -> {
				liveCells.incrementAndGet();
				return OwnerTrace.of(new ReactiveCell<>(() -> io.apply(k.path)))
					.parent(this)
					.tag("path", k.path)
					.tag("operation", k.listing != null ? k.operation + "(" + k.listing + ")" : k.operation)
					.target();
			});
			if (key.listing != null)
				index(key);
			T value = cell.read();
			/*
			 * Cells are removed before they are invalidated. If the cell is still in the map,
			 * any later removal will invalidate the version we have just read.
			 */
			if (cells.get(key) == cell)
				return value;
			logger.trace("Cell for {} was dropped during read. Reading again.", key.path);
		}
	}
	private void index(PathKey key) {
		listings.compute(key.path, (path, variants) -> {
			if (variants == null)
				variants = ConcurrentHashMap.newKeySet();
			variants.add(key.listing);
			return variants;
		});
	}
	/*
	 * Indexing follows insertion of the cell, so the entry is kept if a new cell replaced the dropped one.
	 */
	private void unindex(PathKey key) {
		listings.computeIfPresent(key.path, (path, variants) -> {
			if (!cells.containsKey(key))
				variants.remove(key.listing);
			return variants.isEmpty() ? null : variants;
		});
	}
	/*
	 * Subscription precedes the first read, so that changes that happen during the read are not missed.
	 */
	private boolean watch(Path path) {
		if (watched.containsKey(path))
			return true;
		long observed = epoch.get();
		ProjectWatcher watcher;
		CloseableScope subscription;
		try {
			watcher = pool.acquireWatcher(path);
			if (watcher.ignored(path)) {
				logger.trace("Reading ignored path {} without watching.", path);
				return false;
			}
			subscription = watcher.subscribeSync(path, this::changed, false);
		} catch (WatcherUnavailableException ex) {
			logger.trace("Reading {} without watching.", path);
			return false;
		} catch (IllegalStateException ex) {
			/*
			 * Watcher was closed between acquisition and subscription.
			 */
			logger.debug("Watcher for {} closed before subscription.", path);
			return false;
		}
		if (watched.putIfAbsent(path, subscription) != null) {
			subscription.close();
			return true;
		}
		/*
		 * Subscriptions were forgotten while we were subscribing. Ours might belong to the replaced watcher.
		 * Coverage was invalidated after the increment, so the caller re-runs and subscribes again.
		 */
		if (epoch.get() != observed && watched.remove(path, subscription))
			subscription.close();
		return true;
	}
	private void changed(List<WatchEvent> events) {
		for (WatchEvent event : events) {
			Path path = event.path();
			invalidate(path);
			if (event.structural() && path.getParent() != null)
				invalidate(path.getParent(), PathOperation.LIST);
			if (event.kind() == WatchEventKind.DELETE) {
				for (PathKey key : new ArrayList<>(cells.keySet()))
					if (!key.path.equals(path) && key.path.startsWith(path))
						invalidate(key);
			}
		}
	}
	private void invalidate(Path path) {
		for (PathOperation operation : PathOperation.values())
			invalidate(path, operation);
	}
	private void invalidate(Path path, PathOperation operation) {
		invalidate(new PathKey(path, operation));
		if (operation == PathOperation.LIST) {
			Set<ListingOptions> variants = listings.get(path);
			if (variants != null)
				for (ListingOptions options : variants)
					invalidate(new PathKey(path, operation, options));
		}
	}
	private void invalidate(PathKey key) {
		ReactiveCell<?> cell = cells.get(key);
		if (cell != null)
			cell.invalidate();
	}
	/*
	 * Removal precedes invalidation. Readers rely on this order to detect cells dropped during read.
	 */
	private int drop(Predicate<PathKey> filter) {
		int dropped = 0;
		for (PathKey key : new ArrayList<>(cells.keySet())) {
			if (filter.test(key)) {
				ReactiveCell<?> cell = cells.remove(key);
				if (cell != null) {
					liveCells.decrementAndGet();
					if (key.listing != null)
						unindex(key);
					cell.invalidate();
					++dropped;
				}
			}
		}
		return dropped;
	}
	private void restarted(Path root, ReinitializeReason reason) {
		epoch.incrementAndGet();
		for (Path path : new ArrayList<>(watched.keySet())) {
			if (path.startsWith(root)) {
				CloseableScope subscription = watched.remove(path);
				if (subscription != null)
					subscription.close();
			}
		}
		int dropped = drop(key -> key.path.startsWith(root));
		if (reason != null)
			logger.info("Watcher for {} was reinitialized ({}). Dropped {} cached entries.", root, reason.label(), dropped);
		coverage.invalidate();
	}
	/**
	 * Drops all cached values. Subscriptions are kept. Computations that depend on dropped values are re-run.
	 */
	public void clearCache() {
		drop(key -> true);
	}
	/**
	 * Drops cached values of {@code path} and everything under it. Subscriptions are kept.
	 *
	 * @param path
	 *            file or directory whose cached values are dropped
	 */
	public void clearCache(Path path) {
		Path prefix = RealPaths.resolve(path);
		int dropped = drop(key -> key.path.startsWith(prefix));
		logger.debug("Dropped {} cached entries under {}.", dropped, prefix);
	}
	public int getCacheSize() {
		return cells.size();
	}
	public int watchedPathCount() {
		return watched.size();
	}
	/**
	 * Cancels all subscriptions and drops all cached values. The pool is left running.
	 */
	@Override
	public void close() {
		generations.close();
		epoch.incrementAndGet();
		for (Path path : new ArrayList<>(watched.keySet())) {
			CloseableScope subscription = watched.remove(path);
			if (subscription != null)
				ExceptionLogging.log(logger).run(subscription::close);
		}
		clearCache();
	}
	/*
	 * Paths under a regular file fail with a generic FileSystemException. They don't exist either.
	 */
	private static <T> Optional<T> absent(Path path, IOException exception) {
		if (exception instanceof NoSuchFileException || exception instanceof NotDirectoryException || !Files.exists(path, LinkOption.NOFOLLOW_LINKS))
			return Optional.empty();
		throw new UncheckedIOException(exception);
	}
	private static Optional<String> readFileNow(Path path) {
		try {
			if (Files.isDirectory(path))
				return Optional.empty();
			return Optional.of(new String(Files.readAllBytes(path), StandardCharsets.UTF_8));
		} catch (IOException ex) {
			return absent(path, ex);
		}
	}
	private static Optional<List<DirectoryEntry>> readDirNow(Path path) {
		List<DirectoryEntry> entries = new ArrayList<>();
		try (DirectoryStream<Path> stream = Files.newDirectoryStream(path)) {
			for (Path child : stream) {
				EntryKind kind;
				try {
					kind = EntryKind.of(Files.readAttributes(child, BasicFileAttributes.class));
				} catch (NoSuchFileException ex) {
					/*
					 * Deleted or dangling symlink. Deletion will invalidate the listing again.
					 */
					if (!Files.isSymbolicLink(child))
						continue;
					kind = EntryKind.OTHER;
				}
				entries.add(new DirectoryEntry(child.getFileName().toString(), kind));
			}
		} catch (IOException ex) {
			return absent(path, ex);
		}
		Collections.sort(entries);
		return Optional.of(Collections.unmodifiableList(entries));
	}
	private static Optional<FileStat> statNow(Path path) {
		try {
			return Optional.of(FileStat.of(Files.readAttributes(path, BasicFileAttributes.class)));
		} catch (IOException ex) {
			return absent(path, ex);
		}
	}
	@Override
	public String toString() {
		return OwnerTrace.of(this) + " (" + cells.size() + " cells, " + watched.size() + " watched paths)";
	}
}
