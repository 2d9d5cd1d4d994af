// Part of ReactiveFS
package com.machinezoo.reactivefs.fs;

import static org.awaitility.Awaitility.*;
import static org.hamcrest.MatcherAssert.*;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;
import java.io.*;
import java.nio.charset.*;
import java.nio.file.*;
import java.time.*;
import java.util.*;
import java.util.concurrent.*;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.*;
import com.machinezoo.noexception.*;
import com.machinezoo.reactivefs.*;
import com.machinezoo.reactivefs.watch.*;

public class PathCacheTest extends TestBase {
	@TempDir
	Path temp;
	Path root;
	FakeFileEventSource source = new FakeFileEventSource();
	WatcherPool pool;
	PathCache cache;
	@BeforeEach
	public void setup() {
		root = RealPaths.resolve(temp);
		pool = new WatcherPool(new WatcherOptions()
			.source(source)
			.debounce(Duration.ofMillis(20))
			.recovery(Duration.ofMillis(50))
			.liveness(Duration.ZERO));
		cache = new PathCache(pool);
	}
	@AfterEach
	public void teardown() {
		cache.close();
		pool.closeAllWatchers();
	}
	private void init() {
		pool.init(root).join();
	}
	private static void write(Path path, String content) {
		Exceptions.sneak().run(() -> {
			Files.createDirectories(path.getParent());
			Files.write(path, content.getBytes(StandardCharsets.UTF_8));
		});
	}
	private static <T> T pull(ReactiveStream<T> stream) {
		return Exceptions.sneak().get(() -> CompletableFuture.supplyAsync(stream::next).get(10, TimeUnit.SECONDS));
	}
	@Test
	public void cached() {
		init();
		Path f = root.resolve("f.txt");
		write(f, "1");
		assertEquals(Optional.of("1"), cache.readFile(f));
		assertEquals(1, cache.getCacheSize());
		assertEquals(1, cache.watchedPathCount());
		// Without a change event, the second read is served from cache.
		write(f, "2");
		assertEquals(Optional.of("1"), cache.readFile(f));
		assertEquals(1, cache.getCacheSize());
		// Change event invalidates the cached value.
		source.update(f);
		await().until(() -> cache.readFile(f), equalTo(Optional.of("2")));
	}
	@Test
	public void operations() {
		init();
		Path f = root.resolve("f.txt");
		write(f, "hello");
		cache.readFile(f);
		cache.stat(f);
		cache.exists(f);
		cache.readDir(root);
		// Every (path, operation) pair has its own cell, but each path is subscribed only once.
		assertEquals(4, cache.getCacheSize());
		assertEquals(2, cache.watchedPathCount());
		cache.readFile(root.resolve("./f.txt"));
		assertEquals(4, cache.getCacheSize());
		assertEquals(2, pool.activeSubscriptionCount());
	}
	@Test
	public void absent() {
		init();
		Path missing = root.resolve("missing");
		assertEquals(Optional.empty(), cache.readFile(missing));
		assertEquals(Optional.empty(), cache.readDir(missing));
		assertEquals(Optional.empty(), cache.stat(missing));
		assertFalse(cache.exists(missing));
		// Directories have no content and files have no listing.
		Path f = root.resolve("f.txt");
		write(f, "text");
		assertEquals(Optional.empty(), cache.readFile(root));
		assertEquals(Optional.empty(), cache.readDir(f));
		assertEquals(Optional.empty(), cache.readFile(f.resolve("child")));
	}
	@Test
	public void listing() {
		init();
		write(root.resolve("b.txt"), "");
		write(root.resolve("a/nested.txt"), "");
		write(root.resolve(".hidden"), "");
		assertEquals(Optional.of(Arrays.asList(
			new DirectoryEntry(".hidden", EntryKind.FILE),
			new DirectoryEntry("a", EntryKind.DIRECTORY),
			new DirectoryEntry("b.txt", EntryKind.FILE))), cache.readDir(root));
		Path empty = root.resolve("empty");
		Exceptions.sneak().run(() -> Files.createDirectories(empty));
		assertEquals(Optional.of(Collections.emptyList()), cache.readDir(empty));
	}
	@Test
	public void stat() {
		init();
		Path f = root.resolve("f.txt");
		write(f, "12345");
		FileStat stat = cache.stat(f).get();
		assertEquals(EntryKind.FILE, stat.kind());
		assertEquals(5, stat.size());
		assertTrue(stat.file());
		assertFalse(stat.directory());
		assertTrue(cache.stat(root).get().directory());
		assertTrue(cache.exists(root));
	}
	@Test
	public void stream() {
		init();
		Path f = root.resolve("f.txt");
		write(f, "1");
		try (ReactiveStream<Optional<String>> s = ReactiveStream.of(() -> cache.readFile(f))) {
			assertEquals(Optional.of("1"), s.next());
			write(f, "2");
			source.update(f);
			assertEquals(Optional.of("2"), pull(s));
			// File deletion makes it absent.
			Exceptions.sneak().run(() -> Files.delete(f));
			source.delete(f);
			assertEquals(Optional.empty(), pull(s));
		}
	}
	@Test
	public void directoryStream() {
		init();
		Path x = root.resolve("x.txt");
		try (ReactiveStream<List<String>> s = ReactiveStream.of(() -> {
			List<String> names = new ArrayList<>();
			for (DirectoryEntry entry : cache.readDir(root).get())
				names.add(entry.name());
			return names;
		})) {
			assertThat(s.next(), empty());
			write(x, "x");
			source.create(x);
			assertEquals(Arrays.asList("x.txt"), pull(s));
			Exceptions.sneak().run(() -> Files.delete(x));
			source.delete(x);
			assertThat(pull(s), empty());
		}
	}
	@Test
	public void listingInvalidation() {
		init();
		Path child = root.resolve("child.txt");
		Path deep = root.resolve("a/b/deep.txt");
		write(child, "child");
		write(deep, "deep");
		Tracked<?> listing = ReactiveScope.runTracked(() -> cache.readDir(root));
		Tracked<?> nested = ReactiveScope.runTracked(() -> cache.readDir(root.resolve("a")));
		Tracked<?> content = ReactiveScope.runTracked(() -> cache.readFile(deep));
		Tracked<?> sibling = ReactiveScope.runTracked(() -> cache.readFile(child));
		// Content update of a deeply nested file invalidates only that file.
		source.update(deep);
		await().until(content::stale);
		settle();
		assertFalse(listing.stale());
		assertFalse(nested.stale());
		assertFalse(sibling.stale());
		// Content update of a direct child doesn't change the listing either.
		source.update(child);
		await().until(sibling::stale);
		settle();
		assertFalse(listing.stale());
		// Creating a direct child does.
		source.create(root.resolve("new.txt"));
		await().until(listing::stale);
		assertFalse(nested.stale());
	}
	@Test
	public void deletedDirectory() {
		init();
		Path deep = root.resolve("a/b/deep.txt");
		write(deep, "deep");
		Tracked<?> content = ReactiveScope.runTracked(() -> cache.readFile(deep));
		Tracked<?> listing = ReactiveScope.runTracked(() -> cache.readDir(root));
		// Deleting a directory invalidates everything under it and the parent's listing.
		source.delete(root.resolve("a"));
		await().until(content::stale);
		await().until(listing::stale);
	}
	@Test
	public void clear() {
		init();
		Path f = root.resolve("f.txt");
		write(f, "1");
		Tracked<?> tracked = ReactiveScope.runTracked(() -> cache.readFile(f));
		cache.clearCache();
		assertEquals(0, cache.getCacheSize());
		assertTrue(tracked.stale());
		// Subscriptions survive and fresh reads hit the disk.
		assertEquals(1, cache.watchedPathCount());
		write(f, "2");
		assertEquals(Optional.of("2"), cache.readFile(f));
		// New cells still receive events.
		write(f, "3");
		source.update(f);
		await().until(() -> cache.readFile(f), equalTo(Optional.of("3")));
	}
	@Test
	public void selectiveClear() {
		init();
		Path a = root.resolve("a/x.txt");
		Path b = root.resolve("b/y.txt");
		write(a, "a");
		write(b, "b");
		Tracked<?> first = ReactiveScope.runTracked(() -> cache.readFile(a));
		Tracked<?> second = ReactiveScope.runTracked(() -> cache.readFile(b));
		Tracked<?> listing = ReactiveScope.runTracked(() -> cache.readDir(root));
		assertEquals(3, cache.getCacheSize());
		cache.clearCache(root.resolve("a"));
		// Only entries under the cleared directory are dropped.
		assertTrue(first.stale());
		assertFalse(second.stale());
		assertFalse(listing.stale());
		assertEquals(2, cache.getCacheSize());
		assertEquals(3, cache.watchedPathCount());
		write(a, "a2");
		assertEquals(Optional.of("a2"), cache.readFile(a));
	}
	@Test
	public void clearDuringRead() {
		init();
		Path f = root.resolve("f.txt");
		write(f, "1");
		ExecutorService executor = Executors.newSingleThreadExecutor();
		try {
			for (int i = 0; i < 2000; ++i) {
				CyclicBarrier barrier = new CyclicBarrier(2);
				Future<?> clearing = executor.submit(() -> {
					Exceptions.sneak().run(barrier::await);
					cache.clearCache();
				});
				Exceptions.sneak().run(barrier::await);
				Tracked<?> tracked = ReactiveScope.runTracked(() -> cache.readFile(f));
				Exceptions.sneak().get(clearing::get);
				// Read that survived clearing must depend on the cell that future events will invalidate.
				if (!tracked.stale()) {
					Tracked<?> fresh = ReactiveScope.runTracked(() -> cache.readFile(f));
					assertTrue(tracked.dependencies().containsAll(fresh.dependencies()), "Iteration " + i);
				}
			}
		} finally {
			executor.shutdownNow();
		}
	}
	@Test
	public void reinitializeDuringRead() {
		init();
		Path f = root.resolve("f.txt");
		write(f, "1");
		for (int i = 0; i < 30; ++i) {
			CompletableFuture<Void> restart = pool.reinitialize(root, ReinitializeReason.MANUAL);
			Tracked<?> tracked = ReactiveScope.runTracked(() -> cache.readFile(f));
			restart.join();
			// Either the restart invalidated the read or the path is subscribed with the new watcher.
			if (!tracked.stale()) {
				source.update(f);
				await().until(tracked::stale);
			}
		}
	}
	@Test
	public void filteredListing() {
		init();
		write(root.resolve("b.txt"), "");
		write(root.resolve("a/nested.txt"), "");
		write(root.resolve(".hidden"), "");
		DirectoryEntry a = new DirectoryEntry("a", EntryKind.DIRECTORY);
		DirectoryEntry b = new DirectoryEntry("b.txt", EntryKind.FILE);
		DirectoryEntry hidden = new DirectoryEntry(".hidden", EntryKind.FILE);
		// Hidden entries are left out by default.
		assertEquals(Optional.of(Arrays.asList(a, b)), cache.readDir(root, new ListingOptions()));
		assertEquals(Optional.of(Arrays.asList(a)), cache.readDir(root, new ListingOptions().directoriesOnly(true)));
		assertEquals(Optional.of(Arrays.asList(hidden, b)), cache.readDir(root, new ListingOptions().filesOnly(true).includeHidden(true)));
		assertEquals(Optional.of(Arrays.asList(b)), cache.readDir(root, new ListingOptions().exclude("a")));
		assertEquals(cache.readDir(root), cache.readDir(root, ListingOptions.ALL));
		assertEquals(Optional.empty(), cache.readDir(root.resolve("missing"), new ListingOptions()));
		// Every combination of options has its own cell. Equal options share one.
		assertEquals(6, cache.getCacheSize());
		cache.readDir(root, new ListingOptions().exclude("a"));
		assertEquals(6, cache.getCacheSize());
		// Events invalidate filtered listings too.
		Tracked<?> visible = ReactiveScope.runTracked(() -> cache.readDir(root, new ListingOptions()));
		Path c = root.resolve("c.txt");
		write(c, "");
		source.create(c);
		await().until(visible::stale);
		assertEquals(Optional.of(Arrays.asList(a, b, new DirectoryEntry("c.txt", EntryKind.FILE))), cache.readDir(root, new ListingOptions()));
	}
	@Test
	public void ignoredPath() {
		init();
		Path head = root.resolve(".git/HEAD");
		write(head, "main");
		// Events under ignored paths are never delivered, so they are read without caching.
		assertEquals(Optional.of("main"), cache.readFile(head));
		assertEquals(0, cache.getCacheSize());
		assertEquals(0, cache.watchedPathCount());
		write(head, "dev");
		assertEquals(Optional.of("dev"), cache.readFile(head));
	}
	@Test
	public void unwatched() {
		Path f = root.resolve("f.txt");
		write(f, "1");
		// Without initialized watcher, reads go straight to disk and nothing is cached.
		assertEquals(Optional.of("1"), cache.readFile(f));
		assertEquals(0, cache.getCacheSize());
		assertEquals(0, cache.watchedPathCount());
		write(f, "2");
		assertEquals(Optional.of("2"), cache.readFile(f));
	}
	@Test
	public void watchingStarts() {
		Path f = root.resolve("f.txt");
		write(f, "1");
		try (ReactiveStream<Optional<String>> s = ReactiveStream.of(() -> cache.readFile(f))) {
			assertEquals(Optional.of("1"), s.next());
			// Starting the watcher re-runs computations that read unwatched.
			write(f, "2");
			init();
			assertEquals(Optional.of("2"), pull(s));
			assertEquals(1, cache.watchedPathCount());
			// From now on, reads are live.
			write(f, "3");
			source.update(f);
			assertEquals(Optional.of("3"), pull(s));
		}
	}
	@Test
	public void reinitialization() {
		init();
		Path f = root.resolve("f.txt");
		write(f, "1");
		Tracked<?> tracked = ReactiveScope.runTracked(() -> cache.readFile(f));
		assertEquals(1, cache.getCacheSize());
		// Replaced watcher might have missed events, so everything under its root is dropped.
		source.drop(root);
		await().until(() -> pool.status(root).generation(), equalTo(2L));
		await().until(tracked::stale);
		assertEquals(0, cache.getCacheSize());
		assertEquals(0, cache.watchedPathCount());
		// Next read subscribes with the new watcher.
		write(f, "2");
		assertEquals(Optional.of("2"), cache.readFile(f));
		assertEquals(1, cache.watchedPathCount());
		assertEquals(1, pool.activeSubscriptionCount());
		write(f, "3");
		source.update(f);
		await().until(() -> cache.readFile(f), equalTo(Optional.of("3")));
	}
	@Test
	public void close() {
		init();
		cache.readFile(root.resolve("f.txt"));
		assertEquals(1, pool.activeSubscriptionCount());
		cache.close();
		assertEquals(0, pool.activeSubscriptionCount());
		assertEquals(0, cache.getCacheSize());
	}
	@Test
	public void ioErrors() {
		init();
		// Failures other than absence propagate.
		Path locked = root.resolve("locked.txt");
		write(locked, "secret");
		Assumptions.assumeTrue(locked.toFile().setReadable(false));
		Assumptions.assumeFalse(Files.isReadable(locked), "Running with privileges that ignore permissions.");
		try {
			assertThrows(UncheckedIOException.class, () -> cache.readFile(locked));
		} finally {
			locked.toFile().setReadable(true);
		}
	}
}
