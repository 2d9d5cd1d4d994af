// Part of ReactiveFS
package com.machinezoo.reactivefs.watch;

import java.io.*;
import java.nio.file.*;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.*;

/*
 * Deterministic replacement for native notifications. Tests push events, overflows, and errors by hand.
 */
public class FakeFileEventSource implements FileEventSource {
	private final Map<Path, FileEventListener> listeners = new ConcurrentHashMap<>();
	private final AtomicInteger subscriptions = new AtomicInteger();
	private final AtomicInteger closed = new AtomicInteger();
	private volatile IOException failure;
	@Override
	public Closeable subscribe(Path root, FileEventListener listener) throws IOException {
		IOException failure = this.failure;
		if (failure != null)
			throw failure;
		if (!Files.isDirectory(root))
			throw new NoSuchFileException(root.toString());
		subscriptions.incrementAndGet();
		listeners.put(root, listener);
		return () -> {
			if (listeners.remove(root, listener))
				closed.incrementAndGet();
		};
	}
	public void failWith(IOException failure) {
		this.failure = failure;
	}
	public int subscriptions() {
		return subscriptions.get();
	}
	public int closed() {
		return closed.get();
	}
	public boolean active(Path root) {
		return listeners.containsKey(root);
	}
	private FileEventListener listener(Path path) {
		for (Map.Entry<Path, FileEventListener> entry : listeners.entrySet())
			if (path.startsWith(entry.getKey()))
				return entry.getValue();
		throw new IllegalStateException("Nobody watches " + path);
	}
	public void emit(WatchEventKind kind, Path path) {
		listener(path).onEvents(Collections.singletonList(new WatchEvent(kind, path)));
	}
	public void create(Path path) {
		emit(WatchEventKind.CREATE, path);
	}
	public void update(Path path) {
		emit(WatchEventKind.UPDATE, path);
	}
	public void delete(Path path) {
		emit(WatchEventKind.DELETE, path);
	}
	public void drop(Path root) {
		listener(root).onDropped();
	}
	public void error(Path root, Throwable exception) {
		listener(root).onError(exception);
	}
}
