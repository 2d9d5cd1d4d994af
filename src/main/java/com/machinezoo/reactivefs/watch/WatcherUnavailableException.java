// Part of ReactiveFS
package com.machinezoo.reactivefs.watch;

import java.nio.file.*;

/**
 * Thrown by {@link WatcherPool#acquireWatcher(Path)} when no initialized watcher covers the path.
 * Callers are expected to fall back to unwatched reads.
 */
@SuppressWarnings("serial")
public class WatcherUnavailableException extends IllegalStateException {
	private final Path path;
	public Path path() {
		return path;
	}
	public WatcherUnavailableException(Path path) {
		super("No initialized watcher covers " + path + ".");
		this.path = path;
	}
}
