// Part of ReactiveFS
package com.machinezoo.reactivefs.watch;

import java.nio.file.*;
import java.util.*;

/**
 * File system change notification: event kind and absolute path of the affected file or directory.
 * Paths delivered to subscriptions are normalized the same way as subscribed paths (see {@link RealPaths}).
 */
public class WatchEvent {
	private final WatchEventKind kind;
	public WatchEventKind kind() {
		return kind;
	}
	private final Path path;
	public Path path() {
		return path;
	}
	public WatchEvent(WatchEventKind kind, Path path) {
		Objects.requireNonNull(kind);
		Objects.requireNonNull(path);
		this.kind = kind;
		this.path = path;
	}
	/*
	 * Create and delete change the parent directory's listing. Updates don't.
	 */
	public boolean structural() {
		return kind != WatchEventKind.UPDATE;
	}
	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof WatchEvent))
			return false;
		WatchEvent other = (WatchEvent)obj;
		return kind == other.kind && path.equals(other.path);
	}
	@Override
	public int hashCode() {
		return Objects.hash(kind, path);
	}
	@Override
	public String toString() {
		return kind.name().toLowerCase() + " " + path;
	}
}
