// Part of ReactiveFS
package com.machinezoo.reactivefs.watch;

import java.io.*;
import java.nio.file.*;
import java.util.*;

/**
 * Path normalization shared by watchers, subscriptions, and cache keys.
 * Equivalent spellings of the same location, including symlinked prefixes, map to the same path.
 */
public class RealPaths {
	/**
	 * Makes {@code path} absolute, normalizes it, and resolves symlinks in its longest existing prefix.
	 * Segments that don't exist yet are appended unchanged.
	 *
	 * @param path
	 *            path to resolve
	 * @return canonical form of {@code path}
	 */
	public static Path resolve(Path path) {
		Objects.requireNonNull(path);
		Path absolute = path.toAbsolutePath().normalize();
		Deque<Path> missing = new ArrayDeque<>();
		Path existing = absolute;
		while (existing != null) {
			try {
				Path real = existing.toRealPath();
				for (Path segment : missing)
					real = real.resolve(segment);
				return real;
			} catch (IOException ex) {
				if (existing.getFileName() == null)
					break;
				missing.addFirst(existing.getFileName());
				existing = existing.getParent();
			}
		}
		return absolute;
	}
}
