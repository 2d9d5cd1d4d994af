// Part of ReactiveFS
package com.machinezoo.reactivefs.watch;

import java.nio.file.*;
import java.util.*;
import java.util.function.*;
import com.machinezoo.stagean.*;

/*
 * Three pattern forms are supported:
 * - bare name (".git", "node_modules") matches the name anywhere in the path, which excludes the whole subtree
 * - "**" + "/name" matches files with that name at any depth
 * - anything else is a glob evaluated against the path relative to the watched root
 */
/**
 * Compiled ignore globs of {@link ProjectWatcher}.
 */
@StubDocs
public class IgnoreRules {
	private final Path root;
	private final List<String> patterns;
	private final List<Predicate<Path>> rules = new ArrayList<>();
	public IgnoreRules(Path root, Collection<String> patterns) {
		Objects.requireNonNull(root);
		Objects.requireNonNull(patterns);
		this.root = root;
		this.patterns = Collections.unmodifiableList(new ArrayList<>(patterns));
		FileSystem fs = root.getFileSystem();
		for (String pattern : this.patterns) {
			if (pattern.isEmpty())
				throw new IllegalArgumentException("Empty ignore pattern.");
			if (!pattern.contains("/") && !pattern.contains("*") && !pattern.contains("?") && !pattern.contains("[")) {
				rules.add(relative -> {
					for (Path component : relative)
						if (component.toString().equals(pattern))
							return true;
					return false;
				});
			} else if (pattern.startsWith("**/") && pattern.indexOf('/', 3) < 0) {
				PathMatcher name = fs.getPathMatcher("glob:" + pattern.substring(3));
				rules.add(relative -> relative.getFileName() != null && name.matches(relative.getFileName()));
			} else {
				PathMatcher glob = fs.getPathMatcher("glob:" + pattern);
				rules.add(glob::matches);
			}
		}
	}
	public List<String> patterns() {
		return patterns;
	}
	/**
	 * Returns {@code true} if events for {@code path} should be dropped.
	 * Paths outside of the root are never ignored here.
	 *
	 * @param path
	 *            absolute path of the event
	 * @return {@code true} if {@code path} matches some pattern
	 */
	public boolean ignored(Path path) {
		if (!path.startsWith(root) || path.equals(root))
			return false;
		Path relative = root.relativize(path);
		for (Predicate<Path> rule : rules)
			if (rule.test(relative))
				return true;
		return false;
	}
	@Override
	public String toString() {
		return patterns.toString();
	}
}
