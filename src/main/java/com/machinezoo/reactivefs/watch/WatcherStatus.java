// Part of ReactiveFS
package com.machinezoo.reactivefs.watch;

import java.nio.file.*;
import java.util.*;

/**
 * Snapshot of the runtime state of one root in {@link WatcherPool}.
 */
public class WatcherStatus {
	private final Path root;
	public Path root() {
		return root;
	}
	private final boolean initialized;
	public boolean initialized() {
		return initialized;
	}
	private final int subscriptionCount;
	public int subscriptionCount() {
		return subscriptionCount;
	}
	/*
	 * Zero until the first watcher starts. Incremented every time a new watcher starts.
	 */
	private final long generation;
	public long generation() {
		return generation;
	}
	private final int reinitializeCount;
	public int reinitializeCount() {
		return reinitializeCount;
	}
	private final ReinitializeReason lastReason;
	public Optional<ReinitializeReason> lastReason() {
		return Optional.ofNullable(lastReason);
	}
	private final Map<ReinitializeReason, Integer> reasonCounts;
	public Map<ReinitializeReason, Integer> reasonCounts() {
		return reasonCounts;
	}
	public int reasonCount(ReinitializeReason reason) {
		return reasonCounts.getOrDefault(reason, 0);
	}
	private final Throwable failure;
	/*
	 * Last initialization failure. Cleared when a watcher starts successfully.
	 */
	public Optional<Throwable> failure() {
		return Optional.ofNullable(failure);
	}
	WatcherStatus(Path root, boolean initialized, int subscriptionCount, long generation, int reinitializeCount, ReinitializeReason lastReason, Map<ReinitializeReason, Integer> reasonCounts, Throwable failure) {
		this.root = root;
		this.initialized = initialized;
		this.subscriptionCount = subscriptionCount;
		this.generation = generation;
		this.reinitializeCount = reinitializeCount;
		this.lastReason = lastReason;
		this.reasonCounts = Collections.unmodifiableMap(new EnumMap<>(reasonCounts));
		this.failure = failure;
	}
	@Override
	public String toString() {
		StringBuilder text = new StringBuilder();
		text.append(root).append(initialized ? " (initialized)" : " (not initialized)");
		text.append(", generation ").append(generation);
		text.append(", ").append(subscriptionCount).append(" subscriptions");
		if (reinitializeCount > 0)
			text.append(", reinitialized ").append(reinitializeCount).append("x, last ").append(lastReason.label());
		if (failure != null)
			text.append(", failed: ").append(failure.getMessage());
		return text.toString();
	}
}
