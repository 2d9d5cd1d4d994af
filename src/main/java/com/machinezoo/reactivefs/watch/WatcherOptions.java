// Part of ReactiveFS
package com.machinezoo.reactivefs.watch;

import java.time.*;
import java.util.*;
import java.util.concurrent.*;
import com.machinezoo.reactivefs.*;
import com.machinezoo.stagean.*;

/*
 * Options are read when a watcher is created. Changing them afterwards affects only watchers created later.
 */
/**
 * Configuration of {@link ProjectWatcher} and {@link WatcherPool}.
 */
@StubDocs
public class WatcherOptions {
	private Duration debounce = Duration.ofMillis(50);
	public synchronized Duration debounce() {
		return debounce;
	}
	public synchronized WatcherOptions debounce(Duration debounce) {
		Objects.requireNonNull(debounce);
		if (debounce.isNegative())
			throw new IllegalArgumentException("Debounce window must not be negative.");
		this.debounce = debounce;
		return this;
	}
	private List<String> ignore = Collections.unmodifiableList(Arrays.asList(".git", "node_modules", "**/.DS_Store"));
	public synchronized List<String> ignore() {
		return ignore;
	}
	public synchronized WatcherOptions ignore(Collection<String> ignore) {
		Objects.requireNonNull(ignore);
		this.ignore = Collections.unmodifiableList(new ArrayList<>(ignore));
		return this;
	}
	/*
	 * Delay before a failed watcher is replaced. Failures within this window are coalesced into one reinitialization.
	 */
	private Duration recovery = Duration.ofSeconds(3);
	public synchronized Duration recovery() {
		return recovery;
	}
	public synchronized WatcherOptions recovery(Duration recovery) {
		Objects.requireNonNull(recovery);
		if (recovery.isNegative())
			throw new IllegalArgumentException("Recovery delay must not be negative.");
		this.recovery = recovery;
		return this;
	}
	/*
	 * Period of the check that the watched root still exists and it is still the same directory.
	 * Zero disables the check.
	 */
	private Duration liveness = Duration.ofSeconds(3);
	public synchronized Duration liveness() {
		return liveness;
	}
	public synchronized WatcherOptions liveness(Duration liveness) {
		Objects.requireNonNull(liveness);
		if (liveness.isNegative())
			throw new IllegalArgumentException("Liveness period must not be negative.");
		this.liveness = liveness;
		return this;
	}
	private FileEventSource source;
	public synchronized FileEventSource source() {
		if (source == null)
			source = new NativeFileEventSource(executor());
		return source;
	}
	public synchronized WatcherOptions source(FileEventSource source) {
		Objects.requireNonNull(source);
		this.source = source;
		return this;
	}
	/*
	 * Runs watcher initialization, which may walk large directory trees.
	 */
	private Executor executor = ReactiveExecutor.common();
	public synchronized Executor executor() {
		return executor;
	}
	public synchronized WatcherOptions executor(Executor executor) {
		Objects.requireNonNull(executor);
		this.executor = executor;
		return this;
	}
	@Override
	public synchronized String toString() {
		return "debounce " + debounce.toMillis() + "ms, ignore " + ignore + ", recovery " + recovery.toMillis() + "ms, liveness " + liveness.toMillis() + "ms";
	}
}
