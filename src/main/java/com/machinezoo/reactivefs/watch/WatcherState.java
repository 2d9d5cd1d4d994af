// Part of ReactiveFS
package com.machinezoo.reactivefs.watch;

/**
 * Lifecycle of {@link ProjectWatcher}. Closing returns the watcher to {@link #UNINITIALIZED}.
 */
public enum WatcherState {
	UNINITIALIZED,
	INITIALIZING,
	INITIALIZED
}
