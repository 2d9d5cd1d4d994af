// Part of ReactiveFS
package com.machinezoo.reactivefs.watch;

/**
 * Why {@link WatcherPool} replaced the {@link ProjectWatcher} of a root directory.
 */
public enum ReinitializeReason {
	/*
	 * OS notification queue overflowed. Some changes were not reported.
	 */
	DROP_EVENTS("drop-events"),
	WATCHER_ERROR("watcher-error"),
	MISSING_PROJECT_DIRECTORY("missing-project-directory"),
	PROJECT_DIRECTORY_REPLACED("project-directory-replaced"),
	MANUAL("manual");
	private final String label;
	ReinitializeReason(String label) {
		this.label = label;
	}
	/*
	 * Stable name used in logs and metric tags.
	 */
	public String label() {
		return label;
	}
}
