// Part of ReactiveFS
package com.machinezoo.reactivefs.watch;

/**
 * Kind of {@link WatchEvent}.
 */
public enum WatchEventKind {
	CREATE,
	UPDATE,
	DELETE
}
