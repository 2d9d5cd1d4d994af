// Part of ReactiveFS
package com.machinezoo.reactivefs.watch;

import java.util.*;

/**
 * Receiver of raw notifications from {@link FileEventSource}.
 * Methods may be called from any thread, but the source calls them sequentially.
 */
public interface FileEventListener {
	void onEvents(List<WatchEvent> events);
	/*
	 * Notification queue overflowed. Some events are missing and their coverage cannot be recovered.
	 */
	void onDropped();
	void onError(Throwable exception);
}
