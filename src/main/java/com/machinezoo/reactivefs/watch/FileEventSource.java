// Part of ReactiveFS
package com.machinezoo.reactivefs.watch;

import java.io.*;
import java.nio.file.*;

/**
 * OS-level primitive that reports changes in a directory tree.
 * Default implementation is {@link NativeFileEventSource}. Tests can plug in a fake source via {@link WatcherOptions#source(FileEventSource)}.
 */
public interface FileEventSource {
	/**
	 * Starts watching the directory tree under {@code root}.
	 * Events that happen after this method returns must be reported.
	 *
	 * @param root
	 *            absolute, symlink-resolved directory
	 * @param listener
	 *            receiver of events
	 * @return handle that stops watching when closed
	 * @throws IOException
	 *             if the tree cannot be watched, for example because it doesn't exist
	 */
	Closeable subscribe(Path root, FileEventListener listener) throws IOException;
}
