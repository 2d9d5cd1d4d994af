// Part of ReactiveFS
package com.machinezoo.reactivefs.watch;

import java.io.*;
import java.nio.file.*;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.*;
import org.slf4j.*;
import com.machinezoo.reactivefs.*;
import com.machinezoo.stagean.*;
import io.methvin.watcher.*;

/*
 * Recursive watching is delegated to directory-watcher, which uses the JDK WatchService on Linux and Windows
 * and FSEvents on macOS. It registers the whole tree synchronously in watchAsync(),
 * so events that happen after subscribe() returns are reported.
 */
/**
 * {@link FileEventSource} backed by native OS notifications.
 */
@StubDocs
@NoTests
public class NativeFileEventSource implements FileEventSource {
	private final Executor executor;
	public NativeFileEventSource(Executor executor) {
		Objects.requireNonNull(executor);
		this.executor = executor;
	}
	public NativeFileEventSource() {
		this(ReactiveExecutor.common());
	}
	private static final Logger logger = LoggerFactory.getLogger(NativeFileEventSource.class);
	@Override
	public Closeable subscribe(Path root, FileEventListener listener) throws IOException {
		Objects.requireNonNull(root);
		Objects.requireNonNull(listener);
		if (!Files.isDirectory(root))
			throw new NoSuchFileException(root.toString(), null, "Watched root is not a directory.");
		/*
		 * Closing the watcher makes its event loop fail. That's not an error worth reporting.
		 */
		AtomicBoolean closed = new AtomicBoolean();
		DirectoryWatcher watcher = DirectoryWatcher.builder()
			.path(root)
			.fileHashing(false)
			.listener(new DirectoryChangeListener() {
				@Override
				public void onEvent(DirectoryChangeEvent event) {
					if (closed.get())
						return;
					switch (event.eventType()) {
					case CREATE:
						listener.onEvents(Collections.singletonList(new WatchEvent(WatchEventKind.CREATE, event.path())));
						break;
					case MODIFY:
						listener.onEvents(Collections.singletonList(new WatchEvent(WatchEventKind.UPDATE, event.path())));
						break;
					case DELETE:
						listener.onEvents(Collections.singletonList(new WatchEvent(WatchEventKind.DELETE, event.path())));
						break;
					case OVERFLOW:
						listener.onDropped();
						break;
					default:
						logger.debug("Ignoring {} event for {}.", event.eventType(), event.path());
					}
				}
				@Override
				public void onException(Exception exception) {
					if (!closed.get())
						listener.onError(exception);
				}
			})
			.build();
		watcher.watchAsync(executor).whenComplete((result, exception) -> {
			if (exception != null && !closed.get())
				listener.onError(exception);
		});
		return () -> {
			if (closed.compareAndSet(false, true))
				watcher.close();
		};
	}
}
