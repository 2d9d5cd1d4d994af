// Part of ReactiveFS
package com.machinezoo.reactivefs.fs;

import java.nio.file.attribute.*;

public enum EntryKind {
	FILE,
	DIRECTORY,
	/*
	 * Sockets, devices, and other special files.
	 */
	OTHER;
	static EntryKind of(BasicFileAttributes attributes) {
		if (attributes.isDirectory())
			return DIRECTORY;
		if (attributes.isRegularFile())
			return FILE;
		return OTHER;
	}
}
