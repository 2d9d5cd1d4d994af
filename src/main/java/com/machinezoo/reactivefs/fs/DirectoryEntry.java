// Part of ReactiveFS
package com.machinezoo.reactivefs.fs;

import java.util.*;

/**
 * Immediate child of a directory as returned by {@link PathCache#readDir(java.nio.file.Path)}.
 */
public class DirectoryEntry implements Comparable<DirectoryEntry> {
	private final String name;
	public String name() {
		return name;
	}
	private final EntryKind kind;
	public EntryKind kind() {
		return kind;
	}
	public DirectoryEntry(String name, EntryKind kind) {
		Objects.requireNonNull(name);
		Objects.requireNonNull(kind);
		this.name = name;
		this.kind = kind;
	}
	public boolean directory() {
		return kind == EntryKind.DIRECTORY;
	}
	public boolean file() {
		return kind == EntryKind.FILE;
	}
	@Override
	public int compareTo(DirectoryEntry other) {
		return name.compareTo(other.name);
	}
	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof DirectoryEntry))
			return false;
		DirectoryEntry other = (DirectoryEntry)obj;
		return name.equals(other.name) && kind == other.kind;
	}
	@Override
	public int hashCode() {
		return Objects.hash(name, kind);
	}
	@Override
	public String toString() {
		return kind == EntryKind.DIRECTORY ? name + "/" : name;
	}
}
