// Part of ReactiveFS
package com.machinezoo.reactivefs.fs;

import java.nio.file.attribute.*;
import java.time.*;
import java.util.*;

/**
 * File metadata as returned by {@link PathCache#stat(java.nio.file.Path)}.
 */
public class FileStat {
	private final EntryKind kind;
	public EntryKind kind() {
		return kind;
	}
	private final long size;
	public long size() {
		return size;
	}
	private final Instant modified;
	public Instant modified() {
		return modified;
	}
	/*
	 * Falls back to modification time on file systems that don't record creation time.
	 */
	private final Instant created;
	public Instant created() {
		return created;
	}
	public FileStat(EntryKind kind, long size, Instant modified, Instant created) {
		Objects.requireNonNull(kind);
		Objects.requireNonNull(modified);
		Objects.requireNonNull(created);
		this.kind = kind;
		this.size = size;
		this.modified = modified;
		this.created = created;
	}
	static FileStat of(BasicFileAttributes attributes) {
		return new FileStat(EntryKind.of(attributes), attributes.size(), attributes.lastModifiedTime().toInstant(), attributes.creationTime().toInstant());
	}
	public boolean directory() {
		return kind == EntryKind.DIRECTORY;
	}
	public boolean file() {
		return kind == EntryKind.FILE;
	}
	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof FileStat))
			return false;
		FileStat other = (FileStat)obj;
		return kind == other.kind && size == other.size && modified.equals(other.modified) && created.equals(other.created);
	}
	@Override
	public int hashCode() {
		return Objects.hash(kind, size, modified, created);
	}
	@Override
	public String toString() {
		return kind.name().toLowerCase() + ", " + size + " bytes, modified " + modified;
	}
}
