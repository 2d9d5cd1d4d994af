// Part of ReactiveFS
package com.machinezoo.reactivefs.fs;

import java.util.*;

/**
 * Filter applied to directory listings by {@link PathCache#readDir(java.nio.file.Path, ListingOptions)}.
 * Options are immutable. Every distinct combination of options is cached separately.
 * Default options hide entries whose name starts with a dot and keep everything else.
 */
public class ListingOptions {
	/**
	 * Options that keep every entry, hidden ones included.
	 */
	public static final ListingOptions ALL = new ListingOptions().includeHidden(true);
	private final boolean includeHidden;
	private final boolean directoriesOnly;
	private final boolean filesOnly;
	private final Set<String> exclude;
	public ListingOptions() {
		this(false, false, false, Collections.emptySet());
	}
	private ListingOptions(boolean includeHidden, boolean directoriesOnly, boolean filesOnly, Set<String> exclude) {
		this.includeHidden = includeHidden;
		this.directoriesOnly = directoriesOnly;
		this.filesOnly = filesOnly;
		this.exclude = exclude;
	}
	public boolean includeHidden() {
		return includeHidden;
	}
	public ListingOptions includeHidden(boolean includeHidden) {
		return new ListingOptions(includeHidden, directoriesOnly, filesOnly, exclude);
	}
	public boolean directoriesOnly() {
		return directoriesOnly;
	}
	public ListingOptions directoriesOnly(boolean directoriesOnly) {
		return new ListingOptions(includeHidden, directoriesOnly, filesOnly, exclude);
	}
	public boolean filesOnly() {
		return filesOnly;
	}
	public ListingOptions filesOnly(boolean filesOnly) {
		return new ListingOptions(includeHidden, directoriesOnly, filesOnly, exclude);
	}
	public Set<String> exclude() {
		return exclude;
	}
	/**
	 * Replaces the set of entry names that are always left out of the listing.
	 *
	 * @param names
	 *            exact entry names to exclude
	 * @return new options with the given exclusions
	 */
	public ListingOptions exclude(Collection<String> names) {
		Objects.requireNonNull(names);
		return new ListingOptions(includeHidden, directoriesOnly, filesOnly, Collections.unmodifiableSet(new TreeSet<>(names)));
	}
	public ListingOptions exclude(String... names) {
		return exclude(Arrays.asList(names));
	}
	public boolean accepts(DirectoryEntry entry) {
		if (!includeHidden && entry.name().startsWith("."))
			return false;
		if (exclude.contains(entry.name()))
			return false;
		if (directoriesOnly && !entry.directory())
			return false;
		if (filesOnly && !entry.file())
			return false;
		return true;
	}
	List<DirectoryEntry> apply(List<DirectoryEntry> entries) {
		List<DirectoryEntry> accepted = new ArrayList<>();
		for (DirectoryEntry entry : entries)
			if (accepts(entry))
				accepted.add(entry);
		return Collections.unmodifiableList(accepted);
	}
	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof ListingOptions))
			return false;
		ListingOptions other = (ListingOptions)obj;
		return includeHidden == other.includeHidden
			&& directoriesOnly == other.directoriesOnly
			&& filesOnly == other.filesOnly
			&& exclude.equals(other.exclude);
	}
	@Override
	public int hashCode() {
		return Objects.hash(includeHidden, directoriesOnly, filesOnly, exclude);
	}
	@Override
	public String toString() {
		StringBuilder description = new StringBuilder();
		if (includeHidden)
			description.append("hidden,");
		if (directoriesOnly)
			description.append("directories,");
		if (filesOnly)
			description.append("files,");
		if (!exclude.isEmpty())
			description.append("exclude=").append(exclude).append(",");
		if (description.length() == 0)
			return "visible";
		description.setLength(description.length() - 1);
		return description.toString();
	}
}
