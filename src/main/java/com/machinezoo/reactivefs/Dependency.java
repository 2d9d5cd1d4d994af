// Part of ReactiveFS
package com.machinezoo.reactivefs;

import java.util.*;

/**
 * Reference to particular version of {@link ReactiveCell}, i.e. one member of a dependency set.
 *
 * @see ReactiveScope#dependencies()
 * @see ReactiveTrigger#arm(Collection)
 */
public class Dependency {
	private final ReactiveCell<?> cell;
	public ReactiveCell<?> cell() {
		return cell;
	}
	private final long version;
	/**
	 * Returns the version of the {@link #cell()} observed when the dependency was recorded.
	 *
	 * @return observed version
	 */
	public long version() {
		return version;
	}
	/**
	 * Creates new {@link Dependency} on specified version of the cell.
	 *
	 * @param cell
	 *            {@link ReactiveCell} that is depended on
	 * @param version
	 *            non-negative observed version
	 * @throws NullPointerException
	 *             if {@code cell} is {@code null}
	 * @throws IllegalArgumentException
	 *             if {@code version} is negative
	 */
	public Dependency(ReactiveCell<?> cell, long version) {
		Objects.requireNonNull(cell);
		if (version < 0)
			throw new IllegalArgumentException();
		this.cell = cell;
		this.version = version;
	}
	/**
	 * Creates new {@link Dependency} on current version of the cell.
	 *
	 * @param cell
	 *            {@link ReactiveCell} that is depended on
	 */
	public Dependency(ReactiveCell<?> cell) {
		this(cell, cell.version());
	}
	/**
	 * Returns {@code true} if the cell has changed since this dependency was recorded.
	 *
	 * @return {@code true} if {@link ReactiveCell#version()} differs from {@link #version()}
	 */
	public boolean stale() {
		return cell.version() != version;
	}
	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof Dependency))
			return false;
		Dependency other = (Dependency)obj;
		return cell == other.cell && version == other.version;
	}
	@Override
	public int hashCode() {
		return Objects.hash(cell, version);
	}
	@Override
	public String toString() {
		return "Version " + version + " of " + cell;
	}
}
