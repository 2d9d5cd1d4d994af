// Part of ReactiveFS
package com.machinezoo.reactivefs;

import java.util.*;

/**
 * Output of one tracked execution together with the dependency set collected while it ran.
 *
 * @param <T>
 *            type of the computation result
 *
 * @see ReactiveScope#runTracked(java.util.function.Supplier)
 */
public class Tracked<T> {
	private final ReactiveValue<T> value;
	public ReactiveValue<T> value() {
		return value;
	}
	private final List<Dependency> dependencies;
	public List<Dependency> dependencies() {
		return dependencies;
	}
	public Tracked(ReactiveValue<T> value, Collection<Dependency> dependencies) {
		Objects.requireNonNull(value);
		Objects.requireNonNull(dependencies);
		this.value = value;
		this.dependencies = Collections.unmodifiableList(new ArrayList<>(dependencies));
	}
	/*
	 * Unpacks the value, throwing CompletionException if the computation failed.
	 */
	public T get() {
		return value.get();
	}
	public boolean stale() {
		for (Dependency dependency : dependencies)
			if (dependency.stale())
				return true;
		return false;
	}
	@Override
	public String toString() {
		return value + " with " + dependencies.size() + " dependencies";
	}
}
