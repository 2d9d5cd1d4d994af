// Part of ReactiveFS
package com.machinezoo.reactivefs.util;

import static java.util.stream.Collectors.*;
import java.util.*;
import com.google.common.cache.*;
import com.machinezoo.stagean.*;
import io.opentracing.*;
import it.unimi.dsi.fastutil.objects.*;

/*
 * Reactive objects invert call stacks. When a file event invalidates a cell, which wakes up a stream,
 * the stack trace of the wakeup says nothing about which path or which stream was involved.
 * Owner trace attaches an alias, identifying tags, and an owner to any object,
 * so that toString() and tracing spans can describe the whole ownership chain, e.g. "pathcache.cell[path=...]".
 *
 * Trace data lives in a weak identity map, so that traced objects don't need a dedicated field
 * and collection of the traced object drops its trace data.
 */
/**
 * Trace of object owners and identifying tags for diagnostics and tracing.
 */
@NoTests
@StubDocs
public class OwnerTrace<T> {
	/*
	 * Guava's weakKeys() switches the cache to identity comparison, which is what we need here,
	 * because traced objects (paths, cells) may define equals() that would merge unrelated traces.
	 */
	private static final LoadingCache<Object, TraceData> all = CacheBuilder.newBuilder()
		.weakKeys()
		.build(CacheLoader.from(TraceData::new));
	public static <T> OwnerTrace<T> of(T target) {
		return new OwnerTrace<T>(target, all.getUnchecked(target));
	}
	private final T target;
	public T target() {
		return target;
	}
	private final TraceData data;
	private OwnerTrace(T target, TraceData data) {
		Objects.requireNonNull(target);
		this.target = target;
		this.data = data;
	}
	private static class TraceData {
		volatile String alias;
		/*
		 * Copy-on-write map. Tags are written a few times during construction and read on every toString().
		 */
		volatile Map<String, Object> tags = Collections.emptyMap();
		volatile TraceData parent;
		TraceData(Object target) {
			alias = target instanceof Class ? ((Class<?>)target).getSimpleName() : target.getClass().getSimpleName();
		}
	}
	public OwnerTrace<T> alias(String alias) {
		Objects.requireNonNull(alias);
		data.alias = alias;
		return this;
	}
	public OwnerTrace<T> tag(String key, Object value) {
		Objects.requireNonNull(key);
		/*
		 * Null values are ignored, so that callers don't have to check optional identifiers.
		 */
		if (value != null) {
			synchronized (data) {
				Map<String, Object> copy = new TreeMap<>(data.tags);
				copy.put(key, value);
				data.tags = Collections.unmodifiableMap(copy);
			}
		}
		return this;
	}
	public OwnerTrace<T> parent(Object parent) {
		if (parent == null)
			data.parent = null;
		else if (parent instanceof OwnerTrace)
			data.parent = ((OwnerTrace<?>)parent).data;
		else
			data.parent = OwnerTrace.of(parent).data;
		return this;
	}
	/*
	 * Ancestors are listed from the root owner down to this object.
	 * Repeated aliases get numbered, so that tags of a stream inside another stream don't collide.
	 */
	private List<Map.Entry<String, TraceData>> chain() {
		List<TraceData> ancestors = new ArrayList<>();
		for (TraceData ancestor = data; ancestor != null && ancestors.size() < 32; ancestor = ancestor.parent)
			ancestors.add(ancestor);
		Collections.reverse(ancestors);
		Object2IntMap<String> numbering = new Object2IntOpenHashMap<>();
		List<Map.Entry<String, TraceData>> chain = new ArrayList<>();
		for (TraceData ancestor : ancestors) {
			String alias = ancestor.alias;
			int number = numbering.getInt(alias);
			numbering.put(alias, number + 1);
			chain.add(new AbstractMap.SimpleImmutableEntry<>(number == 0 ? alias : alias + (number + 1), ancestor));
		}
		return chain;
	}
	public Span fill(Span span) {
		Objects.requireNonNull(span);
		List<Map.Entry<String, TraceData>> chain = chain();
		span.setTag("owner", chain.stream().map(Map.Entry::getKey).collect(joining(".")));
		for (Map.Entry<String, TraceData> link : chain) {
			for (Map.Entry<String, Object> tag : link.getValue().tags.entrySet()) {
				String key = link.getKey() + "." + tag.getKey();
				Object value = tag.getValue();
				if (value instanceof Number)
					span.setTag(key, (Number)value);
				else if (value instanceof Boolean)
					span.setTag(key, (boolean)value);
				else
					span.setTag(key, value.toString());
			}
		}
		return span;
	}
	@Override
	public String toString() {
		List<Map.Entry<String, TraceData>> chain = chain();
		Map<String, Object> sorted = new TreeMap<>();
		for (Map.Entry<String, TraceData> link : chain)
			for (Map.Entry<String, Object> tag : link.getValue().tags.entrySet())
				sorted.put(link.getKey() + "." + tag.getKey(), tag.getValue());
		return chain.stream().map(Map.Entry::getKey).collect(joining(".")) + (sorted.isEmpty() ? "" : sorted.toString());
	}
}
