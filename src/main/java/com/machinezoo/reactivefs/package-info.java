// Part of ReactiveFS
/*
 * Conventions shared by all reactive objects:
 * - Null check is performed on method parameters where appropriate.
 * - If the object has no way to propagate exceptions (callbacks, timers, background reinitialization), it logs them.
 * - Metrics are exposed only by objects that generate events, i.e. cells, streams, watchers, and the cache.
 * - Opentracing spans are created only in ReactiveCell and ReactiveTrigger.
 * - Object's OwnerTrace has at least an alias. Identifying parameters of the object are added as tags.
 * - Method toString() is defined and it uses OwnerTrace.toString().
 */
/**
 * Reactive core: invalidatable cells, dependency tracking, and streams of tracked computations.
 *
 * @see com.machinezoo.reactivefs.fs.PathCache
 */
package com.machinezoo.reactivefs;
