// Part of ReactiveFS
/**
 * Recursive project watchers with debounced path subscriptions and automatic failure recovery.
 */
package com.machinezoo.reactivefs.watch;
