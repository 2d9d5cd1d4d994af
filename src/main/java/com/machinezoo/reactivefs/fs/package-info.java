// Part of ReactiveFS
/**
 * Reactive cache of file system queries.
 */
package com.machinezoo.reactivefs.fs;
