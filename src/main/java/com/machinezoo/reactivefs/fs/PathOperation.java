// Part of ReactiveFS
package com.machinezoo.reactivefs.fs;

/**
 * Kind of file system query cached by {@link PathCache}. Every path has at most one cell per operation.
 */
public enum PathOperation {
	READ,
	STAT,
	LIST,
	EXISTS
}
