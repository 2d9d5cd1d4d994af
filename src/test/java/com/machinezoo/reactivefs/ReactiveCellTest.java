// Part of ReactiveFS
package com.machinezoo.reactivefs;

import static org.junit.jupiter.api.Assertions.*;
import java.util.*;
import java.util.concurrent.atomic.*;
import org.junit.jupiter.api.*;
import com.machinezoo.closeablescope.*;

public class ReactiveCellTest {
	@Test
	public void lazy() {
		AtomicInteger n = new AtomicInteger();
		ReactiveCell<String> c = new ReactiveCell<>(() -> "value " + n.incrementAndGet());
		// Nothing is computed until the first read.
		assertEquals(0, n.get());
		assertFalse(c.cached());
		assertEquals("value 1", c.read());
		assertTrue(c.cached());
		// Second read is served from cache.
		assertEquals("value 1", c.read());
		assertEquals(1, n.get());
	}
	@Test
	public void versions() {
		ReactiveCell<String> c = new ReactiveCell<>(() -> "hello");
		// Versions start at 0 and they are incremented by every change.
		assertEquals(0, c.version());
		c.read();
		assertEquals(0, c.version());
		c.invalidate();
		assertEquals(1, c.version());
		c.set("hi");
		assertEquals(2, c.version());
		// Setting the same value still counts as a change.
		c.set("hi");
		assertEquals(3, c.version());
	}
	@Test
	public void invalidate() {
		AtomicInteger n = new AtomicInteger();
		ReactiveCell<Integer> c = new ReactiveCell<>(n::incrementAndGet);
		assertEquals(1, (int)c.read());
		// Invalidation doesn't recompute eagerly.
		c.invalidate();
		assertEquals(1, n.get());
		assertFalse(c.cached());
		// Next read does.
		assertEquals(2, (int)c.read());
	}
	@Test
	public void set() {
		AtomicInteger n = new AtomicInteger();
		ReactiveCell<Integer> c = new ReactiveCell<>(n::incrementAndGet);
		// Explicit value bypasses the compute function.
		c.set(10);
		assertEquals(10, (int)c.read());
		assertEquals(0, n.get());
		// Cells without compute function hold whatever was set.
		ReactiveCell<String> s = ReactiveCell.of("hello");
		assertEquals("hello", s.read());
		s.set(null);
		assertNull(s.read());
		assertTrue(s.cached());
	}
	@Test
	public void failures() {
		AtomicInteger n = new AtomicInteger();
		ReactiveCell<Integer> c = new ReactiveCell<>(() -> {
			if (n.incrementAndGet() == 1)
				throw new IllegalStateException();
			return n.get();
		});
		// Exceptions propagate and nothing is cached.
		assertThrows(IllegalStateException.class, c::read);
		assertFalse(c.cached());
		// Next read tries again.
		assertEquals(2, (int)c.read());
	}
	@Test
	public void invalidatedWhileComputing() {
		AtomicInteger n = new AtomicInteger();
		AtomicReference<ReactiveCell<Integer>> self = new AtomicReference<>();
		self.set(new ReactiveCell<>(() -> {
			// Simulate concurrent change while the first computation runs.
			if (n.incrementAndGet() == 1)
				self.get().invalidate();
			return n.get();
		}));
		ReactiveCell<Integer> c = self.get();
		// The reader still gets its result, but it is not cached, because it might be outdated.
		assertEquals(1, (int)c.read());
		assertFalse(c.cached());
		assertEquals(2, (int)c.read());
		assertTrue(c.cached());
	}
	@Test
	public void fireOnChange() {
		ReactiveCell<String> c = ReactiveCell.of("hello");
		AtomicInteger n = new AtomicInteger();
		try (ReactiveTrigger t = new ReactiveTrigger()) {
			t.callback(n::incrementAndGet);
			t.arm(Arrays.asList(new Dependency(c)));
			assertEquals(0, n.get());
			// First change fires the trigger.
			c.invalidate();
			assertEquals(1, n.get());
			// Triggers are one-shot.
			c.set("hi");
			assertEquals(1, n.get());
		}
	}
	@Test
	public void trackAccess() {
		ReactiveCell<String> c = ReactiveCell.of("hello");
		ReactiveScope s = new ReactiveScope();
		try (CloseableScope active = s.enter()) {
			assertEquals("hello", c.read());
		}
		// Read has been recorded together with the observed version.
		assertEquals(Arrays.asList(new Dependency(c, 0)), s.dependencies());
		// Reads outside of the scope are not recorded.
		c.read();
		assertEquals(1, s.dependencies().size());
	}
	@Test
	public void identity() {
		ReactiveCell<String> a = ReactiveCell.of("same");
		ReactiveCell<String> b = ReactiveCell.of("same");
		// Cells are compared by identity, never by value.
		assertNotEquals(a, b);
		assertEquals(a, a);
	}
}
