package io.github.bluuewhale.lockcollections;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import java.util.stream.Stream;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

class ListSetConcurrencyTest {

	record SetSpec(String name, Supplier<Set<Integer>> supplier) {
		Set<Integer> newSet() {
			return supplier.get();
		}

		@Override public String toString() { return name; }
	}

	static Stream<SetSpec> setSpecs() {
		return Stream.of(
			new SetSpec("CoarseListSet", CoarseListSet::new),
			new SetSpec("FineGrainedListSet", FineGrainedListSet::new)
		);
	}

	/** Not comparable, and every instance collides. */
	record Collide(int v) {
		@Override public int hashCode() { return 0; }
	}

	record CollidingSpec(String name, Supplier<Set<Collide>> supplier) {
		@Override public String toString() { return name; }
	}

	static Stream<CollidingSpec> hashOrderedSpecs() {
		return Stream.of(
			new CollidingSpec("CoarseListSet.hashOrdered", CoarseListSet::hashOrdered),
			new CollidingSpec("FineGrainedListSet.hashOrdered", FineGrainedListSet::hashOrdered)
		);
	}

	@ParameterizedTest(name = "{0} disjointPartitionsAreNotLost")
	@MethodSource("setSpecs")
	void disjointPartitionsAreNotLost(SetSpec spec) {
		var s = spec.newSet();
		int threads = 4;
		int perThread = 1_000;

		ConcurrentRunner.run(threads, t -> {
			for (int i = t * perThread; i < (t + 1) * perThread; i++) {
				assertTrue(s.add(i));
			}
		});

		assertEquals(threads * perThread, s.size());
		for (int i = 0; i < threads * perThread; i++) assertTrue(s.contains(i), "missing " + i);
	}

	@ParameterizedTest(name = "{0} interleavedPartitionsAreNotLost")
	@MethodSource("setSpecs")
	void interleavedPartitionsAreNotLost(SetSpec spec) {
		var s = spec.newSet();
		int threads = 8;
		int total = 4_000;

		// Neighbouring keys belong to different threads, so inserts collide on the same list region.
		ConcurrentRunner.run(threads, t -> {
			for (int i = t; i < total; i += threads) assertTrue(s.add(i));
		});

		assertEquals(total, s.size());
		List<Integer> expected = new ArrayList<>(total);
		for (int i = 0; i < total; i++) expected.add(i);
		assertEquals(expected, new ArrayList<>(s));
	}

	@ParameterizedTest(name = "{0} identicalAddSucceedsExactlyOnce")
	@MethodSource("setSpecs")
	void identicalAddSucceedsExactlyOnce(SetSpec spec) {
		int threads = 8;
		for (int round = 0; round < 200; round++) {
			var s = spec.newSet();
			s.add(10);
			s.add(30);
			AtomicInteger winners = new AtomicInteger();

			ConcurrentRunner.run(threads, t -> {
				if (s.add(20)) winners.incrementAndGet();
			});

			assertEquals(1, winners.get(), "round " + round);
			assertEquals(List.of(10, 20, 30), new ArrayList<>(s));
		}
	}

	@ParameterizedTest(name = "{0} identicalCollidingAddSucceedsExactlyOnce")
	@MethodSource("hashOrderedSpecs")
	void identicalCollidingAddSucceedsExactlyOnce(CollidingSpec spec) {
		int threads = 8;
		for (int round = 0; round < 200; round++) {
			Set<Collide> s = spec.supplier().get();
			// One run of equal hash codes, scanned with equals.
			for (int i = 0; i < 4; i++) s.add(new Collide(i * 2));
			AtomicInteger winners = new AtomicInteger();

			ConcurrentRunner.run(threads, t -> {
				// Every thread races on the same new element and on one of its own.
				if (s.add(new Collide(101))) winners.incrementAndGet();
				assertTrue(s.add(new Collide(1_000 + t)));
			});

			assertEquals(1, winners.get(), "round " + round);
			assertEquals(4 + 1 + threads, s.size());
			assertEquals(4 + 1 + threads, new HashSet<>(s).size());
			assertTrue(s.contains(new Collide(101)));
			for (int t = 0; t < threads; t++) assertTrue(s.remove(new Collide(1_000 + t)));
			assertFalse(s.contains(new Collide(1_000)));
		}
	}

	@ParameterizedTest(name = "{0} insertContainsDeletePerThread")
	@MethodSource("setSpecs")
	void insertContainsDeletePerThread(SetSpec spec) {
		var s = spec.newSet();
		int threads = 8;
		int perThread = 4_000 / threads;

		ConcurrentRunner.run(threads, t -> {
			int lo = t * perThread;
			int hi = lo + perThread;
			for (int i = lo; i < hi; i++) assertTrue(s.add(i));
			for (int i = lo; i < hi; i++) assertTrue(s.contains(i));
			for (int i = lo; i < hi; i++) assertTrue(s.remove(i));
			for (int i = lo; i < hi; i++) assertFalse(s.contains(i));
		});

		assertTrue(s.isEmpty());
	}

	@ParameterizedTest(name = "{0} removeRacingContainsNeverLosesUntouchedKeys")
	@MethodSource("setSpecs")
	void removeRacingContainsNeverLosesUntouchedKeys(SetSpec spec) {
		var s = spec.newSet();
		int n = 2_000;
		for (int i = 0; i < n; i++) s.add(i);
		AtomicBoolean removing = new AtomicBoolean(true);

		ConcurrentRunner.run(4, t -> {
			if (t == 0) {
				try {
					for (int i = 0; i < n; i += 2) assertTrue(s.remove(i));
				} finally {
					removing.set(false);
				}
				return;
			}
			while (removing.get()) {
				int k = ThreadLocalRandom.current().nextInt(n);
				boolean present = s.contains(k);
				// Odd keys are never removed; even keys may be seen either way.
				if (k % 2 != 0) assertTrue(present, "odd key vanished: " + k);
			}
		});

		assertEquals(n / 2, s.size());
		for (int i = 0; i < n; i++) assertEquals(i % 2 != 0, s.contains(i));
	}

	@ParameterizedTest(name = "{0} randomMixKeepsListSortedAndCounted")
	@MethodSource("setSpecs")
	void randomMixKeepsListSortedAndCounted(SetSpec spec) {
		var s = spec.newSet();
		int keys = 256;

		ConcurrentRunner.run(8, t -> {
			ThreadLocalRandom rnd = ThreadLocalRandom.current();
			for (int op = 0; op < 20_000; op++) {
				int k = rnd.nextInt(keys);
				switch (rnd.nextInt(3)) {
					case 0 -> s.add(k);
					case 1 -> s.remove(k);
					default -> s.contains(k);
				}
			}
		});

		List<Integer> snapshot = new ArrayList<>(s);
		for (int i = 1; i < snapshot.size(); i++) {
			assertTrue(snapshot.get(i - 1) < snapshot.get(i), "list out of order at " + i);
		}
		assertEquals(snapshot.size(), s.size());
		for (int k = 0; k < keys; k++) assertEquals(snapshot.contains(k), s.contains(k));
	}

	@ParameterizedTest(name = "{0} clearRacingAddsLeavesConsistentList")
	@MethodSource("setSpecs")
	void clearRacingAddsLeavesConsistentList(SetSpec spec) {
		var s = spec.newSet();

		ConcurrentRunner.run(4, t -> {
			for (int round = 0; round < 200; round++) {
				if (t == 0) {
					s.clear();
				} else {
					for (int i = 0; i < 20; i++) s.add(t * 1_000 + i);
				}
			}
		});

		List<Integer> snapshot = new ArrayList<>(s);
		assertEquals(snapshot.size(), s.size());
		for (int i = 1; i < snapshot.size(); i++) assertTrue(snapshot.get(i - 1) < snapshot.get(i));
	}
}
