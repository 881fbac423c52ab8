package io.github.bluuewhale.lockcollections;

import java.util.Random;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentSkipListSet;
import java.util.function.Supplier;
import java.util.stream.Stream;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import org.openjdk.jol.info.GraphLayout;

public class SetFootprintTest {

	private static final int MAX_ENTRIES = 2_000;
	private static final int STEP = 500;

	private record SetSpec(String name, Supplier<Set<Integer>> supplier) {
		Set<Integer> newSet() {
			return supplier.get();
		}

		@Override
		public String toString() {
			return name;
		}
	}

	private static Stream<SetSpec> sets() {
		return Stream.of(
			new SetSpec("TreeSet", TreeSet::new),
			new SetSpec("ConcurrentSkipListSet", ConcurrentSkipListSet::new),
			new SetSpec("CoarseListSet", CoarseListSet::new),
			new SetSpec("FineGrainedListSet", FineGrainedListSet::new));
	}

	// List sets insert in O(n), so sizes stay small.
	@ParameterizedTest(name = "{0} footprint growth")
	@MethodSource("sets")
	void printFootprint(SetSpec setSpec) {
		Set<Integer> set = setSpec.newSet();
		Random rnd = new Random(42L);
		for (int i = 1; i <= MAX_ENTRIES; i++) {
			set.add(rnd.nextInt());

			if (i % STEP == 0) {
				long size = GraphLayout.parseInstance(set).totalSize();
				System.out.printf("set=%-22s n=%-6d size=%-,10dB%n", setSpec.name(), i, size);
			}
		}
	}
}
