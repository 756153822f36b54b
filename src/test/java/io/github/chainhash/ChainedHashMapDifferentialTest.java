package io.github.chainhash;

import static org.junit.jupiter.api.Assertions.*;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Random;
import java.util.stream.LongStream;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

/**
 * Drives a {@link ChainedHashMap} and a {@link HashMap} with the same seeded operation stream
 * and checks that they never disagree.
 */
class ChainedHashMapDifferentialTest {

	private static final int OPS = 50_000;

	private static LongStream seeds() {
		return LongStream.of(1L, 17L, 1234L, 0xC0FFEEL);
	}

	/* Narrow key range so puts, overwrites and removes all hit often. */
	private static Integer nextKey(Random rnd) {
		int r = rnd.nextInt(100);
		if (r < 5) return null;
		if (r < 25) return rnd.nextInt(1 << 20) << 12; // vary only the high bits
		return rnd.nextInt(2_000);
	}

	@ParameterizedTest(name = "seed={0}")
	@MethodSource("seeds")
	void agreesWithHashMap(long seed) {
		var rnd = new Random(seed);
		var actual = new ChainedHashMap<Integer, Integer>(1 + rnd.nextInt(64), 0.25d + rnd.nextDouble() * 0.75d);
		var expected = new HashMap<Integer, Integer>();

		for (int op = 0; op < OPS; op++) {
			Integer k = nextKey(rnd);
			int v = rnd.nextInt();
			switch (rnd.nextInt(8)) {
				case 0, 1 -> assertEquals(expected.put(k, v), actual.put(k, v));
				case 2 -> {
					expected.put(k, v);
					actual.update(k, v);
				}
				case 3 -> assertEquals(expected.remove(k), actual.remove(k));
				case 4 -> assertEquals(expected.get(k), actual.get(k));
				case 5 -> assertEquals(expected.containsKey(k), actual.containsKey(k));
				case 6 -> {
					Integer want = expected.containsKey(k) ? expected.get(k) : v;
					expected.putIfAbsent(k, v);
					assertEquals(want, actual.getOrElseUpdate(k, () -> v));
				}
				default -> {
					if (rnd.nextInt(500) == 0) actual.sizeHint(actual.size() * 4);
				}
			}
			assertEquals(expected.size(), actual.size());
		}

		Chains.assertWellFormed(actual);
		assertEquals(expected, actual);
		assertIterationComplete(actual);
	}

	@ParameterizedTest(name = "seed={0}")
	@MethodSource("seeds")
	void removingEverythingEmptiesTheMap(long seed) {
		var rnd = new Random(seed);
		var m = new ChainedHashMap<Integer, Integer>();
		var keys = new HashSet<Integer>();
		for (int i = 0; i < 5_000; i++) {
			int k = rnd.nextInt();
			keys.add(k);
			m.put(k, i);
		}
		assertEquals(keys.size(), m.size());

		for (Integer k : keys) {
			assertNotNull(m.remove(k));
			assertNull(m.remove(k));
		}
		assertTrue(m.isEmpty());
		assertFalse(m.keySet().iterator().hasNext());
		Chains.assertWellFormed(m);
	}

	private static void assertIterationComplete(ChainedHashMap<Integer, Integer> m) {
		var seen = new HashSet<Integer>();
		int count = 0;
		for (var e : m.entrySet()) {
			assertTrue(seen.add(e.getKey()), "key yielded twice: " + e.getKey());
			assertTrue(m.containsKey(e.getKey()));
			assertEquals(m.get(e.getKey()), e.getValue());
			count++;
		}
		assertEquals(m.size(), count);
	}
}
