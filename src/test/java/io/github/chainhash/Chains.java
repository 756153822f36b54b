package io.github.chainhash;

import static org.junit.jupiter.api.Assertions.*;

import java.lang.reflect.Field;

/**
 * Reflection helpers to inspect the private bucket array of a {@link ChainedHashMap}.
 */
final class Chains {

	private Chains() {}

	static ChainedHashMap.Node<?, ?>[] tableOf(ChainedHashMap<?, ?> m) {
		try {
			Field f = ChainedHashMap.class.getDeclaredField("table");
			f.setAccessible(true);
			return (ChainedHashMap.Node<?, ?>[]) f.get(m);
		} catch (ReflectiveOperationException e) {
			throw new AssertionError("Failed to access table via reflection", e);
		}
	}

	static int chainLength(ChainedHashMap<?, ?> m, int bucket) {
		int len = 0;
		for (var n = tableOf(m)[bucket]; n != null; n = n.next) len++;
		return len;
	}

	/**
	 * Every chain sorted by ascending hash, every node in the bucket its hash selects,
	 * and the reachable node count equal to size().
	 */
	static void assertWellFormed(ChainedHashMap<?, ?> m) {
		var table = tableOf(m);
		int mask = table.length - 1;
		assertEquals(0, table.length & mask, "table length must be a power of two");
		int reachable = 0;
		for (int i = 0; i < table.length; i++) {
			ChainedHashMap.Node<?, ?> prev = null;
			for (var n = table[i]; n != null; n = n.next) {
				assertEquals(i, n.hash & mask, "node " + n + " sits in the wrong bucket");
				if (prev != null) {
					assertTrue(prev.hash <= n.hash, "bucket " + i + " not hash-sorted at " + n);
				}
				prev = n;
				reachable++;
			}
		}
		assertEquals(m.size(), reachable);
	}
}
