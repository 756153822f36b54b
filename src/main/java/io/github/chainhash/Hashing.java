package io.github.chainhash;

import java.util.Objects;

/**
 * Static helpers for hash spreading and power-of-two table sizing.
 */
final class Hashing {

	private Hashing() {}

	/*
	 * Upper bound to keep table size as a power of two.
	 */
	static final int MAX_TABLE_SIZE = 1 << 30;

	/* Smallest bucket array ever allocated. */
	static final int MIN_TABLE_SIZE = 4;

	/*
	 * Xor the high 16 bits into the low 16 bits: only the low bits pick a bucket,
	 * so entropy skewed towards the high bits would otherwise be lost.
	 */
	static int spread(int h) {
		return h ^ (h >>> 16);
	}

	static int spreadHash(Object o) {
		return spread(Objects.hashCode(o));
	}

	/**
	 * Smallest power of two {@code >= capacity}, at least {@link #MIN_TABLE_SIZE}
	 * and at most {@link #MAX_TABLE_SIZE}.
	 */
	static int tableSizeFor(int capacity) {
		if (capacity <= MIN_TABLE_SIZE) return MIN_TABLE_SIZE;
		if (capacity >= MAX_TABLE_SIZE) return MAX_TABLE_SIZE;
		return Integer.highestOneBit(capacity - 1) << 1;
	}

	static int threshold(int tableSize, double loadFactor) {
		return (int) (tableSize * loadFactor);
	}

	/*
	 * Smallest table whose threshold stays above expectedEntries, so that many inserts never grow it.
	 * Double arithmetic so that Integer.MAX_VALUE hints saturate instead of wrapping; the loop
	 * re-checks with the exact threshold the map uses, rounding included.
	 */
	static int tableSizeForEntries(int expectedEntries, double loadFactor) {
		int tableSize = tableSizeFor((int) Math.ceil((expectedEntries + 1.0d) / loadFactor));
		while (tableSize < MAX_TABLE_SIZE && threshold(tableSize, loadFactor) <= expectedEntries) {
			tableSize <<= 1;
		}
		return tableSize;
	}
}
