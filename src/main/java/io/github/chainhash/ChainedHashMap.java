package io.github.chainhash;

import java.util.AbstractCollection;
import java.util.AbstractMap;
import java.util.AbstractSet;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;
import java.util.function.BiConsumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Separate-chaining hash map (null keys and null values allowed).
 *
 * <p>Every chain is kept sorted by ascending spread hash. Lookups stop as soon as the chain
 * passes the query hash, and growth splits each chain into a low and a high half using one
 * extra hash bit, so no hash is ever recomputed and no chain is ever re-sorted.
 *
 * <p>Not thread-safe. Mutating the map while one of its views is being iterated is
 * unsupported and is not detected; {@link Iterator#remove()} on the element just returned is
 * the only exception.
 */
public final class ChainedHashMap<K, V> extends AbstractMap<K, V> {

	/* Defaults */
	static final int DEFAULT_INITIAL_CAPACITY = 16;
	static final double DEFAULT_LOAD_FACTOR = 0.75d;

	/* Storage */
	private Node<K, V>[] table;
	private int threshold; // size at which the next insertion grows the table
	private int size;
	private final double loadFactor;

	public ChainedHashMap() {
		this(DEFAULT_INITIAL_CAPACITY, DEFAULT_LOAD_FACTOR);
	}

	public ChainedHashMap(int initialCapacity) {
		this(initialCapacity, DEFAULT_LOAD_FACTOR);
	}

	public ChainedHashMap(int initialCapacity, double loadFactor) {
		if (initialCapacity < 1) {
			throw new IllegalArgumentException("initialCapacity must be >= 1: " + initialCapacity);
		}
		validateLoadFactor(loadFactor);
		this.loadFactor = loadFactor;
		this.table = newTable(Hashing.tableSizeFor(initialCapacity));
		this.threshold = Hashing.threshold(table.length, loadFactor);
	}

	/**
	 * Builds a map holding every mapping of {@code source}, pre-sized so that the copy never
	 * grows while it is being filled.
	 */
	public static <K, V> ChainedHashMap<K, V> from(Map<? extends K, ? extends V> source) {
		int n = source.size();
		int capacity = (n > 0) ? Hashing.tableSizeForEntries(n, DEFAULT_LOAD_FACTOR) : DEFAULT_INITIAL_CAPACITY;
		ChainedHashMap<K, V> m = new ChainedHashMap<>(capacity, DEFAULT_LOAD_FACTOR);
		m.putAll(source);
		return m;
	}

	/* ------------ Map API ------------ */

	@Override
	public int size() {
		return size;
	}

	@Override
	public boolean isEmpty() {
		return size == 0;
	}

	@Override
	public boolean containsKey(Object key) {
		return findNode(key) != null;
	}

	@Override
	public V get(Object key) {
		Node<K, V> nd = findNode(key);
		return (nd == null) ? null : nd.value;
	}

	@Override
	public V getOrDefault(Object key, V defaultValue) {
		Node<K, V> nd = findNode(key);
		return (nd == null) ? defaultValue : nd.value;
	}

	/**
	 * Returns the value bound to {@code key}, or the result of {@code fallback} if there is none.
	 * The fallback is only evaluated on a miss.
	 */
	public V getOrElse(K key, Supplier<? extends V> fallback) {
		Node<K, V> nd = findNode(key);
		return (nd == null) ? fallback.get() : nd.value;
	}

	/**
	 * Returns the value bound to {@code key}.
	 *
	 * @throws NoSuchElementException if the key is absent
	 */
	public V apply(K key) {
		Node<K, V> nd = findNode(key);
		if (nd == null) throw new NoSuchElementException("key not found: " + key);
		return nd.value;
	}

	/**
	 * Returns the value bound to {@code key}, or {@code defaultValue.apply(key)} if the key is
	 * absent. The map is left untouched either way.
	 */
	public V apply(K key, Function<? super K, ? extends V> defaultValue) {
		Node<K, V> nd = findNode(key);
		return (nd == null) ? defaultValue.apply(key) : nd.value;
	}

	@Override
	public V put(K key, V value) {
		return put0(key, value, true);
	}

	/**
	 * Same as {@link #put} without reporting the previous value.
	 */
	public void update(K key, V value) {
		put0(key, value, false);
	}

	/**
	 * Returns the value bound to {@code key}; if there is none, evaluates {@code defaultValue}
	 * exactly once, stores the result and returns it. A key bound to {@code null} counts as
	 * present.
	 *
	 * <p>{@code defaultValue} may insert other keys (and thereby grow the table) but must not
	 * insert {@code key} itself or remove anything.
	 */
	public V getOrElseUpdate(K key, Supplier<? extends V> defaultValue) {
		int hash = Hashing.spreadHash(key);
		int idx = index(hash);
		Node<K, V> nd = findNode(key, hash, idx);
		if (nd != null) return nd.value;

		Node<K, V>[] table0 = table;
		V value = defaultValue.get();
		insertAbsent(key, value, hash, idx, table0);
		return value;
	}

	@Override
	public V computeIfAbsent(K key, Function<? super K, ? extends V> mappingFunction) {
		Objects.requireNonNull(mappingFunction);
		int hash = Hashing.spreadHash(key);
		int idx = index(hash);
		Node<K, V> nd = findNode(key, hash, idx);
		if (nd != null && nd.value != null) return nd.value;

		Node<K, V>[] table0 = table;
		V value = mappingFunction.apply(key);
		if (value == null) return null;
		if (nd != null) {
			nd.value = value;
		} else {
			insertAbsent(key, value, hash, idx, table0);
		}
		return value;
	}

	@Override
	public V remove(Object key) {
		Node<K, V> nd = remove0(key);
		return (nd == null) ? null : nd.value;
	}

	@Override
	public void putAll(Map<? extends K, ? extends V> m) {
		sizeHint(m.size());
		m.forEach((k, v) -> put0(k, v, false));
	}

	/**
	 * Inserts every pair of {@code entries}, overwriting existing keys. A {@link Collection}
	 * source pre-sizes the table from its size first.
	 */
	public void addAll(Iterable<? extends Map.Entry<? extends K, ? extends V>> entries) {
		if (entries instanceof Collection<?> c) sizeHint(c.size());
		for (Map.Entry<? extends K, ? extends V> e : entries) {
			put0(e.getKey(), e.getValue(), false);
		}
	}

	/**
	 * Grows the table so that {@code expectedSize} entries fit without an intermediate resize.
	 * Never shrinks; negative hints are ignored.
	 */
	public void sizeHint(int expectedSize) {
		int target = Hashing.tableSizeForEntries(expectedSize, loadFactor);
		if (target > table.length) growTable(target);
	}

	@Override
	public void clear() {
		Arrays.fill(table, null);
		size = 0;
	}

	@Override
	public void forEach(BiConsumer<? super K, ? super V> action) {
		Objects.requireNonNull(action);
		Node<K, V>[] tab = table;
		for (Node<K, V> head : tab) {
			for (Node<K, V> n = head; n != null; n = n.next) {
				action.accept(n.key, n.value);
			}
		}
	}

	@Override
	public Set<Map.Entry<K, V>> entrySet() {
		return new EntrySet();
	}

	@Override
	public Set<K> keySet() {
		return new KeySet();
	}

	@Override
	public Collection<V> values() {
		return new Values();
	}

	/* Introspection (tests, serializers) */
	int capacity() {
		return table.length;
	}

	int threshold() {
		return threshold;
	}

	double loadFactor() {
		return loadFactor;
	}

	/* ------------ Internals ------------ */

	private int index(int hash) {
		return hash & (table.length - 1);
	}

	private Node<K, V> findNode(Object key) {
		int hash = Hashing.spreadHash(key);
		return findNode(key, hash, index(hash));
	}

	private Node<K, V> findNode(Object key, int hash, int idx) {
		Node<K, V> head = table[idx];
		return (head == null) ? null : head.find(key, hash);
	}

	private V put0(K key, V value, boolean getOld) {
		growIfNeeded();
		int hash = Hashing.spreadHash(key);
		return put0(key, value, getOld, hash, index(hash));
	}

	private V put0(K key, V value, boolean getOld, int hash, int idx) {
		Node<K, V> head = table[idx];
		if (head == null) {
			table[idx] = new Node<>(key, hash, value, null);
		} else {
			Node<K, V> prev = null;
			Node<K, V> n = head;
			while (n != null && n.hash <= hash) {
				if (n.hash == hash && Objects.equals(key, n.key)) {
					V old = n.value;
					n.value = value;
					return getOld ? old : null;
				}
				prev = n;
				n = n.next;
			}
			if (prev == null) table[idx] = new Node<>(key, hash, value, head);
			else prev.next = new Node<>(key, hash, value, n);
		}
		size++;
		return null;
	}

	/*
	 * Insert a key known to be absent when table0 was current. The caller may have run user code
	 * since then, so idx is only trusted if the table has not been replaced meanwhile.
	 */
	private void insertAbsent(K key, V value, int hash, int idx, Node<K, V>[] table0) {
		growIfNeeded();
		int newIdx = (table0 == table) ? idx : index(hash);
		put0(key, value, false, hash, newIdx);
	}

	private Node<K, V> remove0(Object key) {
		int hash = Hashing.spreadHash(key);
		int idx = index(hash);
		Node<K, V> head = table[idx];
		if (head == null) return null;
		if (head.hash == hash && Objects.equals(key, head.key)) {
			table[idx] = head.next;
			size--;
			return head;
		}
		Node<K, V> prev = head;
		Node<K, V> n = head.next;
		while (n != null && n.hash <= hash) {
			if (n.hash == hash && Objects.equals(key, n.key)) {
				prev.next = n.next;
				size--;
				return n;
			}
			prev = n;
			n = n.next;
		}
		return null;
	}

	private void growIfNeeded() {
		if (size + 1 >= threshold && table.length < Hashing.MAX_TABLE_SIZE) {
			growTable(table.length << 1);
		}
	}

	/* Resize helpers */
	private void growTable(int newLength) {
		int oldLength = table.length;
		threshold = Hashing.threshold(newLength, loadFactor);
		if (size == 0) {
			table = newTable(newLength);
			return;
		}

		Node<K, V>[] tab = Arrays.copyOf(table, newLength);
		table = tab;
		// One doubling per pass: bucket i splits into i (bit clear) and i + oldLength (bit set).
		while (oldLength < newLength) {
			for (int i = 0; i < oldLength; i++) {
				Node<K, V> n = tab[i];
				if (n == null) continue;

				Node<K, V> loHead = null, loTail = null;
				Node<K, V> hiHead = null, hiTail = null;
				do {
					Node<K, V> next = n.next;
					if ((n.hash & oldLength) == 0) {
						if (loTail == null) loHead = n;
						else loTail.next = n;
						loTail = n;
					} else {
						if (hiTail == null) hiHead = n;
						else hiTail.next = n;
						hiTail = n;
					}
					n = next;
				} while (n != null);

				if (loTail != null) loTail.next = null;
				if (hiTail != null) hiTail.next = null;
				tab[i] = loHead;
				tab[i + oldLength] = hiHead;
			}
			oldLength <<= 1;
		}
	}

	private static void validateLoadFactor(double lf) {
		if (!(lf > 0.0d && lf <= 1.0d)) {
			throw new IllegalArgumentException("loadFactor must be in (0,1]: " + lf);
		}
	}

	@SuppressWarnings("unchecked")
	private static <K, V> Node<K, V>[] newTable(int length) {
		return (Node<K, V>[]) new Node<?, ?>[length];
	}

	/* ------------ Chain node ------------ */

	static final class Node<K, V> {
		final K key;
		final int hash;
		V value;
		Node<K, V> next;

		Node(K key, int hash, V value, Node<K, V> next) {
			this.key = key;
			this.hash = hash;
			this.value = value;
			this.next = next;
		}

		/* Chains are hash-sorted, so a node hashing above h proves h is absent. */
		Node<K, V> find(Object k, int h) {
			Node<K, V> n = this;
			for (;;) {
				if (n.hash == h && Objects.equals(k, n.key)) return n;
				if (n.next == null || n.hash > h) return null;
				n = n.next;
			}
		}

		@Override
		public String toString() {
			return "Node(" + key + ", " + value + ", " + hash + ")";
		}
	}

	/* ------------ Views / Iterators ------------ */

	private final class EntrySet extends AbstractSet<Map.Entry<K, V>> {
		@Override
		public int size() {
			return ChainedHashMap.this.size;
		}

		@Override
		public void clear() {
			ChainedHashMap.this.clear();
		}

		@Override
		public boolean contains(Object o) {
			if (!(o instanceof Map.Entry<?, ?> e)) return false;
			Node<K, V> nd = findNode(e.getKey());
			return nd != null && Objects.equals(nd.value, e.getValue());
		}

		@Override
		public boolean remove(Object o) {
			if (!contains(o)) return false;
			remove0(((Map.Entry<?, ?>) o).getKey());
			return true;
		}

		@Override
		public Iterator<Map.Entry<K, V>> iterator() {
			if (size == 0) return Collections.emptyIterator();
			return new ChainIterator<>() {
				@Override
				Map.Entry<K, V> extract(Node<K, V> nd) {
					return new EntryView(nd);
				}
			};
		}
	}

	private final class KeySet extends AbstractSet<K> {
		@Override
		public int size() {
			return ChainedHashMap.this.size;
		}

		@Override
		public void clear() {
			ChainedHashMap.this.clear();
		}

		@Override
		public boolean contains(Object o) {
			return containsKey(o);
		}

		@Override
		public boolean remove(Object o) {
			return remove0(o) != null;
		}

		@Override
		public Iterator<K> iterator() {
			if (size == 0) return Collections.emptyIterator();
			return new ChainIterator<>() {
				@Override
				K extract(Node<K, V> nd) {
					return nd.key;
				}
			};
		}
	}

	private final class Values extends AbstractCollection<V> {
		@Override
		public int size() {
			return ChainedHashMap.this.size;
		}

		@Override
		public void clear() {
			ChainedHashMap.this.clear();
		}

		@Override
		public Iterator<V> iterator() {
			if (size == 0) return Collections.emptyIterator();
			return new ChainIterator<>() {
				@Override
				V extract(Node<K, V> nd) {
					return nd.value;
				}
			};
		}
	}

	/**
	 * Walks buckets in index order and each chain to its end before moving on.
	 * Subclasses only choose what to project out of a node.
	 */
	private abstract class ChainIterator<T> implements Iterator<T> {
		private final Node<K, V>[] tab = table;
		private int nextBucket;
		private Node<K, V> node;
		private Node<K, V> lastReturned;

		abstract T extract(Node<K, V> nd);

		@Override
		public boolean hasNext() {
			if (node != null) return true;
			while (nextBucket < tab.length) {
				Node<K, V> n = tab[nextBucket++];
				if (n != null) {
					node = n;
					return true;
				}
			}
			return false;
		}

		@Override
		public T next() {
			if (!hasNext()) throw new NoSuchElementException();
			Node<K, V> nd = node;
			node = nd.next;
			lastReturned = nd;
			return extract(nd);
		}

		@Override
		public void remove() {
			if (lastReturned == null) throw new IllegalStateException();
			// Unlinking never resizes and leaves lastReturned.next (our cursor) in place.
			remove0(lastReturned.key);
			lastReturned = null;
		}
	}

	private final class EntryView implements Map.Entry<K, V> {
		private final Node<K, V> node;

		EntryView(Node<K, V> node) {
			this.node = node;
		}

		@Override
		public K getKey() {
			return node.key;
		}

		@Override
		public V getValue() {
			return node.value;
		}

		@Override
		public V setValue(V value) {
			V old = node.value;
			node.value = value;
			return old;
		}

		@Override
		public int hashCode() {
			return Objects.hashCode(node.key) ^ Objects.hashCode(node.value);
		}

		@Override
		public boolean equals(Object obj) {
			if (!(obj instanceof Map.Entry<?, ?> e)) return false;
			return Objects.equals(node.key, e.getKey()) && Objects.equals(node.value, e.getValue());
		}

		@Override
		public String toString() {
			return node.key + "=" + node.value;
		}
	}
}
