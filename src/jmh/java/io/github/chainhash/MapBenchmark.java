package io.github.chainhash;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Random;
import java.util.concurrent.TimeUnit;
import java.util.stream.IntStream;

import it.unimi.dsi.fastutil.objects.Object2ObjectOpenHashMap;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;

@Warmup(iterations = 3)
@Measurement(iterations = 5)
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
public class MapBenchmark {

	private static int[] distinctInts(Random rnd, int n, HashSet<Integer> exclude) {
		int[] out = new int[n];
		for (int i = 0; i < n; i++) {
			int k;
			do { k = rnd.nextInt(); } while (!exclude.add(k));
			out[i] = k;
		}
		return out;
	}

	@State(Scope.Benchmark)
	public static class ReadState {
		@Param({ "100", "1000", "10000" })
		int size;

		ChainedHashMap<Integer, Integer> chained;
		HashMap<Integer, Integer> jdk;
		Object2ObjectOpenHashMap<Integer, Integer> fastutil;
		int[] keys;
		int[] misses;
		Random rnd;

		@Setup(Level.Trial)
		public void setup() {
			rnd = new Random(123);
			var seen = new HashSet<Integer>(size * 4);
			keys = distinctInts(rnd, size, seen);
			misses = distinctInts(rnd, size, seen);
			chained = new ChainedHashMap<>();
			jdk = new HashMap<>();
			fastutil = new Object2ObjectOpenHashMap<>();
			for (int i = 0; i < size; i++) {
				chained.put(keys[i], i);
				jdk.put(keys[i], i);
				fastutil.put(keys[i], i);
			}
		}

		int nextKey() { return keys[rnd.nextInt(keys.length)]; }
		int nextMiss() { return misses[rnd.nextInt(misses.length)]; }
	}

	@State(Scope.Thread)
	public static class MutateState {
		@Param({ "100", "1000", "10000" })
		int size;

		int[] keys;
		int[] misses;
		int putValue;
		ChainedHashMap<Integer, Integer> chained;
		HashMap<Integer, Integer> jdk;
		Object2ObjectOpenHashMap<Integer, Integer> fastutil;

		@Setup(Level.Trial)
		public void initKeys() {
			var rnd = new Random(456);
			keys = IntStream.range(0, size).map(i -> rnd.nextInt()).toArray();
			misses = IntStream.range(0, size).map(i -> rnd.nextInt()).toArray();
		}

		@Setup(Level.Iteration)
		public void resetMaps() {
			chained = new ChainedHashMap<>();
			jdk = new HashMap<>();
			fastutil = new Object2ObjectOpenHashMap<>();
			for (int i = 0; i < size; i++) {
				chained.put(keys[i], i);
				jdk.put(keys[i], i);
				fastutil.put(keys[i], i);
			}
			putValue = 0;
		}

		int existingKey(int i) { return keys[i % keys.length]; }
		int missingKey(int i) { return misses[i % misses.length]; }
		int nextValue() { return ++putValue; }
	}

	@State(Scope.Thread)
	public static class RemoveState {
		@Param({ "100", "1000", "10000" })
		int size;

		ChainedHashMap<Integer, Integer> chained;
		HashMap<Integer, Integer> jdk;
		Object2ObjectOpenHashMap<Integer, Integer> fastutil;
		int[] keys;
		int[] misses;
		Random rnd;

		@Setup(Level.Trial)
		public void initData() {
			rnd = new Random(789);
			var seen = new HashSet<Integer>(size * 4);
			keys = distinctInts(rnd, size, seen);
			misses = distinctInts(rnd, size, seen);
		}

		@Setup(Level.Invocation)
		public void resetMaps() {
			chained = new ChainedHashMap<>();
			jdk = new HashMap<>();
			fastutil = new Object2ObjectOpenHashMap<>();
			for (int i = 0; i < size; i++) {
				chained.put(keys[i], i);
				jdk.put(keys[i], i);
				fastutil.put(keys[i], i);
			}
		}

		int hitKey() { return keys[rnd.nextInt(keys.length)]; }
		int missKey() { return misses[rnd.nextInt(misses.length)]; }
	}

	// ------- get hit/miss -------
	@Benchmark
	public int chainedGetHit(ReadState s) {
		return s.chained.get(s.nextKey());
	}

	@Benchmark
	public int jdkGetHit(ReadState s) {
		return s.jdk.get(s.nextKey());
	}

	@Benchmark
	public int fastutilGetHit(ReadState s) {
		return s.fastutil.get(s.nextKey());
	}

	@Benchmark
	public int chainedGetMiss(ReadState s) {
		Integer v = s.chained.get(s.nextMiss());
		return v == null ? -1 : v;
	}

	@Benchmark
	public int jdkGetMiss(ReadState s) {
		Integer v = s.jdk.get(s.nextMiss());
		return v == null ? -1 : v;
	}

	@Benchmark
	public int fastutilGetMiss(ReadState s) {
		Integer v = s.fastutil.get(s.nextMiss());
		return v == null ? -1 : v;
	}

	@Benchmark
	public int chainedGetOrElseMiss(ReadState s) {
		return s.chained.getOrElse(s.nextMiss(), () -> -1);
	}

	// ------- iterate -------
	@Benchmark
	public long chainedIterate(ReadState s) {
		long sum = 0;
		for (var e : s.chained.entrySet()) sum += e.getValue();
		return sum;
	}

	@Benchmark
	public long chainedForEach(ReadState s) {
		long[] sum = new long[1];
		s.chained.forEach((k, v) -> sum[0] += v);
		return sum[0];
	}

	@Benchmark
	public long jdkIterate(ReadState s) {
		long sum = 0;
		for (var e : s.jdk.entrySet()) sum += e.getValue();
		return sum;
	}

	@Benchmark
	public long fastutilIterate(ReadState s) {
		long sum = 0;
		for (var e : s.fastutil.entrySet()) sum += e.getValue();
		return sum;
	}

	// ------- mutating: put hit/miss -------
	@Benchmark
	public int chainedPutHit(MutateState s) {
		int k = s.existingKey(0);
		return s.chained.put(k, s.nextValue());
	}

	@Benchmark
	public void chainedUpdateHit(MutateState s) {
		s.chained.update(s.existingKey(0), s.nextValue());
	}

	@Benchmark
	public int jdkPutHit(MutateState s) {
		int k = s.existingKey(0);
		return s.jdk.put(k, s.nextValue());
	}

	@Benchmark
	public int fastutilPutHit(MutateState s) {
		int k = s.existingKey(0);
		return s.fastutil.put(k, s.nextValue());
	}

	@Benchmark
	public int chainedPutMiss(MutateState s) {
		int k = s.missingKey(s.putValue);
		Integer prev = s.chained.put(k, s.nextValue());
		return prev == null ? -1 : prev;
	}

	@Benchmark
	public int jdkPutMiss(MutateState s) {
		int k = s.missingKey(s.putValue);
		Integer prev = s.jdk.put(k, s.nextValue());
		return prev == null ? -1 : prev;
	}

	@Benchmark
	public int fastutilPutMiss(MutateState s) {
		int k = s.missingKey(s.putValue);
		Integer prev = s.fastutil.put(k, s.nextValue());
		return prev == null ? -1 : prev;
	}

	@Benchmark
	public int chainedGetOrElseUpdate(MutateState s) {
		int k = s.missingKey(s.putValue);
		return s.chained.getOrElseUpdate(k, s::nextValue);
	}

	@Benchmark
	public int jdkComputeIfAbsent(MutateState s) {
		int k = s.missingKey(s.putValue);
		return s.jdk.computeIfAbsent(k, ignored -> s.nextValue());
	}

	// ------- remove hit/miss -------
	@Benchmark
	public int chainedRemoveHit(RemoveState s) {
		Integer prev = s.chained.remove(s.hitKey());
		return prev == null ? -1 : prev;
	}

	@Benchmark
	public int jdkRemoveHit(RemoveState s) {
		Integer prev = s.jdk.remove(s.hitKey());
		return prev == null ? -1 : prev;
	}

	@Benchmark
	public int fastutilRemoveHit(RemoveState s) {
		Integer prev = s.fastutil.remove(s.hitKey());
		return prev == null ? -1 : prev;
	}

	@Benchmark
	public int chainedRemoveMiss(RemoveState s) {
		Integer prev = s.chained.remove(s.missKey());
		return prev == null ? -1 : prev;
	}

	@Benchmark
	public int jdkRemoveMiss(RemoveState s) {
		Integer prev = s.jdk.remove(s.missKey());
		return prev == null ? -1 : prev;
	}

	@Benchmark
	public int fastutilRemoveMiss(RemoveState s) {
		Integer prev = s.fastutil.remove(s.missKey());
		return prev == null ? -1 : prev;
	}
}
