package uk.ac.manchester.cs.taskengine.name;

import static com.google.common.hash.Funnels.stringFunnel;
import static java.nio.charset.StandardCharsets.UTF_8;

import java.util.ArrayList;
import java.util.List;

import com.google.common.hash.BloomFilter;

/**
 * A probabilistic set of strings that grows as it fills. It is a chain of
 * plain bloom filters; each new one has twice the capacity of the one before
 * and half its false positive rate, so the overall rate stays under the
 * target however many strings are added. There are never false negatives.
 * <p>
 * Not thread-safe.
 */
public class GrowableBloomFilter {
	private static final double TIGHTENING_RATIO = 0.5;
	private static final int GROWTH_FACTOR = 2;

	private final List<Slice> slices = new ArrayList<>();
	private int size;

	/**
	 * @param errorRate
	 *            The false positive rate to stay below.
	 * @param expectedSize
	 *            How many strings the first slice should hold.
	 */
	public GrowableBloomFilter(double errorRate, int expectedSize) {
		if (errorRate <= 0 || errorRate >= 1)
			throw new IllegalArgumentException(
					"error rate must be between 0 and 1");
		if (expectedSize < 1)
			throw new IllegalArgumentException(
					"expected size must be positive");
		// The rates of the slices form a geometric series summing to the target
		slices.add(new Slice(expectedSize, errorRate * (1 - TIGHTENING_RATIO)));
	}

	/**
	 * @return Whether the string might have been added. A false answer is
	 *         always right.
	 */
	public boolean contains(String item) {
		for (Slice slice : slices)
			if (slice.filter.mightContain(item))
				return true;
		return false;
	}

	/**
	 * Add a string.
	 *
	 * @return Whether the string was (probably) not already there.
	 */
	public boolean add(String item) {
		if (contains(item))
			return false;
		Slice current = slices.get(slices.size() - 1);
		if (current.isFull()) {
			current = new Slice(current.capacity * GROWTH_FACTOR,
					current.errorRate * TIGHTENING_RATIO);
			slices.add(current);
		}
		current.add(item);
		size++;
		return true;
	}

	/** @return how many strings have been added */
	public int size() {
		return size;
	}

	/** @return how many plain filters are chained */
	int sliceCount() {
		return slices.size();
	}

	/** @return how many strings the newest slice was sized for */
	int currentCapacity() {
		return slices.get(slices.size() - 1).capacity;
	}

	private static final class Slice {
		final int capacity;
		final double errorRate;
		final BloomFilter<CharSequence> filter;
		int count;

		Slice(int capacity, double errorRate) {
			this.capacity = capacity;
			this.errorRate = errorRate;
			filter = BloomFilter.create(stringFunnel(UTF_8), capacity,
					errorRate);
		}

		boolean isFull() {
			return count >= capacity;
		}

		void add(String item) {
			filter.put(item);
			count++;
		}
	}
}
