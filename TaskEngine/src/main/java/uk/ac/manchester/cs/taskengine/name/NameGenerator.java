package uk.ac.manchester.cs.taskengine.name;

import static org.apache.commons.lang3.RandomStringUtils.randomAlphanumeric;
import static org.slf4j.LoggerFactory.getLogger;

import java.util.ArrayDeque;
import java.util.Deque;

import org.slf4j.Logger;

/**
 * Makes names for tasks that were not given one. Names are random alphanumeric
 * strings, checked against every name this generator has already produced, so
 * the same generator never hands out the same name twice. Names are made in
 * batches to keep the cost of the check off the submission path.
 */
public class NameGenerator {
	/** How many names are made at a time. */
	public static final int BUFFER_SIZE = 4096;
	public static final int NAME_LENGTH = 12;
	private static final double ERROR_RATE = 0.001;

	private final Logger log = getLogger(getClass());
	private final Deque<String> buffer = new ArrayDeque<>();
	private final GrowableBloomFilter issued;
	private final int bufferSize;
	private final int length;

	public NameGenerator() {
		this(NAME_LENGTH, BUFFER_SIZE);
	}

	/**
	 * @param length
	 *            How long each name is.
	 * @param bufferSize
	 *            How many names to make at once.
	 */
	public NameGenerator(int length, int bufferSize) {
		if (length < 1 || bufferSize < 1)
			throw new IllegalArgumentException(
					"length and buffer size must be positive");
		this.length = length;
		this.bufferSize = bufferSize;
		issued = new GrowableBloomFilter(ERROR_RATE, bufferSize);
	}

	/** @return a name this generator has not produced before */
	public synchronized String next() {
		if (buffer.isEmpty())
			refill();
		return buffer.removeFirst();
	}

	private void refill() {
		int rejected = 0;
		while (buffer.size() < bufferSize) {
			String name = randomAlphanumeric(length);
			// A hit may be a false positive; just try another
			if (issued.add(name))
				buffer.addLast(name);
			else
				rejected++;
		}
		log.debug("generated " + bufferSize + " names (" + rejected
				+ " rejected)");
	}
}
