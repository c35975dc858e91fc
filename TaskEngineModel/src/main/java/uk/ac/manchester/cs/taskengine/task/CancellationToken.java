package uk.ac.manchester.cs.taskengine.task;

import static java.lang.System.currentTimeMillis;
import static java.util.Objects.requireNonNull;
import static org.slf4j.LoggerFactory.getLogger;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;

/**
 * A one-shot cooperative cancellation signal. It starts live and may be
 * cancelled once; there is no way back. Any number of holders may observe it.
 * Backends observe it either by checking {@link #isCancelled()} at their call
 * boundaries, by sleeping through {@link #await(long)}, or by registering a
 * teardown action with {@link #onCancel(Runnable)}.
 */
public final class CancellationToken {
	private final Logger logger = getLogger(getClass());
	private final Object lock = new Object();
	private final Set<Runnable> actions = new LinkedHashSet<>();
	private boolean cancelled;

	/**
	 * Cancel the token. Registered actions run on the calling thread. Calling
	 * this more than once has no further effect.
	 */
	public void cancel() {
		List<Runnable> toRun;
		synchronized (lock) {
			if (cancelled)
				return;
			cancelled = true;
			toRun = new ArrayList<>(actions);
			actions.clear();
			lock.notifyAll();
		}
		for (Runnable action : toRun)
			runQuietly(action);
	}

	public boolean isCancelled() {
		synchronized (lock) {
			return cancelled;
		}
	}

	/**
	 * Sleep for up to the given time, waking early if the token is cancelled.
	 * 
	 * @param millis
	 *            How long to wait, in milliseconds.
	 * @return Whether the token is cancelled.
	 */
	public boolean await(long millis) {
		long deadline = currentTimeMillis() + millis;
		synchronized (lock) {
			while (!cancelled) {
				long remaining = deadline - currentTimeMillis();
				if (remaining <= 0)
					break;
				try {
					lock.wait(remaining);
				} catch (InterruptedException e) {
					Thread.currentThread().interrupt();
					break;
				}
			}
			return cancelled;
		}
	}

	/**
	 * Arrange for something to happen when the token is cancelled. If it
	 * already is, the action runs immediately on this thread.
	 * 
	 * @param action
	 *            What to do. Exceptions it throws are logged and dropped; an
	 *            action that needs to report failure must record it itself.
	 * @return A handle that withdraws the action when closed.
	 */
	public Registration onCancel(final Runnable action) {
		requireNonNull(action);
		synchronized (lock) {
			if (!cancelled) {
				actions.add(action);
				return new Registration() {
					@Override
					public void close() {
						synchronized (lock) {
							actions.remove(action);
						}
					}
				};
			}
		}
		runQuietly(action);
		return new Registration() {
			@Override
			public void close() {
				// Does Nothing; the action has already run
			}
		};
	}

	private void runQuietly(Runnable action) {
		try {
			action.run();
		} catch (RuntimeException e) {
			logger.warn("cancellation action failed", e);
		}
	}

	@Override
	public String toString() {
		return isCancelled() ? "CancellationToken(cancelled)"
				: "CancellationToken(live)";
	}

	/** Withdraws a cancellation action. */
	public interface Registration extends AutoCloseable {
		@Override
		void close();
	}
}
