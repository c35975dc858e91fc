package uk.ac.manchester.cs.taskengine.task;

import static java.lang.System.currentTimeMillis;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.concurrent.atomic.AtomicInteger;

import org.junit.Test;

public class CancellationTokenTest {
	@Test
	public void startsLiveAndCancelsOnce() {
		CancellationToken token = new CancellationToken();
		final AtomicInteger count = new AtomicInteger();
		token.onCancel(new Runnable() {
			@Override
			public void run() {
				count.incrementAndGet();
			}
		});
		assertFalse(token.isCancelled());
		token.cancel();
		token.cancel();
		assertTrue(token.isCancelled());
		assertEquals(1, count.get());
	}

	@Test
	public void lateRegistrationRunsImmediately() {
		CancellationToken token = new CancellationToken();
		token.cancel();
		final AtomicInteger count = new AtomicInteger();
		token.onCancel(new Runnable() {
			@Override
			public void run() {
				count.incrementAndGet();
			}
		}).close();
		assertEquals(1, count.get());
	}

	@Test
	public void closedRegistrationDoesNotRun() {
		CancellationToken token = new CancellationToken();
		final AtomicInteger count = new AtomicInteger();
		CancellationToken.Registration reg = token.onCancel(new Runnable() {
			@Override
			public void run() {
				count.incrementAndGet();
			}
		});
		reg.close();
		token.cancel();
		assertEquals(0, count.get());
	}

	@Test
	public void throwingActionDoesNotStopOthers() {
		CancellationToken token = new CancellationToken();
		final AtomicInteger count = new AtomicInteger();
		token.onCancel(new Runnable() {
			@Override
			public void run() {
				throw new IllegalStateException("boom");
			}
		});
		token.onCancel(new Runnable() {
			@Override
			public void run() {
				count.incrementAndGet();
			}
		});
		token.cancel();
		assertEquals(1, count.get());
	}

	@Test
	public void awaitTimesOutWhenLive() {
		CancellationToken token = new CancellationToken();
		long start = currentTimeMillis();
		assertFalse(token.await(50));
		assertTrue(currentTimeMillis() - start >= 45);
	}

	@Test
	public void awaitWakesOnCancel() throws InterruptedException {
		final CancellationToken token = new CancellationToken();
		Thread canceller = new Thread() {
			@Override
			public void run() {
				token.await(50);
				token.cancel();
			}
		};
		long start = currentTimeMillis();
		canceller.start();
		assertTrue(token.await(10000));
		assertTrue(currentTimeMillis() - start < 5000);
		canceller.join();
	}
}
