package uk.ac.manchester.cs.taskengine.runner.docker;

import static org.slf4j.LoggerFactory.getLogger;

import java.io.IOException;

import org.slf4j.Logger;

/**
 * Removes one container or service, at most once, whether asked by a
 * cancellation callback or by the task's own thread.
 */
abstract class Teardown implements Runnable {
	private final Logger log = getLogger(getClass());
	private final String what;
	private boolean done;
	private IOException failure;

	Teardown(String what) {
		this.what = what;
	}

	/** Do the removal. */
	abstract void remove() throws IOException;

	@Override
	public synchronized void run() {
		if (done)
			return;
		done = true;
		log.info("tearing down " + what);
		try {
			remove();
		} catch (IOException e) {
			log.warn("failed to tear down " + what, e);
			failure = e;
		}
	}

	synchronized boolean isDone() {
		return done;
	}

	/** @return what went wrong with the removal, or <tt>null</tt> */
	synchronized IOException getFailure() {
		return failure;
	}
}
