package uk.ac.manchester.cs.taskengine.events;

import static org.slf4j.LoggerFactory.getLogger;

import java.util.Set;
import java.util.concurrent.CopyOnWriteArraySet;

import org.slf4j.Logger;

import uk.ac.manchester.cs.taskengine.events.TaskEvent.Type;

/**
 * Hands events to whoever is listening. With nobody listening this does
 * nothing; a listener that throws is logged and otherwise ignored.
 */
public class TaskEvents {
	private final Logger log = getLogger(getClass());
	private final Set<TaskEventListener> listeners = new CopyOnWriteArraySet<>();

	public void addListener(TaskEventListener listener) {
		listeners.add(listener);
	}

	public void removeListener(TaskEventListener listener) {
		listeners.remove(listener);
	}

	public boolean hasListeners() {
		return !listeners.isEmpty();
	}

	public void send(Type type, String backend, String taskName, String message) {
		if (listeners.isEmpty())
			return;
		TaskEvent event = new TaskEvent(type, backend, taskName, message);
		for (TaskEventListener listener : listeners) {
			try {
				listener.taskEvent(event);
			} catch (RuntimeException e) {
				log.warn("listener failed to handle " + event, e);
			}
		}
	}

	/**
	 * A view of this channel fixed to one task, for handing to the code that
	 * runs it.
	 */
	public Emitter forTask(final String backend, final String taskName) {
		return new Emitter() {
			@Override
			public void send(Type type, String message) {
				TaskEvents.this.send(type, backend, taskName, message);
			}

			@Override
			public boolean isListening() {
				return hasListeners();
			}
		};
	}

	/** Sends the events of one task. */
	public interface Emitter {
		void send(Type type, String message);

		/** @return whether it is worth building a message at all */
		boolean isListening();
	}
}
