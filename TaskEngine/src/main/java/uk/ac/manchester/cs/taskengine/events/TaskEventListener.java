package uk.ac.manchester.cs.taskengine.events;

/**
 * An interface for things that want to hear about what tasks are doing.
 * Listeners are called on the thread running the task, so must return quickly.
 */
public interface TaskEventListener {
	void taskEvent(TaskEvent event);
}
