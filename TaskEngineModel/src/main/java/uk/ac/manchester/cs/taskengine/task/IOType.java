package uk.ac.manchester.cs.taskengine.task;

/**
 * What sort of filesystem object an input or output is.
 */
public enum IOType {
	/** A single file. */
	FILE,
	/** A directory, copied or mounted as a whole. */
	DIRECTORY
}
