package uk.ac.manchester.cs.taskengine.tes.model;

public enum TesFileType {
	FILE, DIRECTORY
}
