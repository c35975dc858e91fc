package uk.ac.manchester.cs.taskengine.tes.model;

public class CreateTaskResponse {
	private String id;

	public String getId() {
		return id;
	}

	public void setId(String id) {
		this.id = id;
	}
}
