package uk.ac.manchester.cs.taskengine.tes.model;

/**
 * An output of a task, uploaded by the service after the executors run.
 */
public class TesOutput {
	private String name;
	private String description;
	private String url;
	private String path;
	private TesFileType type;

	public String getName() {
		return name;
	}

	public void setName(String name) {
		this.name = name;
	}

	public String getDescription() {
		return description;
	}

	public void setDescription(String description) {
		this.description = description;
	}

	public String getUrl() {
		return url;
	}

	public void setUrl(String url) {
		this.url = url;
	}

	public String getPath() {
		return path;
	}

	public void setPath(String path) {
		this.path = path;
	}

	public TesFileType getType() {
		return type;
	}

	public void setType(TesFileType type) {
		this.type = type;
	}
}
