package uk.ac.manchester.cs.taskengine.tes.model;

/**
 * An input to a task, fetched by the service before the executors run.
 * Exactly one of the URL or the inline content is set.
 */
public class TesInput {
	private String name;
	private String description;
	private String url;
	private String path;
	private TesFileType type;
	private String content;

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

	public String getContent() {
		return content;
	}

	public void setContent(String content) {
		this.content = content;
	}
}
