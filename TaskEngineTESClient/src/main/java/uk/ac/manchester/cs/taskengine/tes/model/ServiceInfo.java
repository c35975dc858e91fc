package uk.ac.manchester.cs.taskengine.tes.model;

/**
 * Describes the service; used to check that it is there at all.
 */
public class ServiceInfo {
	private String id;
	private String name;
	private String description;
	private String version;

	public String getId() {
		return id;
	}

	public void setId(String id) {
		this.id = id;
	}

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

	public String getVersion() {
		return version;
	}

	public void setVersion(String version) {
		this.version = version;
	}
}
