package uk.ac.manchester.cs.taskengine.docker.model;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

public class ImageSummary {
	@JsonProperty("Id")
	private String id;
	@JsonProperty("RepoTags")
	private List<String> repoTags;

	public String getId() {
		return id;
	}

	public void setId(String id) {
		this.id = id;
	}

	public List<String> getRepoTags() {
		return repoTags;
	}

	public void setRepoTags(List<String> repoTags) {
		this.repoTags = repoTags;
	}
}
