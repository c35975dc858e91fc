package uk.ac.manchester.cs.taskengine.docker.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public class ResourceRequirements {
	@JsonProperty("Limits")
	private ResourceObject limits;
	@JsonProperty("Reservations")
	private ResourceObject reservations;

	public ResourceObject getLimits() {
		return limits;
	}

	public void setLimits(ResourceObject limits) {
		this.limits = limits;
	}

	public ResourceObject getReservations() {
		return reservations;
	}

	public void setReservations(ResourceObject reservations) {
		this.reservations = reservations;
	}
}
