package uk.ac.manchester.cs.taskengine.tes.model;

import java.util.List;

public class TesResources {
	private Integer cpuCores;
	private Boolean preemptible;
	private Double ramGb;
	private Double diskGb;
	private List<String> zones;

	public Integer getCpuCores() {
		return cpuCores;
	}

	public void setCpuCores(Integer cpuCores) {
		this.cpuCores = cpuCores;
	}

	public Boolean getPreemptible() {
		return preemptible;
	}

	public void setPreemptible(Boolean preemptible) {
		this.preemptible = preemptible;
	}

	public Double getRamGb() {
		return ramGb;
	}

	public void setRamGb(Double ramGb) {
		this.ramGb = ramGb;
	}

	public Double getDiskGb() {
		return diskGb;
	}

	public void setDiskGb(Double diskGb) {
		this.diskGb = diskGb;
	}

	public List<String> getZones() {
		return zones;
	}

	public void setZones(List<String> zones) {
		this.zones = zones;
	}
}
