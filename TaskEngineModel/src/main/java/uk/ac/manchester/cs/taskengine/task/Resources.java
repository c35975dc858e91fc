package uk.ac.manchester.cs.taskengine.task;

import static java.util.Collections.unmodifiableList;

import java.util.ArrayList;
import java.util.List;

/**
 * Resource hints for a task. Every field is optional; <tt>null</tt> means
 * "use the default" (or "ignore", for fields without one).
 */
public final class Resources {
	/** No hints at all. */
	public static final Resources NONE = builder().build();

	private final Double cpu;
	private final Double cpuLimit;
	private final Double ram;
	private final Double ramLimit;
	private final Double disk;
	private final Boolean preemptible;
	private final List<String> zones;

	private Resources(Builder b) {
		cpu = b.cpu;
		cpuLimit = b.cpuLimit;
		ram = b.ram;
		ramLimit = b.ramLimit;
		disk = b.disk;
		preemptible = b.preemptible;
		zones = b.zones == null ? null : unmodifiableList(new ArrayList<>(
				b.zones));
	}

	public static Builder builder() {
		return new Builder();
	}

	/** @return number of CPU cores requested */
	public Double getCpu() {
		return cpu;
	}

	/** @return hard limit on CPU cores */
	public Double getCpuLimit() {
		return cpuLimit;
	}

	/** @return RAM requested, in GiB */
	public Double getRam() {
		return ram;
	}

	/** @return hard limit on RAM, in GiB */
	public Double getRamLimit() {
		return ramLimit;
	}

	/** @return disk requested, in GiB */
	public Double getDisk() {
		return disk;
	}

	public Boolean getPreemptible() {
		return preemptible;
	}

	public List<String> getZones() {
		return zones;
	}

	/**
	 * Lays another set of hints over this one.
	 * 
	 * @param overrides
	 *            The hints that win wherever they are present.
	 * @return The merged hints; neither input is modified.
	 */
	public Resources apply(Resources overrides) {
		if (overrides == null)
			return this;
		Builder b = new Builder();
		b.cpu = pick(overrides.cpu, cpu);
		b.cpuLimit = pick(overrides.cpuLimit, cpuLimit);
		b.ram = pick(overrides.ram, ram);
		b.ramLimit = pick(overrides.ramLimit, ramLimit);
		b.disk = pick(overrides.disk, disk);
		b.preemptible = pick(overrides.preemptible, preemptible);
		b.zones = pick(overrides.zones, zones);
		return b.build();
	}

	private static <T> T pick(T preferred, T fallback) {
		return preferred != null ? preferred : fallback;
	}

	@Override
	public String toString() {
		return "Resources(cpu=" + cpu + ", cpuLimit=" + cpuLimit + ", ram="
				+ ram + ", ramLimit=" + ramLimit + ", disk=" + disk
				+ ", preemptible=" + preemptible + ", zones=" + zones + ")";
	}

	public static final class Builder {
		private Double cpu;
		private Double cpuLimit;
		private Double ram;
		private Double ramLimit;
		private Double disk;
		private Boolean preemptible;
		private List<String> zones;

		private Builder() {
		}

		public Builder cpu(Double cpu) {
			this.cpu = cpu;
			return this;
		}

		public Builder cpuLimit(Double cpuLimit) {
			this.cpuLimit = cpuLimit;
			return this;
		}

		public Builder ram(Double ram) {
			this.ram = ram;
			return this;
		}

		public Builder ramLimit(Double ramLimit) {
			this.ramLimit = ramLimit;
			return this;
		}

		public Builder disk(Double disk) {
			this.disk = disk;
			return this;
		}

		public Builder preemptible(Boolean preemptible) {
			this.preemptible = preemptible;
			return this;
		}

		public Builder zones(List<String> zones) {
			this.zones = zones;
			return this;
		}

		public Resources build() {
			return new Resources(this);
		}
	}
}
