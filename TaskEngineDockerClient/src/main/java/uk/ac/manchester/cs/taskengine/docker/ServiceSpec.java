package uk.ac.manchester.cs.taskengine.docker;

/**
 * What to run as a single-replica, never-restarted swarm service. Unlike a
 * plain container, a service can also reserve resources.
 */
public class ServiceSpec extends ContainerSpec {
	private Double cpuReservation;
	private Long memoryReservation;

	/** @return cores reserved, or <tt>null</tt> */
	public Double getCpuReservation() {
		return cpuReservation;
	}

	public void setCpuReservation(Double cpuReservation) {
		this.cpuReservation = cpuReservation;
	}

	/** @return bytes reserved, or <tt>null</tt> */
	public Long getMemoryReservation() {
		return memoryReservation;
	}

	public void setMemoryReservation(Long memoryReservation) {
		this.memoryReservation = memoryReservation;
	}
}
