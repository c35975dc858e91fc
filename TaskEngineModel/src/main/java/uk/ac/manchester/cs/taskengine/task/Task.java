package uk.ac.manchester.cs.taskengine.task;

import static java.util.Collections.unmodifiableList;
import static java.util.Objects.requireNonNull;
import static org.apache.commons.lang3.StringUtils.isBlank;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * A unit of work: one or more {@link Execution}s plus the inputs, outputs and
 * resources they share. Immutable once built.
 */
public final class Task {
	private final String name;
	private final String description;
	private final List<Execution> executions;
	private final List<Input> inputs;
	private final List<Output> outputs;
	private final Resources resources;
	private final List<String> volumes;

	private Task(String name, String description, List<Execution> executions,
			List<Input> inputs, List<Output> outputs, Resources resources,
			List<String> volumes) {
		if (executions.isEmpty())
			throw new IllegalArgumentException(
					"a task needs at least one execution");
		this.name = name;
		this.description = description;
		this.executions = unmodifiableList(new ArrayList<>(executions));
		this.inputs = unmodifiableList(new ArrayList<>(inputs));
		this.outputs = unmodifiableList(new ArrayList<>(outputs));
		this.resources = resources;
		this.volumes = unmodifiableList(new ArrayList<>(volumes));
	}

	public static Builder builder() {
		return new Builder();
	}

	/** @return the name, or <tt>null</tt> if the engine is to choose one */
	public String getName() {
		return name;
	}

	public boolean hasName() {
		return !isBlank(name);
	}

	public String getDescription() {
		return description;
	}

	public List<Execution> getExecutions() {
		return executions;
	}

	public List<Input> getInputs() {
		return inputs;
	}

	public List<Output> getOutputs() {
		return outputs;
	}

	/** @return the task's own resource hints, or <tt>null</tt> */
	public Resources getResources() {
		return resources;
	}

	/** @return paths inside the environment shared by all executions */
	public List<String> getVolumes() {
		return volumes;
	}

	/**
	 * @param newName
	 *            The name to give the copy.
	 * @return A copy of this task with a different name.
	 */
	public Task withName(String newName) {
		return new Task(requireNonNull(newName), description, executions,
				inputs, outputs, resources, volumes);
	}

	@Override
	public String toString() {
		return "Task(" + name + ", " + executions.size() + " execution(s))";
	}

	public static final class Builder {
		private String name;
		private String description;
		private final List<Execution> executions = new ArrayList<>();
		private final List<Input> inputs = new ArrayList<>();
		private final List<Output> outputs = new ArrayList<>();
		private Resources resources;
		private final List<String> volumes = new ArrayList<>();

		private Builder() {
		}

		public Builder name(String name) {
			this.name = name;
			return this;
		}

		public Builder description(String description) {
			this.description = description;
			return this;
		}

		public Builder execution(Execution execution) {
			executions.add(requireNonNull(execution));
			return this;
		}

		public Builder input(Input input) {
			inputs.add(requireNonNull(input));
			return this;
		}

		public Builder output(Output output) {
			outputs.add(requireNonNull(output));
			return this;
		}

		public Builder resources(Resources resources) {
			this.resources = resources;
			return this;
		}

		public Builder volumes(String... paths) {
			volumes.addAll(Arrays.asList(paths));
			return this;
		}

		/**
		 * @throws IllegalArgumentException
		 *             If no execution was added.
		 */
		public Task build() {
			return new Task(name, description, executions, inputs, outputs,
					resources, volumes);
		}
	}
}
