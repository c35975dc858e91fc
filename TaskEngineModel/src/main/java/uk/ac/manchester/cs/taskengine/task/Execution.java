package uk.ac.manchester.cs.taskengine.task;

import static java.util.Collections.unmodifiableList;
import static java.util.Collections.unmodifiableMap;
import static java.util.Objects.requireNonNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One command run in one environment. A {@link Task} runs its executions
 * strictly in sequence.
 */
public final class Execution {
	private final String image;
	private final String program;
	private final List<String> args;
	private final String workDir;
	private final Map<String, String> env;
	private final String stdin;
	private final String stdout;
	private final String stderr;

	private Execution(Builder b) {
		image = requireNonNull(b.image, "execution image");
		program = requireNonNull(b.program, "execution program");
		args = unmodifiableList(new ArrayList<>(b.args));
		workDir = b.workDir;
		env = unmodifiableMap(new LinkedHashMap<>(b.env));
		stdin = b.stdin;
		stdout = b.stdout;
		stderr = b.stderr;
	}

	public static Builder builder(String image, String program) {
		return new Builder(image, program);
	}

	public String getImage() {
		return image;
	}

	public String getProgram() {
		return program;
	}

	public List<String> getArgs() {
		return args;
	}

	/** @return the program followed by its arguments */
	public List<String> getCommandLine() {
		List<String> command = new ArrayList<>();
		command.add(program);
		command.addAll(args);
		return command;
	}

	public String getWorkDir() {
		return workDir;
	}

	public Map<String, String> getEnv() {
		return env;
	}

	public String getStdin() {
		return stdin;
	}

	public String getStdout() {
		return stdout;
	}

	public String getStderr() {
		return stderr;
	}

	public static final class Builder {
		private final String image;
		private final String program;
		private final List<String> args = new ArrayList<>();
		private String workDir;
		private final Map<String, String> env = new LinkedHashMap<>();
		private String stdin;
		private String stdout;
		private String stderr;

		private Builder(String image, String program) {
			this.image = image;
			this.program = program;
		}

		public Builder args(String... args) {
			this.args.addAll(Arrays.asList(args));
			return this;
		}

		public Builder args(List<String> args) {
			this.args.addAll(args);
			return this;
		}

		public Builder workDir(String workDir) {
			this.workDir = workDir;
			return this;
		}

		public Builder env(String key, String value) {
			env.put(requireNonNull(key), requireNonNull(value));
			return this;
		}

		public Builder stdin(String path) {
			stdin = path;
			return this;
		}

		public Builder stdout(String path) {
			stdout = path;
			return this;
		}

		public Builder stderr(String path) {
			stderr = path;
			return this;
		}

		public Execution build() {
			return new Execution(this);
		}
	}
}
