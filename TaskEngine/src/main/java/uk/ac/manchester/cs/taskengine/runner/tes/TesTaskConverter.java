package uk.ac.manchester.cs.taskengine.runner.tes;

import static org.apache.commons.io.FileUtils.readFileToByteArray;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;

import uk.ac.manchester.cs.taskengine.errors.SubmitException;
import uk.ac.manchester.cs.taskengine.task.Contents;
import uk.ac.manchester.cs.taskengine.task.Execution;
import uk.ac.manchester.cs.taskengine.task.IOType;
import uk.ac.manchester.cs.taskengine.task.Input;
import uk.ac.manchester.cs.taskengine.task.Output;
import uk.ac.manchester.cs.taskengine.task.Resources;
import uk.ac.manchester.cs.taskengine.task.Task;
import uk.ac.manchester.cs.taskengine.tes.model.TesExecutor;
import uk.ac.manchester.cs.taskengine.tes.model.TesFileType;
import uk.ac.manchester.cs.taskengine.tes.model.TesInput;
import uk.ac.manchester.cs.taskengine.tes.model.TesOutput;
import uk.ac.manchester.cs.taskengine.tes.model.TesResources;
import uk.ac.manchester.cs.taskengine.tes.model.TesTask;

/**
 * Turns tasks into the service's task documents. Host files and literals are
 * sent inline, so they must be UTF-8 text.
 */
public abstract class TesTaskConverter {
	private TesTaskConverter() {
	}

	public static TesTask convert(Task task, Resources resources)
			throws SubmitException {
		TesTask tes = new TesTask();
		tes.setName(task.getName());
		tes.setDescription(task.getDescription());
		List<TesExecutor> executors = new ArrayList<>();
		for (Execution execution : task.getExecutions())
			executors.add(convert(execution));
		tes.setExecutors(executors);
		if (!task.getInputs().isEmpty()) {
			List<TesInput> inputs = new ArrayList<>();
			for (Input input : task.getInputs())
				inputs.add(convert(input));
			tes.setInputs(inputs);
		}
		if (!task.getOutputs().isEmpty()) {
			List<TesOutput> outputs = new ArrayList<>();
			for (Output output : task.getOutputs())
				outputs.add(convert(output));
			tes.setOutputs(outputs);
		}
		if (!task.getVolumes().isEmpty())
			tes.setVolumes(new ArrayList<>(task.getVolumes()));
		tes.setResources(convert(resources));
		return tes;
	}

	static TesExecutor convert(Execution execution) {
		TesExecutor executor = new TesExecutor();
		executor.setImage(execution.getImage());
		executor.setCommand(new ArrayList<>(execution.getCommandLine()));
		executor.setWorkdir(execution.getWorkDir());
		if (!execution.getEnv().isEmpty())
			executor.setEnv(new HashMap<>(execution.getEnv()));
		executor.setStdin(execution.getStdin());
		executor.setStdout(execution.getStdout());
		executor.setStderr(execution.getStderr());
		return executor;
	}

	private static TesFileType convert(IOType type) {
		return type == IOType.DIRECTORY ? TesFileType.DIRECTORY
				: TesFileType.FILE;
	}

	static TesInput convert(Input input) throws SubmitException {
		TesInput tes = new TesInput();
		tes.setName(input.getName());
		tes.setDescription(input.getDescription());
		tes.setPath(input.getPath());
		tes.setType(convert(input.getType()));
		Contents contents = input.getContents();
		switch (contents.getKind()) {
		case URL:
			tes.setUrl(contents.getUrl().toString());
			break;
		case PATH:
			try {
				tes.setContent(text(readFileToByteArray(contents.getPath()),
						input));
			} catch (IOException e) {
				throw new SubmitException("cannot read input file "
						+ contents.getPath(), e);
			}
			break;
		case LITERAL:
			tes.setContent(text(contents.getLiteral(), input));
			break;
		}
		return tes;
	}

	private static String text(byte[] bytes, Input input)
			throws SubmitException {
		try {
			return StandardCharsets.UTF_8.newDecoder()
					.onMalformedInput(CodingErrorAction.REPORT)
					.onUnmappableCharacter(CodingErrorAction.REPORT)
					.decode(ByteBuffer.wrap(bytes)).toString();
		} catch (CharacterCodingException e) {
			throw new SubmitException("contents of input " + input.getPath()
					+ " are not UTF-8 text", e);
		}
	}

	static TesOutput convert(Output output) {
		TesOutput tes = new TesOutput();
		tes.setName(output.getName());
		tes.setDescription(output.getDescription());
		tes.setPath(output.getPath());
		if (output.getUrl() != null)
			tes.setUrl(output.getUrl().toString());
		tes.setType(convert(output.getType()));
		return tes;
	}

	/** Limits have no place in the service's resources and are dropped. */
	static TesResources convert(Resources resources) {
		TesResources tes = new TesResources();
		if (resources.getCpu() != null)
			tes.setCpuCores(resources.getCpu().intValue());
		tes.setRamGb(resources.getRam());
		tes.setDiskGb(resources.getDisk());
		tes.setPreemptible(resources.getPreemptible());
		if (resources.getZones() != null && !resources.getZones().isEmpty())
			tes.setZones(new ArrayList<>(resources.getZones()));
		return tes;
	}
}
