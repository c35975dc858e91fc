package uk.ac.manchester.cs.taskengine.spring;

import static org.apache.commons.lang3.StringUtils.isBlank;
import static org.apache.commons.lang3.StringUtils.split;
import static org.apache.commons.lang3.StringUtils.trimToNull;

import java.net.MalformedURLException;
import java.net.URL;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.springframework.core.env.ConfigurableEnvironment;
import org.springframework.core.env.EnumerablePropertySource;
import org.springframework.core.env.PropertySource;

import uk.ac.manchester.cs.taskengine.config.BackendConfig;
import uk.ac.manchester.cs.taskengine.config.BackendKind;
import uk.ac.manchester.cs.taskengine.config.DockerBackendConfig;
import uk.ac.manchester.cs.taskengine.config.GenericBackendConfig;
import uk.ac.manchester.cs.taskengine.config.GenericBackendConfig.CommandLocale;
import uk.ac.manchester.cs.taskengine.config.GenericBackendConfig.Shell;
import uk.ac.manchester.cs.taskengine.config.TesBackendConfig;
import uk.ac.manchester.cs.taskengine.config.TesBackendConfig.AuthType;
import uk.ac.manchester.cs.taskengine.errors.BackendInitException;
import uk.ac.manchester.cs.taskengine.task.Resources;

/**
 * Reads backend configurations out of the environment's properties. Backends
 * are listed in <tt>taskengine.backends</tt>, and each has its settings under
 * <tt>taskengine.backend.<i>name</i>.</tt>
 */
public class BackendConfigLoader {
	public static final String BACKENDS = "taskengine.backends";
	public static final String PREFIX = "taskengine.backend.";

	private final ConfigurableEnvironment environment;

	public BackendConfigLoader(ConfigurableEnvironment environment) {
		this.environment = environment;
	}

	/**
	 * @return The configuration of each listed backend, in the order listed.
	 * @throws BackendInitException
	 *             If a setting cannot be understood.
	 */
	public List<BackendConfig> load() throws BackendInitException {
		return load(environment.getProperty(BACKENDS, ""));
	}

	/**
	 * @param names
	 *            The backends to read, separated by commas.
	 * @return The configuration of each backend, in the order given.
	 * @throws BackendInitException
	 *             If a setting cannot be understood.
	 */
	public List<BackendConfig> load(String names) throws BackendInitException {
		List<BackendConfig> configs = new ArrayList<>();
		for (String name : split(names, ", "))
			configs.add(loadBackend(name));
		return configs;
	}

	private String get(String name, String key) {
		return trimToNull(environment.getProperty(PREFIX + name + "." + key));
	}

	private String get(String name, String key, String defaultValue) {
		String value = get(name, key);
		return value == null ? defaultValue : value;
	}

	private Double getDouble(String name, String key)
			throws BackendInitException {
		String value = get(name, key);
		if (value == null)
			return null;
		try {
			return Double.valueOf(value);
		} catch (NumberFormatException e) {
			throw new BackendInitException("backend " + name + ": bad " + key
					+ ": " + value, e);
		}
	}

	private Long getLong(String name, String key, long defaultValue)
			throws BackendInitException {
		String value = get(name, key);
		if (value == null)
			return defaultValue;
		try {
			return Long.valueOf(value);
		} catch (NumberFormatException e) {
			throw new BackendInitException("backend " + name + ": bad " + key
					+ ": " + value, e);
		}
	}

	private int getInt(String name, String key, int defaultValue)
			throws BackendInitException {
		return getLong(name, key, defaultValue).intValue();
	}

	private URL getUrl(String name, String key) throws BackendInitException {
		String value = get(name, key);
		if (value == null)
			return null;
		try {
			return new URL(value);
		} catch (MalformedURLException e) {
			throw new BackendInitException("backend " + name + ": bad " + key
					+ ": " + value, e);
		}
	}

	private <E extends Enum<E>> E getEnum(String name, String key,
			Class<E> type, E defaultValue) throws BackendInitException {
		String value = get(name, key);
		if (value == null)
			return defaultValue;
		try {
			return Enum.valueOf(type, value.toUpperCase(Locale.ROOT));
		} catch (IllegalArgumentException e) {
			throw new BackendInitException("backend " + name + ": bad " + key
					+ ": " + value, e);
		}
	}

	BackendConfig loadBackend(String name) throws BackendInitException {
		String kind = get(name, "kind");
		if (isBlank(kind))
			throw new BackendInitException("backend " + name
					+ ": no kind given");
		BackendConfig config;
		try {
			switch (BackendKind.parse(kind)) {
			case DOCKER:
				config = docker(name);
				break;
			case GENERIC:
				config = generic(name);
				break;
			case TES:
				config = tes(name);
				break;
			default:
				throw new BackendInitException("backend " + name
						+ ": unsupported kind " + kind);
			}
		} catch (IllegalArgumentException e) {
			throw new BackendInitException("backend " + name
					+ ": unknown kind " + kind, e);
		}
		config.setName(name);
		config.setMaxTasks(getInt(name, "maxTasks", 0));
		Resources defaults = Resources.builder()
				.cpu(getDouble(name, "defaults.cpu"))
				.ram(getDouble(name, "defaults.ram"))
				.disk(getDouble(name, "defaults.disk")).build();
		config.setDefaults(defaults);
		return config;
	}

	private DockerBackendConfig docker(String name)
			throws BackendInitException {
		DockerBackendConfig config = new DockerBackendConfig();
		config.setUrl(getUrl(name, "url"));
		config.setCleanup(Boolean.parseBoolean(get(name, "cleanup", "true")));
		config.setRetries(getInt(name, "retries", 0));
		return config;
	}

	private GenericBackendConfig generic(String name)
			throws BackendInitException {
		GenericBackendConfig config = new GenericBackendConfig();
		config.setSubmit(get(name, "submit"));
		config.setMonitor(get(name, "monitor"));
		config.setKill(get(name, "kill"));
		config.setJobIdRegex(get(name, "jobIdRegex"));
		config.setMonitorFrequency(getLong(name, "monitorFrequency",
				GenericBackendConfig.DEFAULT_MONITOR_FREQUENCY));
		config.setLocale(getEnum(name, "locale", CommandLocale.class,
				CommandLocale.LOCAL));
		config.setShell(getEnum(name, "shell", Shell.class, Shell.BASH));
		config.setSshHost(get(name, "ssh.host"));
		config.setSshPort(getInt(name, "ssh.port",
				GenericBackendConfig.DEFAULT_SSH_PORT));
		config.setSshUsername(get(name, "ssh.username"));
		config.setSshMaxAttempts(getInt(name, "ssh.maxAttempts",
				GenericBackendConfig.DEFAULT_SSH_MAX_ATTEMPTS));
		config.setSshStrictHostKeyChecking(get(name,
				"ssh.strictHostKeyChecking", "yes"));
		config.setAttributes(attributes(name));
		return config;
	}

	/** Collects every <tt>attributes.<i>key</i></tt> setting of a backend. */
	private Map<String, String> attributes(String name) {
		String prefix = PREFIX + name + ".attributes.";
		Map<String, String> attributes = new LinkedHashMap<>();
		for (PropertySource<?> source : environment.getPropertySources()) {
			if (!(source instanceof EnumerablePropertySource))
				continue;
			for (String key : ((EnumerablePropertySource<?>) source)
					.getPropertyNames())
				if (key.startsWith(prefix)
						&& !attributes.containsKey(key.substring(prefix
								.length())))
					attributes.put(key.substring(prefix.length()),
							environment.getProperty(key));
		}
		return attributes;
	}

	private TesBackendConfig tes(String name) throws BackendInitException {
		TesBackendConfig config = new TesBackendConfig();
		config.setUrl(getUrl(name, "url"));
		config.setAuthType(getEnum(name, "auth.type", AuthType.class,
				AuthType.NONE));
		config.setUsername(get(name, "auth.username"));
		config.setPassword(get(name, "auth.password"));
		config.setToken(get(name, "auth.token"));
		config.setPollInterval(getLong(name, "pollInterval",
				TesBackendConfig.DEFAULT_POLL_INTERVAL));
		config.setRetries(getInt(name, "retries",
				TesBackendConfig.DEFAULT_RETRIES));
		return config;
	}
}
