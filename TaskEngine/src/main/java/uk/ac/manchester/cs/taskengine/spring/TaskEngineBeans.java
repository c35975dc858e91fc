package uk.ac.manchester.cs.taskengine.spring;

import static org.slf4j.LoggerFactory.getLogger;

import org.slf4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.PropertySource;
import org.springframework.context.support.PropertySourcesPlaceholderConfigurer;
import org.springframework.core.env.ConfigurableEnvironment;

import uk.ac.manchester.cs.taskengine.config.BackendConfig;
import uk.ac.manchester.cs.taskengine.engine.Engine;
import uk.ac.manchester.cs.taskengine.errors.TaskEngineException;

/**
 * Builds an engine with the backends described in
 * <tt>taskengine.properties</tt>.
 */
@Configuration("TaskEngine-beans")
@PropertySource("classpath:/taskengine.properties")
public class TaskEngineBeans {
	private final Logger log = getLogger(getClass());

	@Autowired
	ConfigurableEnvironment environment;
	@Value("${taskengine.backends:}")
	private String backendNames;

	@Bean
	public static PropertySourcesPlaceholderConfigurer propertySourcesPlaceholderConfigurer() {
		return new PropertySourcesPlaceholderConfigurer();
	}

	@Bean
	public BackendConfigLoader backendConfigLoader() {
		return new BackendConfigLoader(environment);
	}

	@Bean(destroyMethod = "close")
	public Engine engine() throws TaskEngineException {
		Engine engine = new Engine();
		try {
			for (BackendConfig config : backendConfigLoader().load(
					backendNames))
				engine.register(config);
		} catch (TaskEngineException e) {
			engine.close();
			throw e;
		}
		log.info("task engine ready with backends " + engine.runners());
		return engine;
	}
}
