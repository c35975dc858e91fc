package uk.ac.manchester.cs.taskengine.config;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.fail;

import java.net.URL;

import org.junit.Test;

import uk.ac.manchester.cs.taskengine.config.GenericBackendConfig.CommandLocale;
import uk.ac.manchester.cs.taskengine.config.TesBackendConfig.AuthType;
import uk.ac.manchester.cs.taskengine.errors.BackendInitException;

public class BackendConfigTest {
	private static GenericBackendConfig generic() {
		GenericBackendConfig config = new GenericBackendConfig();
		config.setName("g");
		config.setMaxTasks(1);
		config.setSubmit("sbatch --wrap ~{command}");
		return config;
	}

	private static void assertInvalid(BackendConfig config) {
		try {
			config.validate();
			fail("expected " + config + " to be rejected");
		} catch (BackendInitException e) {
			// expected
		}
	}

	@Test
	public void minimalGenericIsValid() throws Exception {
		generic().validate();
	}

	@Test
	public void needsNameAndPositiveMaxTasks() {
		GenericBackendConfig config = generic();
		config.setName(" ");
		assertInvalid(config);
		config = generic();
		config.setMaxTasks(0);
		assertInvalid(config);
	}

	@Test
	public void jobIdPatternNeedsMonitorAndKill() throws Exception {
		GenericBackendConfig config = generic();
		config.setJobIdRegex("Submitted batch job (\\d+)");
		assertInvalid(config);
		config.setMonitor("squeue -j ~{job_id}");
		assertInvalid(config);
		config.setKill("scancel ~{job_id}");
		config.validate();
		assertEquals("123", config.compileJobIdRegex()
				.matcher("Submitted batch job 123").replaceAll("$1"));
	}

	@Test
	public void badPatternIsRejected() {
		GenericBackendConfig config = generic();
		config.setJobIdRegex("(unclosed");
		config.setMonitor("m");
		config.setKill("k");
		assertInvalid(config);
	}

	@Test
	public void sshNeedsHost() {
		GenericBackendConfig config = generic();
		config.setLocale(CommandLocale.SSH);
		assertInvalid(config);
	}

	@Test
	public void noPatternMeansSynchronous() throws Exception {
		assertNull(generic().compileJobIdRegex());
	}

	@Test
	public void monitorFrequencyIsInSeconds() {
		GenericBackendConfig config = generic();
		assertEquals(5000, config.getMonitorInterval());
		config.setMonitorFrequency(2);
		assertEquals(2000, config.getMonitorInterval());
	}

	@Test
	public void tesNeedsHttpUrlAndAuthDetails() throws Exception {
		TesBackendConfig config = new TesBackendConfig();
		config.setName("t");
		config.setMaxTasks(1);
		assertInvalid(config);
		config.setUrl(new URL("ftp://example.org/"));
		assertInvalid(config);
		config.setUrl(new URL("https://example.org/ga4gh/tes/v1"));
		config.validate();
		config.setAuthType(AuthType.BEARER);
		assertInvalid(config);
		config.setToken("secret");
		config.validate();
		config.setAuthType(AuthType.BASIC);
		config.setUsername("user");
		assertInvalid(config);
		config.setPassword("pass");
		config.validate();
	}

	@Test
	public void kindsParseInAnyCase() {
		assertEquals(BackendKind.DOCKER, BackendKind.parse("Docker"));
		assertEquals(BackendKind.TES, BackendKind.parse(" tes "));
	}
}
