package uk.ac.manchester.cs.taskengine.rest.utils;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;

public class CustomJacksonJsonProviderTest {
	public static class Sample {
		public Integer cpuCores;
		public String skipped;
		@JsonProperty("Image")
		public String image;
	}

	@Test
	public void writesSnakeCaseWithoutNulls() throws Exception {
		ObjectMapper mapper = new CustomJacksonJsonProvider().newMapper();
		Sample sample = new Sample();
		sample.cpuCores = 2;
		sample.image = "alpine";
		String json = mapper.writeValueAsString(sample);
		assertTrue(json.contains("\"cpu_cores\":2"));
		assertTrue(json.contains("\"Image\":\"alpine\""));
		assertFalse(json.contains("skipped"));
	}

	@Test
	public void ignoresUnknownProperties() throws Exception {
		ObjectMapper mapper = new CustomJacksonJsonProvider().newMapper();
		Sample sample = mapper.readValue(
				"{\"cpu_cores\":4,\"unexpected\":true}", Sample.class);
		assertEquals(Integer.valueOf(4), sample.cpuCores);
	}
}
