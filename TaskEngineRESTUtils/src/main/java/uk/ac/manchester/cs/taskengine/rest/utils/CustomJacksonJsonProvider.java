package uk.ac.manchester.cs.taskengine.rest.utils;

import static com.fasterxml.jackson.annotation.JsonInclude.Include.NON_NULL;
import static com.fasterxml.jackson.databind.DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES;
import static com.fasterxml.jackson.databind.PropertyNamingStrategies.SNAKE_CASE;
import static java.util.Collections.newSetFromMap;
import static javax.ws.rs.core.MediaType.WILDCARD;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.lang.annotation.Annotation;
import java.lang.reflect.Type;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import javax.ws.rs.Consumes;
import javax.ws.rs.Produces;
import javax.ws.rs.core.MediaType;
import javax.ws.rs.core.MultivaluedMap;
import javax.ws.rs.ext.Provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.jaxrs.json.JacksonJsonProvider;

/**
 * JSON binding for the REST clients. Property names are snake case unless a
 * bean says otherwise with an explicit name, unknown properties are ignored and
 * <tt>null</tt>s are not written.
 */
@Provider
@Consumes(WILDCARD)
@Produces(WILDCARD)
public class CustomJacksonJsonProvider extends JacksonJsonProvider {
	private final Set<ObjectMapper> registeredMappers = newSetFromMap(new ConcurrentHashMap<ObjectMapper, Boolean>());
	private final SimpleModule module = new SimpleModule();

	public <T> void addDeserialiser(Class<T> type,
			StdDeserializer<T> deserialiser) {
		module.addDeserializer(type, deserialiser);
	}

	private void registerMapper(Class<?> type, MediaType mediaType) {
		ObjectMapper mapper = locateMapper(type, mediaType);
		if (registeredMappers.add(mapper))
			configure(mapper);
	}

	private void configure(ObjectMapper mapper) {
		mapper.registerModule(module);
		mapper.setPropertyNamingStrategy(SNAKE_CASE);
		mapper.configure(FAIL_ON_UNKNOWN_PROPERTIES, false);
		mapper.setSerializationInclusion(NON_NULL);
	}

	/**
	 * @return A stand-alone mapper configured the same way as the ones this
	 *         provider uses on the wire.
	 */
	public ObjectMapper newMapper() {
		ObjectMapper mapper = new ObjectMapper();
		configure(mapper);
		return mapper;
	}

	@Override
	public Object readFrom(Class<Object> type, Type genericType,
			Annotation[] annotations, MediaType mediaType,
			MultivaluedMap<String, String> httpHeaders, InputStream entityStream)
			throws IOException {
		registerMapper(type, mediaType);
		return super.readFrom(type, genericType, annotations, mediaType,
				httpHeaders, entityStream);
	}

	@Override
	public void writeTo(Object value, Class<?> type, Type genericType,
			Annotation[] annotations, MediaType mediaType,
			MultivaluedMap<String, Object> httpHeaders,
			OutputStream entityStream) throws IOException {
		registerMapper(type, mediaType);
		super.writeTo(value, type, genericType, annotations, mediaType,
				httpHeaders, entityStream);
	}
}
