package io.github.thunderz99.pgcronner.util;

import java.io.IOException;
import java.io.InputStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.annotation.JsonAutoDetect.Visibility;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Simple Json reader based on jackson. Reads the job manifests into the public-field dto classes.
 *
 * @author thunderz99
 *
 */
public class JsonUtil {

	private static ObjectMapper mapper = new ObjectMapper();

	JsonUtil() {
	}

	static {
		mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false) //
				.setVisibility(PropertyAccessor.FIELD, Visibility.ANY);
	}

	private static final Logger log = LoggerFactory.getLogger(JsonUtil.class);

	/**
	 * Read json from a stream. The stream is closed afterwards.
	 *
	 * @param is      json input
	 * @param typeRef target type
	 * @return the parsed object
	 * @throws IllegalArgumentException if the json is malformed or can not be read
	 */
	public static <T> T fromJson(InputStream is, TypeReference<T> typeRef) {
		try (is) {
			return mapper.readValue(is, typeRef);
		} catch (IOException e) {
			log.error("json read error: ", e);
			throw new IllegalArgumentException("json process error. type: " + typeRef.getType(), e);
		}
	}

}
