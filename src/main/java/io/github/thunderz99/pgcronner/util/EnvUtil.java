package io.github.thunderz99.pgcronner.util;

import java.time.Duration;

import io.github.cdimascio.dotenv.Dotenv;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;

/**
 * A simple util to get env variables from System's Environment variables or .env file
 */
public class EnvUtil {

    static Dotenv dotenv = Dotenv.configure().ignoreIfMalformed().ignoreIfMissing().load();

    EnvUtil() {
    }

    /**
     * get env variable as String
     * @param envName env variable name
     * @return env variable value
     */
    public static String get(String envName) {
        var value = System.getenv(envName);
        if (StringUtils.isEmpty(value)) {
            value = dotenv.get(envName);
        }
        return value;
    }

    /**
     * get env variable as a duration in seconds, or return a default value when missing or not a positive number.
     *
     * @param envName      env variable name
     * @param defaultValue default value
     * @return duration
     */
    public static Duration getSecondsOrDefault(String envName, Duration defaultValue) {
        var seconds = NumberUtils.toLong(get(envName), -1L);
        return seconds > 0 ? Duration.ofSeconds(seconds) : defaultValue;
    }
}
