package io.github.thunderz99.pgcronner.util;

import java.time.Duration;
import java.util.Collection;

import org.apache.commons.lang3.StringUtils;

/**
 * A util class to check if some conditions are met. If not, throw IllegalArgumentException
 *
 */
public class Checker {

	Checker(){
	}

	/**
	 * Check if the result is true. If not, throw IllegalArgumentException with message
	 * @param result
	 * @param message
	 */
	public static void check(boolean result, String message) {

		if (!result) {
			throw new IllegalArgumentException(message);
		}

	}

	/**
	 * Check if the target is not null. If null, throw IllegalArgumentException with name
	 * @param target
	 * @param name
	 * @return target
	 */
	public static <T> T checkNotNull(T target, String name) {

		if (target == null) {
			throw new IllegalArgumentException(String.format("%s should not be null", name));
		}

		return target;

	}

	/**
	 * Check if the target is not blank. If blank, throw IllegalArgumentException with name
	 * @param target
	 * @param name
	 * @return target
	 */
	public static String checkNotBlank(String target, String name) {

		if (StringUtils.isBlank(target)) {
			throw new IllegalArgumentException(String.format("%s should be non-blank", name));
		}

		return target;

	}

	/**
	 * Check if the duration is positive. Used for the timeouts passed to remote calls.
	 * @param target
	 * @param name
	 * @return target
	 */
	public static Duration checkPositive(Duration target, String name) {

		if (target == null || target.isZero() || target.isNegative()) {
			throw new IllegalArgumentException(String.format("%s should be a positive duration", name));
		}

		return target;
	}

	/**
	 * Check if none of the collection's elements is null.
	 * @param target
	 * @param name
	 * @return target
	 */
	public static <T> Collection<T> checkNoNullElements(Collection<T> target, String name) {

		checkNotNull(target, name);
		if (target.stream().anyMatch(e -> e == null)) {
			throw new IllegalArgumentException(String.format("%s should not contain null elements", name));
		}

		return target;
	}
}
