package io.github.thunderz99.pgcronner.util;

import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinition;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.parser.CronParser;
import org.apache.commons.lang3.StringUtils;

/**
 * A simple util class used to check a cron expression is valid or not
 */
public class CronUtil {

    /**
     * pg_cron uses a 5-field Unix cron format: minute, hour, day of month, month, day of week.
     */
    public static final int FIELD_COUNT = 5;

    static final CronDefinition unixDefinition = CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX);

    CronUtil() {
    }

    /**
     * Validate a cron expression and return the reason it is rejected.
     *
     * @param expression a cron expression
     * @return null if the expression is valid, otherwise a short reason
     */
    public static String describeError(String expression) {
        if (StringUtils.isBlank(expression)) {
            return "schedule should be non-blank";
        }

        var fields = StringUtils.split(expression.trim());
        if (fields.length != FIELD_COUNT) {
            return "schedule should have exactly %d fields but has %d: %s".formatted(FIELD_COUNT, fields.length, expression);
        }

        try {
            var cron = new CronParser(unixDefinition).parse(normalize(expression));
            // throws if any field is out of range
            cron.validate();
            return null;
        } catch (RuntimeException e) {
            return "schedule is not a valid cron expression: %s (%s)".formatted(expression, e.getMessage());
        }
    }

    /**
     * Trim and collapse the whitespace between fields, so that "*&#47;5  * * * * " and "*&#47;5 * * * *" compare equal.
     *
     * @param expression a cron expression
     * @return normalized expression, or null if the input is null
     */
    public static String normalize(String expression) {
        if (expression == null) {
            return null;
        }
        return String.join(" ", StringUtils.split(expression.trim()));
    }

}
