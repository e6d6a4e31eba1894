package io.github.thunderz99.pgcronner.util;

import org.apache.commons.lang3.StringUtils;

/**
 * Checks the table names that are concatenated into SQL text (table names can not be bound as parameters).
 */
public class SqlIdentifierUtil {

    /**
     * postgres identifier length limit
     */
    static final int MAX_LENGTH = 63;

    SqlIdentifierUtil() {
    }

    /**
     * Check if the given table name is valid. And then normalize(to lower case) the name.
     *
     * <p>
     * A schema qualified name("myschema.pgcronner_jobs") is allowed.
     * </p>
     *
     * @param tableName the name of the table
     * @return the normalized(to lower case) name
     */
    public static String checkAndNormalizeTableName(String tableName) {
        Checker.checkNotBlank(tableName, "tableName");

        var normalized = StringUtils.lowerCase(tableName.trim());

        for (var part : StringUtils.splitPreserveAllTokens(normalized, '.')) {
            Checker.check(isSimpleIdentifier(part), "tableName should only contain [a-z0-9_] and start with a letter or '_': " + tableName);
            Checker.check(part.length() <= MAX_LENGTH, "tableName should not be longer than %d characters: %s".formatted(MAX_LENGTH, tableName));
        }
        Checker.check(StringUtils.countMatches(normalized, '.') <= 1, "tableName should be 'table' or 'schema.table': " + tableName);

        return normalized;
    }

    static boolean isSimpleIdentifier(String part) {
        return part.matches("[a-z_][a-z0-9_]*");
    }
}
