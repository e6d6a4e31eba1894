package io.github.thunderz99.pgcronner.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CronUtilTest {

    @Test
    void describeError_should_work() {
        {
            // valid cron expression
            assertThat(CronUtil.describeError("* * * * *")).isNull();
            assertThat(CronUtil.describeError("*/5 * * * *")).isNull();      // every 5 minutes
            assertThat(CronUtil.describeError("0-30 * * * *")).isNull();     // minutes 0-30 every hour
            assertThat(CronUtil.describeError("0,15,30 * * * *")).isNull();  // minutes 0, 15, 30 every hour
            assertThat(CronUtil.describeError("0 3 1 1-6 1-5")).isNull();
            assertThat(CronUtil.describeError("  0 0 * * *  ")).isNull();    // surrounding whitespace
        }

        {
            // invalid cron expression
            assertThat(CronUtil.describeError("60 * * * *")).isNotNull();       // minute 60 is out of range
            assertThat(CronUtil.describeError("* 24 * * *")).isNotNull();       // hour 24 is out of range
            assertThat(CronUtil.describeError("*/1 * * *")).isNotNull();        // only 4 fields
            assertThat(CronUtil.describeError("0 0 12 * * ?")).isNotNull();     // six fields is not supported
            assertThat(CronUtil.describeError("invalid_cron")).isNotNull();
            assertThat(CronUtil.describeError("")).isNotNull();
            assertThat(CronUtil.describeError(null)).isNotNull();
        }
    }

    @Test
    void describeError_should_tell_the_field_count() {
        assertThat(CronUtil.describeError("* * * *")).contains("exactly 5 fields but has 4");
        assertThat(CronUtil.describeError("*/5 * * * *")).isNull();
    }

    @Test
    void normalize_should_collapse_whitespace() {
        assertThat(CronUtil.normalize(" */5  *\t* * * ")).isEqualTo("*/5 * * * *");
        assertThat(CronUtil.normalize(null)).isNull();
    }
}
