package com.smartstream.transform.service;

import com.smartstream.transform.model.LakeLayout;
import com.smartstream.transform.model.Route;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TrustedKeyGeneratorTest {

    private static final Route TRANSACTIONS = new Route("finance", "transactions");
    private static final Route EMPLOYEES = new Route("hr", "employees");

    private final TrustedKeyGenerator generator =
            new TrustedKeyGenerator(new LakeLayout("lake", "raw/", "trusted/", "analytics/"));

    @Test
    void mirrorsRawPathUnderRouteDirectories() {
        assertThat(generator.trustedKey("raw/year=2026/month=02/day=07/file.gz", TRANSACTIONS))
                .isEqualTo("trusted/finance/transactions/year=2026/month=02/day=07/file.json");
    }

    @Test
    void keepsJsonSuffixAndAddsItWhenMissing() {
        assertThat(generator.trustedKey("raw/a/file.json", EMPLOYEES)).isEqualTo("trusted/hr/employees/a/file.json");
        assertThat(generator.trustedKey("raw/a/file", EMPLOYEES)).isEqualTo("trusted/hr/employees/a/file.json");
        assertThat(generator.trustedKey("raw/a/file.json.gz", EMPLOYEES)).isEqualTo("trusted/hr/employees/a/file.json");
    }

    @Test
    void isDeterministic() {
        assertThat(generator.trustedKey("raw/a/file.json", EMPLOYEES))
                .isEqualTo(generator.trustedKey("raw/a/file.json", EMPLOYEES));
    }

    @Test
    void separatesRoutesOfSameSource() {
        assertThat(generator.trustedKey("raw/a/file.json", EMPLOYEES))
                .isNotEqualTo(generator.trustedKey("raw/a/file.json", TRANSACTIONS));
    }

    @Test
    void neverPointsBackIntoRawZone() {
        assertThat(generator.trustedKey("raw/a/file.json", EMPLOYEES)).doesNotStartWith("raw/");
        assertThat(generator.trustedKey("other/file.json", EMPLOYEES)).isEqualTo("trusted/hr/employees/other/file.json");
    }

    @Test
    void rejectsBlankKey() {
        assertThatThrownBy(() -> generator.trustedKey(" ", EMPLOYEES)).isInstanceOf(IllegalArgumentException.class);
    }
}
