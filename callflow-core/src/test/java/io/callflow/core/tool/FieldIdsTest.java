package io.callflow.core.tool;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

public class FieldIdsTest {

    @ParameterizedTest
    @CsvSource({
        "3f2a-11ee-b962, 3f2a_11ee_b962",
        "email address!, email_address_",
        "a--b, a_b",
        "first..last, first.last",
        "user@domain.com, user@domain.com",
        "x - y, x_y"
    })
    void sanitizesForPlatformKeys(String raw, String expected) {
        assertThat(FieldIds.sanitize(raw)).isEqualTo(expected);
    }
}
