package io.github.sachinnimbal.filmes.core.enums;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class LengthCategoryTest {

    @ParameterizedTest
    @CsvSource({
            "70, SHORT",
            "89, SHORT",
            "90, FEATURE",
            "150, FEATURE",
            "151, EPIC",
            "600, EPIC"
    })
    void classifiesByDuration(int minutes, LengthCategory expected) {
        assertThat(LengthCategory.of(minutes)).isEqualTo(expected);
    }
}
