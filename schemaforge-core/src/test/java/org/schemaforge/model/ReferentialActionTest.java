package org.schemaforge.model;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class ReferentialActionTest {

    @ParameterizedTest
    @CsvSource({
            "CASCADE, CASCADE",
            "Cascade, CASCADE",
            "SET_NULL, SET_NULL",
            "SetNull, SET_NULL",
            "Restrict, RESTRICT",
            "NO_ACTION, NO_ACTION",
            "SetDefault, NO_ACTION"
    })
    void fromIdentifier(String identifier, ReferentialAction expected) {
        assertThat(ReferentialAction.fromIdentifier(identifier)).isEqualTo(expected);
    }
}
