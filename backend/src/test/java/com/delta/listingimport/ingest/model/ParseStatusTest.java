package com.delta.listingimport.ingest.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ParseStatusTest {

    @Test
    void allowsOnlyForwardTransitions() {
        assertThat(ParseStatus.PENDING.canTransitionTo(ParseStatus.QUICK_PARSING)).isTrue();
        assertThat(ParseStatus.PENDING.canTransitionTo(ParseStatus.FULL_PARSING)).isTrue();
        assertThat(ParseStatus.QUICK_PARSED.canTransitionTo(ParseStatus.FULL_PARSING)).isTrue();
        assertThat(ParseStatus.PARSED.canTransitionTo(ParseStatus.IMPORTED)).isTrue();

        assertThat(ParseStatus.PENDING.canTransitionTo(ParseStatus.PARSED)).isFalse();
        assertThat(ParseStatus.PARSED.canTransitionTo(ParseStatus.FULL_PARSING)).isFalse();
        assertThat(ParseStatus.QUICK_PARSING.canTransitionTo(ParseStatus.FULL_PARSING)).isFalse();
        assertThat(ParseStatus.PENDING.canTransitionTo(null)).isFalse();
    }

    @Test
    void importedAndFailedAreTerminal() {
        assertThat(ParseStatus.IMPORTED.isTerminal()).isTrue();
        assertThat(ParseStatus.FAILED.isTerminal()).isTrue();
        assertThat(ParseStatus.FAILED.canTransitionTo(ParseStatus.PENDING)).isFalse();
        assertThat(ParseStatus.PARSED.isTerminal()).isFalse();
    }

    @Test
    void everyNonTerminalStatusCanFail() {
        for (ParseStatus status : ParseStatus.values()) {
            if (!status.isTerminal()) {
                assertThat(status.allowedNext()).contains(ParseStatus.FAILED);
            }
        }
    }

    @Test
    void serializesAsLowercaseCode() throws Exception {
        ObjectMapper mapper = new ObjectMapper();

        assertThat(mapper.writeValueAsString(ParseStatus.QUICK_PARSED)).isEqualTo("\"quick_parsed\"");
        assertThat(mapper.readValue("\"full_parsing\"", ParseStatus.class)).isEqualTo(ParseStatus.FULL_PARSING);
    }
}
