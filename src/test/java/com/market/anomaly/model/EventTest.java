package com.market.anomaly.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Locale;

import static com.market.anomaly.testutil.TestDataFactory.*;
import static org.assertj.core.api.Assertions.assertThat;

class EventTest {

    private Locale defaultLocale;

    @BeforeEach
    void setUp() {
        defaultLocale = Locale.getDefault();
        // dotless i when lower-casing "I"
        Locale.setDefault(new Locale("tr", "TR"));
    }

    @AfterEach
    void tearDown() {
        Locale.setDefault(defaultLocale);
    }

    @Test
    void idFor_isIndependentOfDefaultLocale() {
        assertThat(Event.idFor(T0, "NORTH", EventSubtype.FLOW_WITHDRAWAL))
                .isEqualTo("evt-" + T0 + "-NORTH-flow_withdrawal");
    }

    @Test
    void json_codesAreIndependentOfDefaultLocale() throws Exception {
        Event event = createEvent(T0, "SSE", EventSubtype.SENTIMENT_TURNING_UP, EventLevel.MEDIUM);

        String json = new ObjectMapper().writeValueAsString(event);

        assertThat(json).contains("\"subtype\":\"sentiment_turning_up\"", "\"level\":\"medium\"",
                "\"type\":\"ANOMALY_DETECTION\"");
    }
}
