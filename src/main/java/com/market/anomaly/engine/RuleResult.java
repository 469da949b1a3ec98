package com.market.anomaly.engine;

import com.market.anomaly.model.EventLevel;
import com.market.anomaly.model.EventSubtype;
import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.Map;

@Value
@Builder
public class RuleResult {

    EventSubtype subtype;

    boolean triggered;

    // null unless triggered
    EventLevel level;

    // metric snapshot that triggered the rule, insertion ordered
    @Builder.Default
    Map<String, Object> data = Collections.emptyMap();

    String reason;

    public static RuleResult notTriggered(EventSubtype subtype, String reason) {
        return RuleResult.builder()
                .subtype(subtype)
                .triggered(false)
                .reason(reason)
                .build();
    }
}
