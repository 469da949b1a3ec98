package com.market.anomaly.engine;

import lombok.Data;

/**
 * Multi-tick state of one rule for one instrument, for rules whose predicate spans
 * several ticks.
 */
@Data
public class RuleMemory {

    // consecutive confirming ticks
    private int streak;

    // a precondition was observed (e.g. a negative flow slope before a reversal)
    private boolean primed;
}
