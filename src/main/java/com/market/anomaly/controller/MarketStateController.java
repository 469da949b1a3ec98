package com.market.anomaly.controller;

import com.market.anomaly.model.MarketState;
import com.market.anomaly.service.StateManager;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/market-state")
@Tag(name = "Market State", description = "Aggregated market status and sentiment score")
public class MarketStateController {

    private final StateManager stateManager;

    public MarketStateController(StateManager stateManager) {
        this.stateManager = stateManager;
    }

    @GetMapping
    @Operation(summary = "Get the current market state")
    public ResponseEntity<MarketState> getCurrentState() {
        return ResponseEntity.ok(stateManager.current());
    }

    @GetMapping("/history")
    @Operation(summary = "Get prior market states",
               description = "Returns the states preceding the current one, newest last")
    public ResponseEntity<List<MarketState>> getHistory(
            @Parameter(description = "Max number of states to return", example = "50")
            @RequestParam(defaultValue = "100") int limit) {
        if (limit <= 0) {
            return ResponseEntity.badRequest().build();
        }
        List<MarketState> history = stateManager.stateHistory();
        int from = Math.max(0, history.size() - limit);
        return ResponseEntity.ok(history.subList(from, history.size()));
    }
}
