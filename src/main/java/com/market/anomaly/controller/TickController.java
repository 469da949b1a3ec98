package com.market.anomaly.controller;

import com.market.anomaly.model.Tick;
import com.market.anomaly.model.TickResult;
import com.market.anomaly.service.MarketPipeline;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/ticks")
@Tag(name = "Ticks", description = "Feed market samples into the detection pipeline")
public class TickController {

    private static final int MAX_REPLAY_TICKS = 10_000;

    private final MarketPipeline pipeline;

    public TickController(MarketPipeline pipeline) {
        this.pipeline = pipeline;
    }

    @Operation(summary = "Process a tick",
            description = "Ingests the samples of one tick, evaluates all rules for the instruments it touches " +
                    "and returns the detected events, emitted notifications and resulting market state. " +
                    "Malformed or out-of-order samples are listed under `rejected`; their instrument is not evaluated.")
    @PostMapping
    public ResponseEntity<?> processTick(@RequestBody Tick tick) {
        if (tick.getSamples() == null || tick.getSamples().isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Tick has no samples", "field", "samples"));
        }
        // through the ingestion lane, so REST ticks queue behind submitted ones
        TickResult result = pipeline.submit(tick).join();
        return ResponseEntity.ok(result);
    }

    @Operation(summary = "Replay a backlog of ticks",
            description = "Processes the ticks in the given order. Instruments already processed at a timestamp " +
                    "are skipped, so replaying the same backlog twice yields no new events.")
    @PostMapping("/replay")
    public ResponseEntity<?> replay(@RequestBody List<Tick> ticks) {
        if (ticks.size() > MAX_REPLAY_TICKS) {
            return ResponseEntity.badRequest().body(Map.of(
                    "error", "Replay backlog exceeds " + MAX_REPLAY_TICKS + " ticks", "field", "ticks"));
        }
        List<TickResult> results = pipeline.replay(ticks);
        return ResponseEntity.ok(results);
    }
}
