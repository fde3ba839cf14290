package in.tradewell.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Trading plan for one session, read from the plan file.
 *
 * Scanner and strategy sections are kept as raw JSON: their schema belongs to
 * the worker implementations, the orchestrator only forwards them.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TradingPlan(
    @JsonProperty("skipExisting")
    boolean skipExisting,           // ignore broker positions when building the universe

    @JsonProperty("testScanners")
    boolean testScanners,           // scanners-only mode

    @JsonProperty("bypassMarketSchedule")
    boolean bypassMarketSchedule,

    @JsonProperty("workerCount")
    int workerCount,                // 0 = estimate from host load

    @JsonProperty("cpuFactor")
    Double cpuFactor,

    @JsonProperty("warmUpMaxSymbols")
    Integer warmUpMaxSymbols,

    @JsonProperty("scanTargets")
    List<String> scanTargets,

    @JsonProperty("scanners")
    Map<String, JsonNode> scanners,

    @JsonProperty("strategies")
    Map<String, JsonNode> strategies
) {
    public TradingPlan {
        scanTargets = scanTargets == null ? List.of() : List.copyOf(scanTargets);
        scanners = scanners == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(scanners));
        strategies = strategies == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(strategies));
    }

    public boolean hasScanners() {
        return !scanners.isEmpty();
    }

    public boolean hasStrategies() {
        return !strategies.isEmpty();
    }
}
