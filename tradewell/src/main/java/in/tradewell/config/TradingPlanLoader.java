package in.tradewell.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Reads the trading plan from {@code <folder>/<filename>}.
 */
public final class TradingPlanLoader {
    private static final Logger log = LoggerFactory.getLogger(TradingPlanLoader.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private TradingPlanLoader() {}

    /**
     * @throws ConfigurationException if the file is missing or not a valid plan
     */
    public static TradingPlan load(String folder, String filename) {
        Path planPath = Paths.get(folder, filename);
        if (!Files.isRegularFile(planPath)) {
            throw new ConfigurationException("Trading plan not found: " + planPath.toAbsolutePath());
        }
        try {
            TradingPlan plan = MAPPER.readValue(Files.readString(planPath), TradingPlan.class);
            log.info("Loaded trading plan from {}: {} scanners, {} strategies, {} scan targets",
                planPath, plan.scanners().size(), plan.strategies().size(), plan.scanTargets().size());
            return plan;
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read trading plan " + planPath + ": " + e.getMessage(), e);
        }
    }
}
