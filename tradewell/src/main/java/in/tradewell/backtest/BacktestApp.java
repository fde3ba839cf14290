package in.tradewell.backtest;

import in.tradewell.application.port.output.BacktestPort;
import in.tradewell.domain.backtest.BatchInfo;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Batch backtest driver.
 *
 * <pre>
 * backtest [-b] [-s] [-d SYMBOL]... [BATCH_ID]...
 * </pre>
 * Batches are replayed one after the other through the {@link BacktestPort}
 * registered on the class path.
 */
public final class BacktestApp {
    private static final Logger log = LoggerFactory.getLogger(BacktestApp.class);

    static final String USAGE = "backtest [options] [batch-id...]";

    private BacktestApp() {}

    public static void main(String[] args) {
        System.exit(run(args, loadPort()));
    }

    static int run(String[] args, Optional<BacktestPort> port) {
        Options options = buildOptions();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            System.err.println(e.getMessage());
            new HelpFormatter().printHelp(USAGE, options);
            return 0;
        }

        boolean listBatches = cmd.hasOption("batch-list");
        List<String> batchIds = cmd.getArgList();
        if (!listBatches && batchIds.isEmpty()) {
            new HelpFormatter().printHelp(USAGE, options);
            return 0;
        }
        if (port.isEmpty()) {
            log.error("No {} registered, cannot run backtest", BacktestPort.class.getName());
            return 1;
        }
        BacktestPort backtest = port.get();

        if (listBatches) {
            List<BatchInfo> batches = backtest.listBatches();
            log.info("{} recorded batches", batches.size());
            for (BatchInfo batch : batches) {
                System.out.printf("%s\t%s\t%d symbols%n", batch.batchId(), batch.recordedAt(), batch.symbolCount());
            }
            return 0;
        }

        List<String> debugSymbols = cmd.hasOption("debug-symbol")
            ? Arrays.asList(cmd.getOptionValues("debug-symbol"))
            : List.of();
        boolean strict = cmd.hasOption("strict");
        if (!debugSymbols.isEmpty()) {
            log.info("Debug symbols: {}", debugSymbols);
        }

        for (String batchId : batchIds) {
            log.info("▶ Replaying batch {} (strict={})", batchId, strict);
            try {
                backtest.replay(batchId, debugSymbols, strict);
            } catch (RuntimeException e) {
                log.error("❌ Backtest of batch {} failed: {}", batchId, e.getMessage(), e);
                return 1;
            }
            log.info("✓ Batch {} done", batchId);
        }
        return 0;
    }

    static Options buildOptions() {
        Options options = new Options();
        options.addOption(Option.builder("b").longOpt("batch-list")
            .desc("list recorded batches and exit").build());
        options.addOption(Option.builder("d").longOpt("debug-symbol").hasArg().argName("symbol")
            .desc("focus the replay on this symbol (repeatable)").build());
        options.addOption(Option.builder("s").longOpt("strict")
            .desc("stricter validation of replayed data").build());
        return options;
    }

    private static Optional<BacktestPort> loadPort() {
        Iterator<BacktestPort> ports = ServiceLoader.load(BacktestPort.class).iterator();
        return ports.hasNext() ? Optional.of(ports.next()) : Optional.empty();
    }
}
