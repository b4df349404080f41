package io.consensusset.core;

import io.consensusset.core.consensus.ConsensusSet;
import io.consensusset.core.metrics.ConsensusMetrics;
import io.consensusset.core.node.Node;
import io.consensusset.core.node.NodeConfig;
import io.consensusset.core.protocol.Block;
import io.consensusset.core.state.LedgerSnapshot;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Logger;

/**
 * Opens (or initializes) a node's consensus state and reports where it stands.
 */
public final class Main {
    private static final Logger LOG = Logger.getLogger(Main.class.getName());

    private Main() {}

    public static void main(String[] args) throws Exception {
        CliOptions options = CliOptions.parse(args);
        if (options.showHelp()) {
            options.printHelp();
            if (options.errorMessage() != null) {
                System.exit(1);
            }
            return;
        }

        NodeConfig config = options.configFile() != null
                ? NodeConfig.load(options.configFile())
                : NodeConfig.defaultLocal();
        if (options.consistencyChecks()) {
            config = config.withConsistencyChecks(true);
        }

        Node node;
        if (options.inMemory()) {
            node = Node.inMemory(config);
        } else {
            Path dataPath = options.dataDir().toAbsolutePath().normalize();
            Files.createDirectories(dataPath);
            node = Node.rocks(config, dataPath.toString());
        }

        try {
            ConsensusSet consensus = node.start();
            LedgerSnapshot snapshot = consensus.snapshot();
            Block tip = consensus.currentBlock();
            LOG.info("Height " + snapshot.height() + ", tip " + tip.id().hex());
            LOG.info("Siacoin outputs=" + snapshot.siacoinOutputs().size()
                    + " siafund outputs=" + snapshot.siafundOutputs().size()
                    + " file contracts=" + snapshot.fileContracts().size()
                    + " maturity buckets=" + snapshot.delayedSiacoinOutputs().size()
                    + " siafund pool=" + snapshot.siafundPool());
            System.out.print(ConsensusMetrics.scrapeMetrics());
        } finally {
            node.close();
        }
    }

    static record CliOptions(
            boolean showHelp,
            String errorMessage,
            Path dataDir,
            Path configFile,
            boolean inMemory,
            boolean consistencyChecks
    ) {
        static CliOptions parse(String[] args) {
            Path dataDir = envPath("CONSENSUS_DATA_DIR", Path.of("./data/consensus"));
            Path configFile = envPath("CONSENSUS_CONFIG", null);
            boolean inMemory = false;
            boolean checks = false;
            boolean showHelp = false;
            String error = null;

            if (args != null) {
                for (String arg : args) {
                    if (arg == null || arg.isBlank()) {
                        continue;
                    }
                    if ("--help".equals(arg) || "-h".equals(arg)) {
                        showHelp = true;
                    } else if (arg.startsWith("--data-dir=")) {
                        dataDir = Path.of(arg.substring("--data-dir=".length()));
                    } else if (arg.startsWith("--config=")) {
                        String value = arg.substring("--config=".length());
                        if (value.isBlank()) {
                            showHelp = true;
                            error = "--config requires a file path";
                        } else {
                            configFile = Path.of(value);
                        }
                    } else if (arg.equals("--in-memory")) {
                        inMemory = true;
                    } else if (arg.equals("--consistency-checks")) {
                        checks = true;
                    } else if (!arg.startsWith("--")) {
                        dataDir = Path.of(arg);
                    } else if (error == null) {
                        showHelp = true;
                        error = "Unknown option: " + arg;
                    }
                }
            }

            return new CliOptions(showHelp, error, dataDir, configFile, inMemory, checks);
        }

        void printHelp() {
            if (errorMessage != null) {
                System.err.println("Error: " + errorMessage);
            }
            System.out.println("""
Usage: consensus-ledger [options] [data-dir]

Options:
  --help, -h                 Show this help message and exit
  --data-dir=<path>          Path for consensus data (default ./data/consensus)
  --config=<file>            JSON file overriding consensus constants and genesis allocations
  --in-memory                Keep everything in memory; nothing is written to disk
  --consistency-checks       Verify ledger invariants after every block (slow)

Environment overrides:
  CONSENSUS_DATA_DIR         Default for --data-dir
  CONSENSUS_CONFIG           Default for --config
""");
        }

        private static Path envPath(String key, Path fallback) {
            String value = System.getenv(key);
            return (value == null || value.isBlank()) ? fallback : Path.of(value);
        }
    }
}
