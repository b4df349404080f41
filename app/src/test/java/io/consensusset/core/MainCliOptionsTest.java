package io.consensusset.core;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class MainCliOptionsTest {

    @Test
    void parsesDefaults() {
        Main.CliOptions options = Main.CliOptions.parse(new String[] {});
        assertFalse(options.showHelp());
        assertNull(options.errorMessage());
        assertFalse(options.inMemory());
        assertFalse(options.consistencyChecks());
        if (System.getenv("CONSENSUS_DATA_DIR") == null) {
            assertEquals(Path.of("./data/consensus").normalize(), options.dataDir().normalize());
        }
    }

    @Test
    void parsesFlags() {
        Main.CliOptions options = Main.CliOptions.parse(new String[] {
                "--data-dir=/tmp/cs",
                "--config=conf/node.json",
                "--in-memory",
                "--consistency-checks"
        });
        assertFalse(options.showHelp());
        assertEquals(Path.of("/tmp/cs"), options.dataDir());
        assertEquals(Path.of("conf/node.json"), options.configFile());
        assertTrue(options.inMemory());
        assertTrue(options.consistencyChecks());
    }

    @Test
    void positionalArgumentIsDataDir() {
        Main.CliOptions options = Main.CliOptions.parse(new String[] {"chaindata"});
        assertEquals(Path.of("chaindata"), options.dataDir());
    }

    @Test
    void unknownOptionShowsHelpWithError() {
        Main.CliOptions options = Main.CliOptions.parse(new String[] {"--mine"});
        assertTrue(options.showHelp());
        assertEquals("Unknown option: --mine", options.errorMessage());
    }

    @Test
    void emptyConfigPathIsAnError() {
        Main.CliOptions options = Main.CliOptions.parse(new String[] {"--config="});
        assertTrue(options.showHelp());
        assertNotNull(options.errorMessage());
    }

    @Test
    void helpDescribesEnvironmentAsDefaults() {
        PrintStream original = System.out;
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
        try {
            Main.CliOptions.parse(new String[] {"--help"}).printHelp();
        } finally {
            System.setOut(original);
        }
        String help = out.toString(StandardCharsets.UTF_8);
        assertTrue(help.contains("CONSENSUS_DATA_DIR         Default for --data-dir"));
        assertFalse(help.contains("Override --data-dir"));
    }

    @Test
    void dataDirFlagWinsOverEnvironmentDefault() {
        Main.CliOptions options = Main.CliOptions.parse(new String[] {"--data-dir=/tmp/explicit"});
        assertEquals(Path.of("/tmp/explicit"), options.dataDir());
    }
}
