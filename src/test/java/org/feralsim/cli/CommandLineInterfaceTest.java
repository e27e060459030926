package org.feralsim.cli;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.feralsim.cli.config.LoggingConfigurator;
import org.feralsim.junit.extensions.logging.ExpectLog;
import org.feralsim.junit.extensions.logging.LogLevel;
import org.feralsim.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class CommandLineInterfaceTest {

    @TempDir
    Path tempDir;

    private StringWriter out;
    private CommandLine commandLine;
    private Path configFile;

    @BeforeEach
    void setUp() throws IOException {
        LoggingConfigurator.reset();
        out = new StringWriter();
        commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);
        commandLine.setOut(new PrintWriter(out));
        configFile = tempDir.resolve("feralsim.conf");
        Files.writeString(configFile, """
                simulation { fightLength = 60, workers = 2 }
                logging { default-level = "WARN" }
                """, StandardCharsets.UTF_8);
    }

    @AfterEach
    void tearDown() {
        LoggingConfigurator.reset();
    }

    private int execute(String... args) {
        String[] full = new String[args.length + 2];
        full[0] = "--config";
        full[1] = configFile.toString();
        System.arraycopy(args, 0, full, 2, args.length);
        return commandLine.execute(full);
    }

    @Test
    void run_printsSummaryTable() {
        int exitCode = execute("run", "-n", "4", "--seed", "3");

        assertThat(exitCode).isZero();
        assertThat(out.toString())
                .contains("Trials:     4 (0 failed)")
                .contains("Shred")
                .contains("Bloodlust");
    }

    @Test
    void run_printsJsonSummary() {
        int exitCode = execute("run", "-n", "4", "--format", "json");

        assertThat(exitCode).isZero();
        JsonObject summary = JsonParser.parseString(out.toString()).getAsJsonObject();
        assertThat(summary.get("trials").getAsInt()).isEqualTo(4);
        assertThat(summary.get("meanDps").getAsDouble()).isPositive();
        assertThat(summary.getAsJsonObject("abilities").has("Rip")).isTrue();
    }

    @Test
    void trace_printsCombatLog() {
        int exitCode = execute("trace");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("Melee").contains("DPS over 60.0 s");
    }

    @Test
    void trace_printsJsonLog() {
        int exitCode = execute("trace", "-f", "json");

        assertThat(exitCode).isZero();
        JsonArray entries = JsonParser.parseString(out.toString()).getAsJsonArray();
        assertThat(entries.size()).isPositive();
        assertThat(entries.get(0).getAsJsonObject().has("energy")).isTrue();
    }

    @Test
    void weights_printsCombatWeights() {
        int exitCode = execute("weights", "-n", "4", "--project", "1000");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("Base DPS").contains("1 AP").contains("1 Weapon Damage")
                .doesNotContain("1 mp5");
    }

    @Test
    @ExpectLog(level = LogLevel.ERROR, messagePattern = "Invalid configuration: actor.stamina.*")
    void run_returnsErrorForInvalidConfiguration() throws IOException {
        Files.writeString(configFile, "actor { stamina = 100 }", StandardCharsets.UTF_8);

        assertThat(execute("run", "-n", "2")).isEqualTo(1);
    }

    @Test
    @ExpectLog(level = LogLevel.ERROR, messagePattern = "Invalid configuration: config.file.*")
    void run_returnsErrorForMissingConfigFile() {
        configFile = tempDir.resolve("absent.conf");

        assertThat(execute("run")).isEqualTo(1);
    }

    @Test
    void noSubcommand_printsUsage() {
        assertThat(commandLine.execute("--help")).isZero();
        assertThat(out.toString()).contains("run").contains("weights").contains("trace");
    }
}
