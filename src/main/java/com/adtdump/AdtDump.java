package com.adtdump;

import ch.qos.logback.classic.Level;
import com.adtdump.adt.Node;
import com.adtdump.json.GraphJsonParser;
import com.adtdump.output.OutputFormatter;
import com.adtdump.output.PrinterConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.concurrent.Callable;

@Command(name = "adtdump", mixinStandardHelpOptions = true, version = "1.0",
         description = "Print an evaluated configuration graph in compact debug form")
public class AdtDump implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(AdtDump.class);

    @Parameters(index = "0", arity = "0..1", description = "Input graph as JSON (default: stdin)")
    private File inputFile;

    @Option(names = {"-r", "--raw"}, description = "Print the conjuncts of each vertex instead of its value")
    private boolean raw = false;

    @Option(names = {"-e", "--expect"}, paramLabel = "FILE",
            description = "Compare the output with a golden file and fail on mismatch")
    private File expectFile;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose = false;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new AdtDump()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        configureLogging();
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        try {
            // Parse the input graph
            GraphJsonParser parser = new GraphJsonParser();
            Node root;
            try (InputStream input = inputFile != null ? new FileInputStream(inputFile) : System.in) {
                log.debug("Reading graph from {}", inputFile != null ? inputFile : "stdin");
                root = parser.parse(input);
            }

            // Render it
            OutputFormatter formatter = new OutputFormatter(raw ? PrinterConfig.rawMode() : PrinterConfig.defaults());
            log.debug("Rendering with {}", formatter.config());
            String text = formatter.format(root);

            if (expectFile != null) {
                String expected = Files.readString(expectFile.toPath(), StandardCharsets.UTF_8).stripTrailing();
                if (!expected.equals(text)) {
                    err.println("Output does not match " + expectFile);
                    err.println("expected: " + expected);
                    err.println("actual:   " + text);
                    return 1;
                }
                log.debug("Output matches {}", expectFile);
            }

            out.println(text);
            out.flush();
            return 0;
        } catch (IOException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    /**
     * Raises the root log level when verbose output was requested.
     */
    private void configureLogging() {
        ch.qos.logback.classic.Logger rootLogger =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
        if (verbose) {
            rootLogger.setLevel(Level.DEBUG);
        }
    }
}
