package com.mimecast.courier;

import com.mimecast.courier.config.TransportConfig;
import com.mimecast.courier.http.HttpTransport;
import com.mimecast.courier.http.TransportResult;
import com.mimecast.courier.http.event.TransportListener;
import com.mimecast.courier.http.event.TransportRequestEvent;
import com.mimecast.courier.http.event.TransportResponseEvent;
import com.mimecast.courier.main.Config;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.help.HelpFormatter;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.config.Configurator;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.Optional;

/**
 * Main runnable.
 *
 * <p>Executes a single transport described by a JSON5 file and prints the request and response logs.
 */
public class Main {

    /**
     * Application jar name.
     */
    private static final String NAME = "courier.jar";

    /**
     * Application jar usage.
     */
    public static final String USAGE = "java -jar " + NAME;

    /**
     * Application description.
     */
    public static final String DESCRIPTION = "HTTP request/response transport";

    public static final int EXIT_SUCCESS = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_USAGE = 2;

    private final String[] args;
    private final PrintStream out;

    /**
     * Main runnable.
     *
     * @param args String array.
     */
    public static void main(String[] args) {
        System.exit(new Main(args, System.out).run());
    }

    /**
     * Constructs a new Main instance.
     *
     * @param args String array.
     * @param out  Output stream.
     */
    Main(String[] args, PrintStream out) {
        this.args = args;
        this.out = out;
    }

    /**
     * Runs the transport.
     *
     * @return Exit status.
     */
    int run() {
        Optional<CommandLine> opt = parseArgs(options());
        if (opt.isEmpty()) {
            return EXIT_USAGE;
        }

        CommandLine cmd = opt.get();
        if (cmd.hasOption("help") || !cmd.hasOption("json")) {
            optionsUsage(options());
            return cmd.hasOption("help") ? EXIT_SUCCESS : EXIT_USAGE;
        }

        // Disable logging unless verbose.
        if (!cmd.hasOption("verbose")) {
            Configurator.setAllLevels(LogManager.getRootLogger().getName(), Level.OFF);
        }

        try {
            if (cmd.hasOption("conf")) {
                Config.initProfiles(cmd.getOptionValue("conf"));
            }

            HttpTransport<Object> transport = new HttpTransport<>(new TransportConfig(cmd.getOptionValue("json")));
            transport.addListener(new TransportListener() {
                @Override
                public void onRequest(TransportRequestEvent event) {
                    log(event.getRequest());
                }

                @Override
                public void onResponse(TransportResponseEvent event) {
                    log(event.getResponse());
                }
            });

            Object body = null;
            if (cmd.hasOption("file")) {
                body = Files.readAllBytes(Paths.get(cmd.getOptionValue("file")));
            } else if (cmd.hasOption("body")) {
                body = cmd.getOptionValue("body");
            }

            TransportResult result = transport.send(body);
            log("Result: " + result);
            return result.isSuccess() ? EXIT_SUCCESS : EXIT_FAILURE;

        } catch (IOException e) {
            log("Unable to read file: " + e.getMessage());
            return EXIT_USAGE;
        }
    }

    /**
     * CLI options.
     * <i>Listing order will be alphabetical</i>.
     *
     * @return Options instance.
     */
    private Options options() {
        Options options = new Options();
        options.addOption("b", "body", true, "Text body to send");
        options.addOption("c", "conf", true, "Path to client profiles JSON5");
        options.addOption("f", "file", true, "File to send as body bytes");
        options.addOption("h", "help", false, "Show usage help");
        options.addOption("j", "json", true, "Path to transport JSON5");
        options.addOption("v", "verbose", false, "Keep logging enabled");
        return options;
    }

    /**
     * CLI usage.
     *
     * @param options Options instance.
     */
    public void optionsUsage(Options options) {
        log(USAGE);
        log(" " + DESCRIPTION);
        log("");

        // Capture System.out to get help output.
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        PrintStream ps = new PrintStream(baos);
        PrintStream oldOut = System.out;
        System.setOut(ps);

        try {
            HelpFormatter formatter = HelpFormatter.builder()
                    .setShowSince(false)
                    .get();
            formatter.printHelp(" ", "", options, "", true);
            System.out.flush();
        } catch (IOException e) {
            // Should not happen with ByteArrayOutputStream.
            throw new RuntimeException(e);
        } finally {
            System.setOut(oldOut);
        }

        log(baos.toString());
        log("");
    }

    /**
     * Parser for CLI arguments.
     *
     * @param options Options instance.
     * @return Optional of CommandLine.
     */
    public Optional<CommandLine> parseArgs(Options options) {
        CommandLine cmd = null;

        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (Exception e) {
            log("Options error: " + e.getMessage());
            log("");
            optionsUsage(options);
        }

        return Optional.ofNullable(cmd);
    }

    /**
     * Logging wrapper.
     *
     * @param string String.
     */
    public void log(String string) {
        out.println(string);
    }
}
