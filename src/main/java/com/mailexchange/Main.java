package com.mailexchange;

import com.mailexchange.main.Server;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Options;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.naming.ConfigurationException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Optional;

/**
 * Main runnable.
 *
 * <p>Parses the command line and starts the forwarder.
 *
 * @see Server
 */
public class Main {
    private static final Logger log = LogManager.getLogger(Main.class);

    /**
     * Application jar name.
     */
    private static final String NAME = "mail-exchange.jar";

    /**
     * Application jar usage.
     */
    public static final String USAGE = "java -jar " + NAME;

    /**
     * Application description.
     */
    public static final String DESCRIPTION = "Tag based IMAP mail forwarder";

    private final String[] args;

    /**
     * Main runnable.
     *
     * @param args String array.
     */
    public static void main(String[] args) {
        int status = new Main(args).run();
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * Constructs a new Main instance.
     *
     * @param args String array.
     */
    Main(String[] args) {
        this.args = args;
    }

    /**
     * Runs the selected command.
     *
     * @return Exit status, 0 while the forwarder keeps running.
     */
    int run() {
        Options options = options();
        Optional<CommandLine> opt = parseArgs(options);
        if (opt.isEmpty()) {
            return 1;
        }

        CommandLine cmd = opt.get();
        if (cmd.hasOption("help")) {
            optionsUsage(options);
            return 0;
        }

        try {
            Server.run(cmd.getOptionValue("config"));
            return 0;
        } catch (ConfigurationException e) {
            log.error("Configuration error: {}", e.getMessage());
            return 1;
        }
    }

    /**
     * CLI options.
     *
     * @return Options instance.
     */
    Options options() {
        Options options = new Options();
        options.addOption("c", "config", true, "Config file or directory containing forwarder.json5");
        options.addOption("h", "help", false, "Show usage");
        return options;
    }

    /**
     * CLI usage.
     *
     * @param options Options instance.
     */
    void optionsUsage(Options options) {
        log(USAGE);
        log(" " + DESCRIPTION);
        log("");

        StringWriter writer = new StringWriter();
        new HelpFormatter().printHelp(new PrintWriter(writer), HelpFormatter.DEFAULT_WIDTH, " ", "", options,
                HelpFormatter.DEFAULT_LEFT_PAD, HelpFormatter.DEFAULT_DESC_PAD, "", true);

        log(writer.toString());
    }

    /**
     * Parser for CLI arguments.
     *
     * @param options Options instance.
     * @return Optional of CommandLine.
     */
    Optional<CommandLine> parseArgs(Options options) {
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
    void log(String string) {
        System.out.println(string);
    }
}
