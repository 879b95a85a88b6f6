package com.userhealth;

import com.userhealth.main.Server;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.help.HelpFormatter;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.Optional;

/**
 * Main runnable.
 *
 * <p>Parses the command line and starts the {@link Server}.
 * <p>The API port can be overridden with {@code --port}, which takes precedence over the
 * {@code PORT} environment variable and {@code server.json5}.
 */
public class Main {

    /**
     * Application jar name.
     */
    private static final String NAME = "user-health-api.jar";

    /**
     * Application jar usage.
     */
    public static final String USAGE = "java -jar " + NAME;

    /**
     * Application description.
     */
    public static final String DESCRIPTION = "Health check and user CRUD HTTP service";

    /**
     * Default configuration directory.
     */
    public static final String DEFAULT_CONFIG_DIR = "cfg/";

    private final String[] args;

    /**
     * Main runnable.
     *
     * @param args String array.
     */
    public static void main(String[] args) {
        new Main(args).run();
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
     * Parses options and starts the server, or shows usage.
     */
    void run() {
        Optional<CommandLine> opt = parseArgs(options());
        if (opt.isEmpty() || opt.get().hasOption("help")) {
            optionsUsage(options());
            return;
        }

        CommandLine cmd = opt.get();
        if (cmd.hasOption("port")) {
            System.setProperty("port", cmd.getOptionValue("port"));
        }

        String configDir = cmd.getOptionValue("config", DEFAULT_CONFIG_DIR);
        try {
            Server.run(configDir);
        } catch (Exception e) {
            log("Unable to start: " + e.getMessage());
            System.exit(1);
        }
    }

    /**
     * CLI options.
     *
     * @return Options instance.
     */
    Options options() {
        Options options = new Options();
        options.addOption(Option.builder("c").longOpt("config").hasArg().argName("dir")
                .desc("Configuration directory (default " + DEFAULT_CONFIG_DIR + ")").build());
        options.addOption(Option.builder("p").longOpt("port").hasArg().argName("port")
                .desc("API port override").build());
        options.addOption("h", "help", false, "Show usage");
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
        } catch (java.io.IOException e) {
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
     * @return Optional of CommandLine, empty when the arguments are invalid.
     */
    public Optional<CommandLine> parseArgs(Options options) {
        CommandLine cmd = null;

        try {
            cmd = new DefaultParser().parse(options, args);
            String port = cmd.getOptionValue("port");
            if (port != null) {
                Integer.parseInt(port.trim());
            }
        } catch (Exception e) {
            log("Options error: " + e.getMessage());
            log("");
            cmd = null;
        }

        return Optional.ofNullable(cmd);
    }

    /**
     * Logging wrapper.
     *
     * @param string String.
     */
    public void log(String string) {
        System.out.println(string);
    }
}
