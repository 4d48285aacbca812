package net.belfry;

import java.io.File;
import java.io.IOException;
import java.util.logging.Level;
import java.util.logging.Logger;
import net.belfry.util.Logging;
import net.belfry.util.Util;
import net.belfry.util.config.ConfigurationException;
import net.belfry.util.config.RelayConfig;

public class Main implements Runnable {

    public static final String APPNAME = "Belfry";
    public static final String VERSION = "1.0.0";
    public static final String DESCRIPTION = "A WebSocket message relay " +
        "for game sessions.";

    public static final String USAGE = "USAGE: belfry [--config FILE] " +
        "[PORT] [KEY=VALUE ...]";

    private static final Logger LOGGER;

    static {
        Logging.initFormat();
        LOGGER = Logger.getLogger("Main");
    }

    private final String[] args;
    private RelayRunner runner;

    public Main(String[] args) {
        this.args = args;
        this.runner = new RelayRunner();
    }

    public RelayRunner getRunner() {
        return runner;
    }
    public void setRunner(RelayRunner r) {
        runner = r;
    }

    /**
     * Apply the command line to the runner's configuration.
     * Accepts "--config FILE", a bare port number, and "key=value"
     * overrides. Throws IllegalArgumentException on anything else.
     */
    protected void parseArguments() {
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (arg.equals("--config") || arg.equals("-C")) {
                if (i + 1 == args.length)
                    throw new IllegalArgumentException("Missing value for " +
                                                       arg);
                runner.addConfigFile(new File(args[++i]));
            } else if (arg.matches("[0-9]+")) {
                runner.makeConfig().put(RelayConfig.K_PORT, arg);
            } else {
                String[] pair = Util.splitPair(arg);
                if (pair == null)
                    throw new IllegalArgumentException("Unrecognized " +
                        "argument " + arg);
                runner.makeConfig().put(pair[0], pair[1]);
            }
        }
    }

    public void run() {
        Logging.captureExceptions(LOGGER);
        try {
            parseArguments();
        } catch (IllegalArgumentException exc) {
            System.err.println(exc.getMessage());
            System.err.println(USAGE);
            System.exit(1);
        }
        try {
            runner.configureLogging();
            LOGGER.info(APPNAME + " " + VERSION);
            runner.setup();
        } catch (ConfigurationException exc) {
            LOGGER.log(Level.SEVERE, "Invalid configuration:", exc);
            System.exit(2);
        } catch (IOException exc) {
            LOGGER.log(Level.SEVERE, "Exception during setup:", exc);
            System.exit(2);
        }
        runner.registerShutdownHook();
        runner.launch();
    }

    public static void main(String[] args) {
        new Main(args).run();
    }

}
