package com.mailexchange.main;

import com.mailexchange.config.ForwarderConfig;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.naming.ConfigurationException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Foundation for runnables.
 *
 * <p>Locates, loads and validates the configuration file once.
 * <p>Lookup order:
 * <ol>
 *     <li>Path given on the command line, a file or a directory containing {@value #CONFIG_FILE}.</li>
 *     <li>{@value #CONFIG_ENV} environment variable, a file path.</li>
 *     <li>{@value #CONFIG_FILE} in the working directory.</li>
 * </ol>
 */
public abstract class Foundation {
    protected static final Logger log = LogManager.getLogger(Foundation.class);

    /**
     * Default configuration file name.
     */
    public static final String CONFIG_FILE = "forwarder.json5";

    /**
     * Configuration path environment variable.
     */
    public static final String CONFIG_ENV = "CONFIG_PATH";

    /**
     * Initializes configuration.
     *
     * @param path Directory or file path, may be null.
     * @throws ConfigurationException Unable to read or invalid configuration.
     */
    public static void init(String path) throws ConfigurationException {
        Path file = resolve(path, System.getenv(CONFIG_ENV));
        if (!Files.isRegularFile(file)) {
            throw new ConfigurationException("Config file not found: " + file);
        }

        try {
            Config.initForwarder(file.toString());
        } catch (IOException e) {
            ConfigurationException ce = new ConfigurationException("Unable to read config file " + file + ": " + e.getMessage());
            ce.setRootCause(e);
            throw ce;
        }

        ForwarderConfig config = Config.getForwarder();
        config.validate();
        log.debug("Loaded config file: {}", file);
    }

    /**
     * Resolves the configuration file path.
     *
     * @param path Command line path, may be null.
     * @param env  Environment variable value, may be null.
     * @return Path instance.
     */
    static Path resolve(String path, String env) {
        if (StringUtils.isNotBlank(path)) {
            Path given = Paths.get(path);
            return Files.isDirectory(given) ? given.resolve(CONFIG_FILE) : given;
        }
        if (StringUtils.isNotBlank(env)) {
            return Paths.get(env);
        }
        return Paths.get(CONFIG_FILE);
    }
}
