package org.sensitiveword.service.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Properties;

/**
 * Typed configuration for the Sensitive Word Filter service.
 *
 * <p>Loads {@code application.properties}, overlays environment variables, then command-line arguments of
 * the form {@code --key value}. Some convenience normalization is applied:
 * <ul>
 *   <li>If {@code DATA_VOLUME_PATH} is set, it overrides {@code data.path}.</li>
 *   <li>{@code --host}, {@code --port} and {@code --path} are accepted as short forms of
 *   {@code server.host}, {@code server.port} and {@code data.path}.</li>
 *   <li>{@code --rebuild} (or {@code -r}) sets {@code index.rebuild.on.start}.</li>
 *   <li>Unset {@code dictionary.path} and {@code index.path} are derived from {@code data.path}.</li>
 * </ul>
 * Missing required keys fail fast with {@link IllegalStateException}.</p>
 */
public record FilterConfig(
    Server server,
    Storage storage,
    char maskChar,
    boolean rebuildOnStart
) {
    private static final Logger logger = LoggerFactory.getLogger(FilterConfig.class);

    private static final Map<String, String> ARGUMENT_ALIASES = Map.of(
        "host", "server.host",
        "port", "server.port",
        "path", "data.path"
    );

    /** HTTP listener settings. */
    public record Server(String host, int port, long maxRequestBytes) {}

    /** Locations of the word list and the persisted index. */
    public record Storage(Path dataPath, Path dictionaryPath, Path indexPath) {
        public Path modelsDir() {
            return dataPath.resolve("models");
        }

        public Path sourceDir() {
            return modelsDir().resolve("source");
        }
    }

    /**
     * Loads configuration from classpath properties, environment variables and command-line arguments.
     *
     * @param args command-line arguments, highest precedence
     * @return a fully-initialized {@link FilterConfig}
     */
    public static FilterConfig load(String[] args) {
        Properties properties = loadProperties("application.properties");
        overlayEnvironment(properties);
        normalizeDataPath(properties);
        applyArguments(args, properties);
        return from(properties);
    }

    /**
     * True if the arguments ask for usage information.
     */
    public static boolean isHelpRequested(String[] args) {
        for (String arg : args) {
            if (arg.equals("-h") || arg.equals("--help")) {
                return true;
            }
        }
        return false;
    }

    static FilterConfig from(Properties p) {
        return new FilterConfig(
            readServer(p),
            readStorage(p),
            requireChar(p, "filter.mask.char"),
            requireBoolean(p, "index.rebuild.on.start")
        );
    }

    private static Server readServer(Properties p) {
        return new Server(
            requireString(p, "server.host"),
            requirePort(p, "server.port"),
            requireLong(p, "server.max.request.bytes")
        );
    }

    private static Storage readStorage(Properties p) {
        Path dataPath = Paths.get(requireString(p, "data.path"));
        Path modelsDir = dataPath.resolve("models");

        String dictionary = trimToNull(p.getProperty("dictionary.path"));
        String index = trimToNull(p.getProperty("index.path"));

        return new Storage(
            dataPath,
            dictionary != null ? Paths.get(dictionary) : modelsDir.resolve("source").resolve("dic.txt"),
            index != null ? Paths.get(index) : modelsDir.resolve("ac_index.bin")
        );
    }

    /**
     * Parse command line arguments and update configuration
     */
    static void applyArguments(String[] args, Properties properties) {
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (arg.equals("--rebuild") || arg.equals("-r")) {
                properties.setProperty("index.rebuild.on.start", "true");
            } else if (arg.equals("-h") || arg.equals("--help")) {
                continue;
            } else if (arg.startsWith("--") && i + 1 < args.length) {
                String key = arg.substring(2);
                String value = args[++i];
                properties.setProperty(ARGUMENT_ALIASES.getOrDefault(key, key), value);
                logger.info("Command line argument: {} = {}", key, value);
            } else {
                throw new IllegalStateException("Unrecognized command line argument: '" + arg + "'");
            }
        }
    }

    private static Properties loadProperties(String resourceName) {
        Properties properties = new Properties();
        try (InputStream in = FilterConfig.class.getClassLoader().getResourceAsStream(resourceName)) {
            if (in != null) {
                properties.load(in);
            } else {
                logger.warn("{} not found, relying on environment and arguments", resourceName);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load " + resourceName, e);
        }
        return properties;
    }

    private static void overlayEnvironment(Properties properties) {
        properties.putAll(System.getenv());
    }

    private static void normalizeDataPath(Properties properties) {
        String volume = trimToNull(properties.getProperty("DATA_VOLUME_PATH"));
        if (volume != null) {
            properties.setProperty("data.path", volume);
        }
    }

    private static String requireString(Properties properties, String key) {
        String value = trimToNull(properties.getProperty(key));
        if (value == null) {
            throw new IllegalStateException("Missing required configuration: " + key);
        }
        return value;
    }

    private static int requirePort(Properties properties, String key) {
        String value = requireString(properties, key);
        try {
            int port = Integer.parseInt(value);
            if (port < 0 || port > 65535) {
                throw new IllegalStateException("Port out of range for configuration '" + key + "': " + value);
            }
            return port;
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid integer for configuration '" + key + "': '" + value + "'", e);
        }
    }

    private static long requireLong(Properties properties, String key) {
        String value = requireString(properties, key);
        try {
            long parsed = Long.parseLong(value);
            if (parsed <= 0) {
                throw new IllegalStateException("Configuration '" + key + "' must be positive: " + value);
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid integer for configuration '" + key + "': '" + value + "'", e);
        }
    }

    private static boolean requireBoolean(Properties properties, String key) {
        String value = requireString(properties, key);
        if (value.equalsIgnoreCase("true")) {
            return true;
        }
        if (value.equalsIgnoreCase("false")) {
            return false;
        }
        throw new IllegalStateException("Invalid boolean for configuration '" + key + "': '" + value + "'");
    }

    private static char requireChar(Properties properties, String key) {
        String value = properties.getProperty(key);
        if (value == null || value.length() != 1 || Character.isSurrogate(value.charAt(0))
                || Character.isWhitespace(value.charAt(0))) {
            throw new IllegalStateException("Configuration '" + key + "' must be a single visible character: '"
                + value + "'");
        }
        return value.charAt(0);
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
