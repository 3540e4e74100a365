package io.routeguide.server;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Settings for the server and the demonstration client.
 * Values are read from routeguide.properties on the classpath. A JVM system property with the same
 * name overrides the file.
 */
public class ServerConfig {

    public static final String RESOURCE = "routeguide.properties";

    public static final String HOST = "routeguide.host";
    public static final String PORT = "routeguide.port";
    public static final String FEATURES_FILE = "routeguide.featuresFile";
    public static final String REFLECTION = "routeguide.reflection";
    public static final String SHUTDOWN_TIMEOUT_SECONDS = "routeguide.shutdownTimeoutSeconds";
    public static final String CLIENT_TARGET = "routeguide.client.target";
    public static final String CLIENT_DEADLINE_SECONDS = "routeguide.client.deadlineSeconds";

    private final Properties props;

    public ServerConfig(Properties props) {
        this.props = props;
    }

    /**
     * @return the configuration from the classpath resource overlaid with system properties
     */
    public static ServerConfig load() throws IOException {
        final Properties props = new Properties();
        try (InputStream is = ServerConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (is != null) {
                props.load(is);
            }
        }
        for (String name : System.getProperties().stringPropertyNames()) {
            if (name.startsWith("routeguide.")) {
                props.setProperty(name, System.getProperty(name));
            }
        }
        return new ServerConfig(props);
    }

    public String getHost() {
        return getString(HOST, "0.0.0.0");
    }

    public int getPort() {
        final int port = getInt(PORT, 8980);
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException(PORT + " out of range: " + port);
        }
        return port;
    }

    /**
     * @return the dataset path or an empty string to use the bundled dataset
     */
    public String getFeaturesFile() {
        return getString(FEATURES_FILE, "");
    }

    public boolean isReflectionEnabled() {
        return Boolean.parseBoolean(getString(REFLECTION, "true"));
    }

    public long getShutdownTimeoutSeconds() {
        return getInt(SHUTDOWN_TIMEOUT_SECONDS, 30);
    }

    public String getClientTarget() {
        return getString(CLIENT_TARGET, "localhost:8980");
    }

    public long getClientDeadlineSeconds() {
        return getInt(CLIENT_DEADLINE_SECONDS, 10);
    }

    private String getString(String key, String defaultValue) {
        final String value = props.getProperty(key);
        return value == null ? defaultValue : value.trim();
    }

    private int getInt(String key, int defaultValue) {
        final String value = getString(key, "");
        if (value.isEmpty()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + key + ": " + value, e);
        }
    }
}
