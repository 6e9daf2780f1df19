package com.calcsheet;

import java.io.IOException;
import java.net.ServerSocket;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Application configuration: server port, compute sidecar location and log paths.
 */
public class AppConfig {

    private static final String APP_NAME = "Calcsheet";
    static final String COMPUTE_URL_ENV = "CALCSHEET_COMPUTE_URL";
    static final String DEFAULT_COMPUTE_URL = "http://localhost:8000";
    static final int DEFAULT_PORT = 7070;
    static final int DEFAULT_UNIT_TIMEOUT_MS = 10_000;

    private final Path logPath;
    private final int port;
    private final String computeUrl;
    private final int unitCheckTimeoutMs;
    private final boolean devMode;

    private AppConfig(Path logPath, int port, String computeUrl, int unitCheckTimeoutMs, boolean devMode) {
        this.logPath = logPath;
        this.port = port;
        this.computeUrl = computeUrl;
        this.unitCheckTimeoutMs = unitCheckTimeoutMs;
        this.devMode = devMode;
    }

    public Path getLogPath() {
        return logPath;
    }

    public int getPort() {
        return port;
    }

    public String getComputeUrl() {
        return computeUrl;
    }

    public int getUnitCheckTimeoutMs() {
        return unitCheckTimeoutMs;
    }

    public boolean isDevMode() {
        return devMode;
    }

    /**
     * Get the log directory path based on the operating system.
     * Windows: %APPDATA%\Calcsheet\logs
     * macOS: ~/Library/Logs/Calcsheet
     * Linux: ~/.local/share/Calcsheet/logs
     */
    public static Path getLogDirectory() {
        String os = System.getProperty("os.name").toLowerCase();
        String userHome = System.getProperty("user.home");

        if (os.contains("win")) {
            String appData = System.getenv("APPDATA");
            if (appData == null) {
                appData = Paths.get(userHome, "AppData", "Roaming").toString();
            }
            return Paths.get(appData, APP_NAME, "logs");
        } else if (os.contains("mac")) {
            return Paths.get(userHome, "Library", "Logs", APP_NAME);
        } else {
            return Paths.get(userHome, ".local", "share", APP_NAME, "logs");
        }
    }

    public static Path getLogFilePath() {
        return getLogDirectory().resolve("calcsheet.log");
    }

    /**
     * Find an available port, starting with the preferred port.
     */
    public static int findAvailablePort(int preferredPort) {
        if (isPortAvailable(preferredPort)) {
            return preferredPort;
        }
        try (ServerSocket socket = new ServerSocket(0)) {
            socket.setReuseAddress(true);
            return socket.getLocalPort();
        } catch (IOException e) {
            for (int port = preferredPort + 1; port < preferredPort + 100; port++) {
                if (isPortAvailable(port)) {
                    return port;
                }
            }
        }
        // Let the server fail later with a clear bind error.
        return preferredPort;
    }

    public static boolean isPortAvailable(int port) {
        try (ServerSocket socket = new ServerSocket(port)) {
            socket.setReuseAddress(true);
            return true;
        } catch (IOException e) {
            return false;
        }
    }

    public static Path ensureLogDirectory() throws IOException {
        Files.createDirectories(getLogDirectory());
        return getLogFilePath();
    }

    /**
     * Builder for AppConfig.
     */
    public static class Builder {
        private int preferredPort = DEFAULT_PORT;
        private String computeUrl = null;
        private int unitCheckTimeoutMs = DEFAULT_UNIT_TIMEOUT_MS;
        private boolean devMode = false;

        public Builder port(int port) {
            this.preferredPort = port;
            return this;
        }

        public Builder computeUrl(String url) {
            if (url != null && !url.isBlank()) {
                this.computeUrl = url.trim();
            }
            return this;
        }

        public Builder unitCheckTimeoutMs(int timeoutMs) {
            if (timeoutMs > 0) {
                this.unitCheckTimeoutMs = timeoutMs;
            }
            return this;
        }

        public Builder devMode(boolean devMode) {
            this.devMode = devMode;
            return this;
        }

        public Builder parseArgs(String[] args) {
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];

                if (arg.startsWith("--port=")) {
                    parsePort(arg.substring("--port=".length()));
                } else if ("--port".equals(arg) && i + 1 < args.length) {
                    parsePort(args[++i]);
                } else if (arg.startsWith("--compute-url=")) {
                    computeUrl(arg.substring("--compute-url=".length()));
                } else if ("--compute-url".equals(arg) && i + 1 < args.length) {
                    computeUrl(args[++i]);
                } else if (arg.startsWith("--unit-timeout-ms=")) {
                    parseTimeout(arg.substring("--unit-timeout-ms=".length()));
                } else if ("--unit-timeout-ms".equals(arg) && i + 1 < args.length) {
                    parseTimeout(args[++i]);
                } else if ("--dev".equals(arg)) {
                    this.devMode = true;
                }
            }
            return this;
        }

        private void parsePort(String value) {
            try {
                this.preferredPort = Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                AppLogger.get().warn("Ignoring invalid --port value: " + value);
            }
        }

        private void parseTimeout(String value) {
            try {
                unitCheckTimeoutMs(Integer.parseInt(value.trim()));
            } catch (NumberFormatException e) {
                AppLogger.get().warn("Ignoring invalid --unit-timeout-ms value: " + value);
            }
        }

        String resolveComputeUrl() {
            if (computeUrl != null) {
                return computeUrl;
            }
            String fromEnv = System.getenv(COMPUTE_URL_ENV);
            return fromEnv != null && !fromEnv.isBlank() ? fromEnv.trim() : DEFAULT_COMPUTE_URL;
        }

        int getPreferredPort() {
            return preferredPort;
        }

        int getUnitCheckTimeoutMs() {
            return unitCheckTimeoutMs;
        }

        boolean isDevMode() {
            return devMode;
        }

        public AppConfig build() throws IOException {
            int port = findAvailablePort(preferredPort);
            Path logPath = ensureLogDirectory();
            return new AppConfig(logPath, port, resolveComputeUrl(), unitCheckTimeoutMs, devMode);
        }
    }
}
