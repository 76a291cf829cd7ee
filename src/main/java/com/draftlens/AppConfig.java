package com.draftlens;

import java.io.IOException;
import java.net.ServerSocket;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Server configuration: port, log location and analysis limits.
 */
public class AppConfig {

    private static final String APP_NAME = "DraftLens";
    public static final int DEFAULT_PORT = 7410;
    public static final int DEFAULT_MAX_ANALYSIS_LENGTH = 500_000;

    private final Path logPath;
    private final int port;
    private final boolean devMode;
    private final int maxAnalysisLength;

    private AppConfig(Path logPath, int port, boolean devMode, int maxAnalysisLength) {
        this.logPath = logPath;
        this.port = port;
        this.devMode = devMode;
        this.maxAnalysisLength = maxAnalysisLength;
    }

    public Path getLogPath() {
        return logPath;
    }

    public int getPort() {
        return port;
    }

    public boolean isDevMode() {
        return devMode;
    }

    public int getMaxAnalysisLength() {
        return maxAnalysisLength;
    }

    /**
     * Log directory per operating system.
     * Windows: %APPDATA%\DraftLens\logs
     * macOS: ~/Library/Logs/DraftLens
     * Linux: ~/.local/share/DraftLens/logs
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
        return getLogDirectory().resolve("draftlens.log");
    }

    /**
     * Returns the preferred port if free, otherwise any free port the OS hands out.
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

        // let the bind fail later with a clear error
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

    public static class Builder {
        private int preferredPort = DEFAULT_PORT;
        private boolean devMode = false;
        private int maxAnalysisLength = DEFAULT_MAX_ANALYSIS_LENGTH;
        private Path logPath = null;

        public Builder port(int port) {
            if (port < 0 || port > 65535) {
                throw new IllegalArgumentException("Port out of range: " + port);
            }
            this.preferredPort = port;
            return this;
        }

        public Builder devMode(boolean devMode) {
            this.devMode = devMode;
            return this;
        }

        public Builder maxAnalysisLength(int maxAnalysisLength) {
            if (maxAnalysisLength <= 0) {
                throw new IllegalArgumentException("Max analysis length must be positive: " + maxAnalysisLength);
            }
            this.maxAnalysisLength = maxAnalysisLength;
            return this;
        }

        public Builder logPath(String path) {
            if (path != null && !path.isEmpty()) {
                this.logPath = Paths.get(path).toAbsolutePath().normalize();
            }
            return this;
        }

        public Builder parseArgs(String[] args) {
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];

                if (arg.startsWith("--port=")) {
                    port(parseInt("--port", arg.substring("--port=".length())));
                } else if ("--port".equals(arg) && i + 1 < args.length) {
                    port(parseInt("--port", args[++i]));
                }

                else if (arg.startsWith("--max-analysis-length=")) {
                    maxAnalysisLength(parseInt("--max-analysis-length", arg.substring("--max-analysis-length=".length())));
                } else if ("--max-analysis-length".equals(arg) && i + 1 < args.length) {
                    maxAnalysisLength(parseInt("--max-analysis-length", args[++i]));
                }

                else if (arg.startsWith("--log=")) {
                    logPath(arg.substring("--log=".length()));
                } else if ("--log".equals(arg) && i + 1 < args.length) {
                    logPath(args[++i]);
                }

                else if ("--dev".equals(arg)) {
                    this.devMode = true;
                }
            }
            return this;
        }

        private static int parseInt(String flag, String value) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid value for " + flag + ": " + value, e);
            }
        }

        /**
         * Builds the configuration without touching the network or the file system.
         */
        public AppConfig buildDetached() {
            return new AppConfig(logPath, preferredPort, devMode, maxAnalysisLength);
        }

        public AppConfig build() throws IOException {
            int port = findAvailablePort(preferredPort);
            Path resolvedLog = logPath;
            if (resolvedLog == null) {
                resolvedLog = ensureLogDirectory();
            } else if (resolvedLog.getParent() != null) {
                Files.createDirectories(resolvedLog.getParent());
            }
            return new AppConfig(resolvedLog, port, devMode, maxAnalysisLength);
        }
    }
}
