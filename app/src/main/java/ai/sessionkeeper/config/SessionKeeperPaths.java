package ai.sessionkeeper.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Objects;

/**
 * Resolves per-user SessionKeeper locations:
 * - base configuration directory
 * - configuration properties file
 * - default sessions directory
 *
 * Default resolution is platform-aware:
 * - Linux: $XDG_CONFIG_HOME/sessionkeeper or $HOME/.config/sessionkeeper
 * - macOS: $HOME/Library/Application Support/SessionKeeper
 * - Windows: %APPDATA%\\SessionKeeper
 *
 * For tests and overrides use {@link #forBaseDir(Path)}.
 */
public final class SessionKeeperPaths {
    public static final String CONFIG_FILE_NAME = "sessionkeeper.properties";
    public static final String SESSIONS_DIR_NAME = "sessions";

    private final Path baseDir;

    private SessionKeeperPaths(Path baseDir) {
        this.baseDir = Objects.requireNonNull(baseDir);
    }

    public static SessionKeeperPaths defaults() {
        String os = System.getProperty("os.name", "").toLowerCase(Locale.ROOT);
        Path home = Paths.get(System.getProperty("user.home"));

        if (os.contains("win")) {
            String appData = System.getenv("APPDATA");
            if (appData != null && !appData.isBlank()) {
                return new SessionKeeperPaths(Paths.get(appData).resolve("SessionKeeper"));
            }
            return new SessionKeeperPaths(home.resolve("AppData").resolve("Roaming").resolve("SessionKeeper"));
        }

        if (os.contains("mac") || os.contains("darwin")) {
            return new SessionKeeperPaths(
                    home.resolve("Library").resolve("Application Support").resolve("SessionKeeper"));
        }

        String xdg = System.getenv("XDG_CONFIG_HOME");
        if (xdg != null && !xdg.isBlank()) {
            return new SessionKeeperPaths(Paths.get(xdg).resolve("sessionkeeper"));
        }
        return new SessionKeeperPaths(home.resolve(".config").resolve("sessionkeeper"));
    }

    /** Paths anchored at the given base directory. */
    public static SessionKeeperPaths forBaseDir(Path baseDir) {
        return new SessionKeeperPaths(baseDir);
    }

    public Path getBaseDir() {
        return baseDir;
    }

    public Path getConfigFile() {
        return baseDir.resolve(CONFIG_FILE_NAME);
    }

    public Path getDefaultSessionsDir() {
        return baseDir.resolve(SESSIONS_DIR_NAME);
    }
}
