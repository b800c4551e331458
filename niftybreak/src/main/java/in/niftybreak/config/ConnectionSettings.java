package in.niftybreak.config;

import in.niftybreak.util.Env;

/**
 * Credentials and file locations. Read from the environment only, never from
 * the strategy config file.
 */
public record ConnectionSettings(
    String kiteApiKey,
    String kiteAccessToken,
    String orderApiKey,
    String orderApiBaseUrl,
    String instrumentsCsvPath,
    String dataDir,
    String replayFile
) {
    public static ConnectionSettings fromEnv() {
        return new ConnectionSettings(
            Env.get("KITE_API_KEY", ""),
            Env.get("KITE_ACCESS_TOKEN", ""),
            Env.get("ORDER_API_KEY", ""),
            Env.get("ORDER_API_BASE_URL", "https://api.algotest.in/v1"),
            Env.get("INSTRUMENTS_CSV_PATH", "./data/instruments.csv"),
            Env.get("DATA_DIR", "./data"),
            Env.get("REPLAY_FILE", "")
        );
    }

    public boolean hasKiteCredentials() {
        return !kiteApiKey.isBlank() && !kiteAccessToken.isBlank();
    }

    /**
     * Mask a secret for logging.
     */
    public static String mask(String key) {
        if (key == null || key.length() < 8)
            return "***";
        return key.substring(0, 4) + "****" + key.substring(key.length() - 4);
    }
}
