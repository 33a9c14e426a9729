package tessera;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import tessera.utils.Log;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Map;

public class Config {
    public String version = "0.1.0";
    public int port = 6379;
    public String bind = "0.0.0.0";
    // 0 lets Netty pick (2 * cores)
    public int workerThreads = 0;
    public int statsIntervalSeconds = 5;
    public String logLevel = "info";

    public static Config load(String filename) {
        return load(filename, System.getenv());
    }

    static Config load(String filename, Map<String, String> env) {
        File f = new File(filename);
        if (!f.exists()) {
            // Try looking for .yaml extension if .conf was passed
            if (filename.endsWith(".conf")) {
                File yamlFile = new File(filename.substring(0, filename.length() - ".conf".length()) + ".yaml");
                if (yamlFile.exists()) f = yamlFile;
            }
        }

        Config config = new Config();

        if (!f.exists()) {
            Log.warn("Config file not found: " + filename + ". Using defaults.");
        } else {
            try {
                ObjectMapper mapper = new ObjectMapper(new YAMLFactory())
                        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
                Config loaded = mapper.readValue(f, Config.class);
                // An empty document maps to null
                if (loaded != null) config = loaded;
            } catch (IOException e) {
                Log.warn("Failed to load config as YAML (" + e.getMessage() + "). Attempting legacy parse...");
                config = loadLegacy(f, new Config());
            }
        }

        String port = env.get("TESSERA_PORT");
        if (port != null) {
            try {
                config.port = Integer.parseInt(port.trim());
            } catch (NumberFormatException e) {
                Log.warn("Ignoring TESSERA_PORT='" + port + "': not a number");
            }
        }
        return config;
    }

    /**
     * Old style config: one {@code key value} pair per line, {@code #} starts a comment.
     */
    static Config loadLegacy(File f, Config config) {
        try (BufferedReader br = Files.newBufferedReader(f.toPath(), StandardCharsets.UTF_8)) {
            String line;
            while ((line = br.readLine()) != null) {
                line = line.trim();
                if (line.isEmpty() || line.startsWith("#")) continue;
                String[] parts = line.split("\\s+", 2);
                if (parts.length < 2) continue;

                String key = parts[0];
                String val = parts[1];
                try {
                    switch (key) {
                        case "port": config.port = Integer.parseInt(val); break;
                        case "bind": config.bind = val; break;
                        case "worker-threads": config.workerThreads = Integer.parseInt(val); break;
                        case "stats-interval": config.statsIntervalSeconds = Integer.parseInt(val); break;
                        case "loglevel": config.logLevel = val; break;
                        default: Log.warn("Unknown config directive '" + key + "'");
                    }
                } catch (NumberFormatException e) {
                    Log.warn("Bad value for '" + key + "': " + val);
                }
            }
            Log.info("Loaded legacy config.");
        } catch (IOException e) {
            Log.error("Error loading legacy config: " + e.getMessage());
        }
        return config;
    }
}
