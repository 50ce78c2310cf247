package com.newsdigest.news.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

/**
 * Application configuration, read from a YAML file.
 * Environment variables PORT and DB_PATH override the file.
 */
public class DigestConfig {

    private static final Logger log = LoggerFactory.getLogger(DigestConfig.class);
    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory())
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public static final Path DEFAULT_PATH = Path.of("config.yaml");

    private Server server = new Server();
    private Database database = new Database();
    private Schedule schedule = new Schedule();
    private Pipeline pipeline = new Pipeline();
    private Model model = new Model();

    public DigestConfig() {
        // Default constructor for YAML
    }

    // ==================== Loading ====================

    public static DigestConfig load(Path path) throws IOException {
        return load(path, System.getenv());
    }

    /**
     * Load from the file if it exists, otherwise use defaults, then apply environment overrides.
     */
    public static DigestConfig load(Path path, Map<String, String> env) throws IOException {
        DigestConfig config;
        if (path != null && Files.exists(path)) {
            config = YAML.readValue(path.toFile(), DigestConfig.class);
            if (config == null) {
                config = new DigestConfig();
            }
            log.info("Loaded config from {}", path);
        } else {
            config = new DigestConfig();
            log.info("No config file at {}, using defaults", path);
        }
        config.applyEnv(env);
        config.validate();
        return config;
    }

    void applyEnv(Map<String, String> env) {
        String port = env.get("PORT");
        if (port != null && !port.isBlank()) {
            try {
                server.setPort(Integer.parseInt(port.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("PORT is not a number: " + port, e);
            }
        }
        String dbPath = env.get("DB_PATH");
        if (dbPath != null && !dbPath.isBlank()) {
            database.setPath(dbPath.trim());
        }
    }

    void validate() {
        if (server.getPort() < 0 || server.getPort() > 65535) {
            throw new IllegalArgumentException("server.port out of range: " + server.getPort());
        }
        if (pipeline.getConcurrency() < 1) {
            throw new IllegalArgumentException("pipeline.concurrency must be at least 1");
        }
        if (schedule.getProcessBatchSize() < 1) {
            throw new IllegalArgumentException("schedule.processBatchSize must be at least 1");
        }
        if (schedule.getFetchIntervalMinutes() < 1 || schedule.getProcessIntervalMinutes() < 1) {
            throw new IllegalArgumentException("schedule intervals must be at least one minute");
        }
    }

    // ==================== Sections ====================

    public Server getServer() { return server; }
    public void setServer(Server server) { this.server = server; }

    public Database getDatabase() { return database; }
    public void setDatabase(Database database) { this.database = database; }

    public Schedule getSchedule() { return schedule; }
    public void setSchedule(Schedule schedule) { this.schedule = schedule; }

    public Pipeline getPipeline() { return pipeline; }
    public void setPipeline(Pipeline pipeline) { this.pipeline = pipeline; }

    public Model getModel() { return model; }
    public void setModel(Model model) { this.model = model; }

    public static class Server {
        private int port = 3000;

        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }
    }

    public static class Database {
        private String path = "data/news.db";

        public String getPath() { return path; }
        public void setPath(String path) { this.path = path; }
    }

    public static class Schedule {
        private boolean enabled = true;
        private int fetchIntervalMinutes = 30;
        private int processIntervalMinutes = 10;
        private int processBatchSize = 5;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public int getFetchIntervalMinutes() { return fetchIntervalMinutes; }
        public void setFetchIntervalMinutes(int minutes) { this.fetchIntervalMinutes = minutes; }

        public int getProcessIntervalMinutes() { return processIntervalMinutes; }
        public void setProcessIntervalMinutes(int minutes) { this.processIntervalMinutes = minutes; }

        public int getProcessBatchSize() { return processBatchSize; }
        public void setProcessBatchSize(int size) { this.processBatchSize = size; }

        public Duration fetchInterval() { return Duration.ofMinutes(fetchIntervalMinutes); }
        public Duration processInterval() { return Duration.ofMinutes(processIntervalMinutes); }
    }

    public static class Pipeline {
        private int concurrency = 3;
        private int progressInterval = 10;

        public int getConcurrency() { return concurrency; }
        public void setConcurrency(int concurrency) { this.concurrency = concurrency; }

        public int getProgressInterval() { return progressInterval; }
        public void setProgressInterval(int interval) { this.progressInterval = interval; }
    }

    public static class Model {
        private int connectTimeoutSeconds = 10;
        private int callTimeoutSeconds = 120;

        public int getConnectTimeoutSeconds() { return connectTimeoutSeconds; }
        public void setConnectTimeoutSeconds(int seconds) { this.connectTimeoutSeconds = seconds; }

        public int getCallTimeoutSeconds() { return callTimeoutSeconds; }
        public void setCallTimeoutSeconds(int seconds) { this.callTimeoutSeconds = seconds; }

        public Duration connectTimeout() { return Duration.ofSeconds(connectTimeoutSeconds); }
        public Duration callTimeout() { return Duration.ofSeconds(callTimeoutSeconds); }
    }
}
