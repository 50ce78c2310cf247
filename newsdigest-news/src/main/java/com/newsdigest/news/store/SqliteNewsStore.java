package com.newsdigest.news.store;

import com.newsdigest.news.model.Article;
import com.newsdigest.news.model.ArticleStatus;
import com.newsdigest.news.model.Source;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * SQLite implementation of NewsStore.
 * One connection, serialized through a lock, so each statement is atomic for concurrent workers.
 */
public class SqliteNewsStore implements NewsStore {

    private static final Logger log = LoggerFactory.getLogger(SqliteNewsStore.class);
    static final int MAX_BOUND_EXCLUDES = 500;

    private final Connection conn;
    private final Object lock = new Object();

    public SqliteNewsStore(Path dbPath) {
        try {
            Path parent = dbPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            this.conn = DriverManager.getConnection("jdbc:sqlite:" + dbPath);
            configure();
            initSchema();
            log.info("Opened news database at {}", dbPath);
        } catch (Exception e) {
            throw new StoreException("Failed to open database: " + dbPath, e);
        }
    }

    private void configure() throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            stmt.execute("PRAGMA journal_mode=WAL");
            stmt.execute("PRAGMA synchronous=NORMAL");
            stmt.execute("PRAGMA busy_timeout=5000");
        }
    }

    private void initSchema() throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            stmt.execute("""
                CREATE TABLE IF NOT EXISTS sources (
                    id INTEGER PRIMARY KEY AUTOINCREMENT,
                    name TEXT NOT NULL,
                    url TEXT NOT NULL UNIQUE,
                    enabled INTEGER NOT NULL DEFAULT 1,
                    created_at INTEGER NOT NULL,
                    updated_at INTEGER NOT NULL
                )
                """);

            // source_id has no FK: deleting a source leaves its articles in place
            stmt.execute("""
                CREATE TABLE IF NOT EXISTS articles (
                    id INTEGER PRIMARY KEY AUTOINCREMENT,
                    source_id INTEGER NOT NULL,
                    title TEXT NOT NULL DEFAULT '',
                    link TEXT NOT NULL UNIQUE,
                    content TEXT NOT NULL DEFAULT '',
                    pub_date INTEGER NOT NULL,
                    status INTEGER NOT NULL DEFAULT 0,
                    summary TEXT,
                    processed_at INTEGER,
                    created_at INTEGER NOT NULL
                )
                """);

            stmt.execute("""
                CREATE TABLE IF NOT EXISTS settings (
                    key TEXT PRIMARY KEY,
                    value TEXT NOT NULL,
                    updated_at INTEGER NOT NULL
                )
                """);

            stmt.execute("CREATE INDEX IF NOT EXISTS idx_articles_status_pub ON articles(status, pub_date DESC)");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_articles_pub ON articles(pub_date DESC)");
        }
    }

    // === Articles ===

    @Override
    public StoredArticle findOrCreateArticle(Article candidate) {
        String insert = """
            INSERT INTO articles (source_id, title, link, content, pub_date, status, summary, processed_at, created_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT(link) DO NOTHING
            """;
        Instant now = Instant.now();
        synchronized (lock) {
            try (PreparedStatement ps = conn.prepareStatement(insert)) {
                ps.setLong(1, candidate.sourceId());
                ps.setString(2, candidate.title());
                ps.setString(3, candidate.link());
                ps.setString(4, candidate.content());
                ps.setLong(5, toMillis(candidate.publishedAt() != null ? candidate.publishedAt() : now));
                ps.setInt(6, candidate.status().code());
                ps.setString(7, candidate.summary());
                ps.setObject(8, toMillisOrNull(candidate.processedAt()));
                ps.setLong(9, toMillis(candidate.createdAt() != null ? candidate.createdAt() : now));
                boolean created = ps.executeUpdate() > 0;

                Article stored = findByLink(candidate.link())
                    .orElseThrow(() -> new SQLException("Article vanished after insert: " + candidate.link()));
                return new StoredArticle(stored, created);
            } catch (SQLException e) {
                throw new StoreException("Failed to store article " + candidate.link(), e);
            }
        }
    }

    private Optional<Article> findByLink(String link) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT * FROM articles WHERE link = ?")) {
            ps.setString(1, link);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapArticle(rs)) : Optional.empty();
            }
        }
    }

    @Override
    public List<Article> findArticles(ArticleQuery query) {
        StringBuilder sql = new StringBuilder("SELECT * FROM articles WHERE 1=1");
        List<Object> params = new ArrayList<>();

        if (query.status() != null) {
            sql.append(" AND status = ?");
            params.add(query.status().code());
        }

        // Large exclusion sets would exceed SQLite's host parameter limit; filter those while reading
        Set<Long> excluded = query.excludeIds();
        boolean bindExcluded = !excluded.isEmpty() && excluded.size() <= MAX_BOUND_EXCLUDES;
        if (bindExcluded) {
            sql.append(" AND id NOT IN (").append("?,".repeat(excluded.size()));
            sql.setLength(sql.length() - 1);
            sql.append(")");
            params.addAll(excluded);
        }

        sql.append(" ORDER BY pub_date DESC, id DESC");
        boolean filterInMemory = excluded.size() > MAX_BOUND_EXCLUDES;
        if (!filterInMemory) {
            sql.append(" LIMIT ? OFFSET ?");
            params.add(query.limit());
            params.add(query.offset());
        }

        List<Article> articles = new ArrayList<>();
        synchronized (lock) {
            try (PreparedStatement ps = conn.prepareStatement(sql.toString())) {
                for (int i = 0; i < params.size(); i++) {
                    ps.setObject(i + 1, params.get(i));
                }
                try (ResultSet rs = ps.executeQuery()) {
                    int skipped = 0;
                    while (rs.next() && articles.size() < query.limit()) {
                        if (filterInMemory) {
                            if (excluded.contains(rs.getLong("id"))) continue;
                            if (skipped < query.offset()) {
                                skipped++;
                                continue;
                            }
                        }
                        articles.add(mapArticle(rs));
                    }
                }
            } catch (SQLException e) {
                throw new StoreException("Failed to query articles", e);
            }
        }
        return articles;
    }

    @Override
    public Optional<Article> getArticle(long id) {
        synchronized (lock) {
            try (PreparedStatement ps = conn.prepareStatement("SELECT * FROM articles WHERE id = ?")) {
                ps.setLong(1, id);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? Optional.of(mapArticle(rs)) : Optional.empty();
                }
            } catch (SQLException e) {
                throw new StoreException("Failed to get article " + id, e);
            }
        }
    }

    @Override
    public int countArticles(ArticleStatus status) {
        String sql = status == null
            ? "SELECT COUNT(*) FROM articles"
            : "SELECT COUNT(*) FROM articles WHERE status = ?";
        synchronized (lock) {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                if (status != null) {
                    ps.setInt(1, status.code());
                }
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? rs.getInt(1) : 0;
                }
            } catch (SQLException e) {
                throw new StoreException("Failed to count articles", e);
            }
        }
    }

    @Override
    public void saveArticle(Article article) {
        String sql = """
            UPDATE articles
            SET source_id = ?, title = ?, link = ?, content = ?, pub_date = ?,
                status = ?, summary = ?, processed_at = ?
            WHERE id = ?
            """;
        synchronized (lock) {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setLong(1, article.sourceId());
                ps.setString(2, article.title());
                ps.setString(3, article.link());
                ps.setString(4, article.content());
                ps.setLong(5, toMillis(article.publishedAt()));
                ps.setInt(6, article.status().code());
                ps.setString(7, article.summary());
                ps.setObject(8, toMillisOrNull(article.processedAt()));
                ps.setLong(9, article.id());
                if (ps.executeUpdate() == 0) {
                    throw new SQLException("No article with id " + article.id());
                }
            } catch (SQLException e) {
                throw new StoreException("Failed to save article " + article.id(), e);
            }
        }
    }

    @Override
    public boolean deleteArticle(long id) {
        return deleteById("articles", id);
    }

    private Article mapArticle(ResultSet rs) throws SQLException {
        return Article.builder()
            .id(rs.getLong("id"))
            .sourceId(rs.getLong("source_id"))
            .title(rs.getString("title"))
            .link(rs.getString("link"))
            .content(rs.getString("content"))
            .publishedAt(Instant.ofEpochMilli(rs.getLong("pub_date")))
            .status(ArticleStatus.fromCode(rs.getInt("status")))
            .summary(rs.getString("summary"))
            .processedAt(fromMillis(rs, "processed_at"))
            .createdAt(Instant.ofEpochMilli(rs.getLong("created_at")))
            .build();
    }

    // === Sources ===

    @Override
    public Source createSource(String name, String url, boolean enabled) {
        String sql = "INSERT INTO sources (name, url, enabled, created_at, updated_at) VALUES (?, ?, ?, ?, ?)";
        long now = System.currentTimeMillis();
        synchronized (lock) {
            try (PreparedStatement ps = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
                ps.setString(1, name);
                ps.setString(2, url);
                ps.setInt(3, enabled ? 1 : 0);
                ps.setLong(4, now);
                ps.setLong(5, now);
                ps.executeUpdate();
                try (ResultSet keys = ps.getGeneratedKeys()) {
                    if (!keys.next()) {
                        throw new SQLException("No id generated for source " + url);
                    }
                    long id = keys.getLong(1);
                    log.info("Added source {} ({})", name, url);
                    return new Source(id, name, url, enabled, Instant.ofEpochMilli(now), Instant.ofEpochMilli(now));
                }
            } catch (SQLException e) {
                throw new StoreException("Failed to create source " + url, e);
            }
        }
    }

    @Override
    public Optional<Source> getSource(long id) {
        return querySources("SELECT * FROM sources WHERE id = ?", id).stream().findFirst();
    }

    @Override
    public Optional<Source> findSourceByUrl(String url) {
        return querySources("SELECT * FROM sources WHERE url = ?", url).stream().findFirst();
    }

    @Override
    public List<Source> listSources() {
        return querySources("SELECT * FROM sources ORDER BY id");
    }

    @Override
    public List<Source> listEnabledSources() {
        return querySources("SELECT * FROM sources WHERE enabled = 1 ORDER BY id");
    }

    @Override
    public boolean deleteSource(long id) {
        return deleteById("sources", id);
    }

    @Override
    public int countSources(boolean enabledOnly) {
        String sql = enabledOnly
            ? "SELECT COUNT(*) FROM sources WHERE enabled = 1"
            : "SELECT COUNT(*) FROM sources";
        synchronized (lock) {
            try (Statement stmt = conn.createStatement(); ResultSet rs = stmt.executeQuery(sql)) {
                return rs.next() ? rs.getInt(1) : 0;
            } catch (SQLException e) {
                throw new StoreException("Failed to count sources", e);
            }
        }
    }

    private List<Source> querySources(String sql, Object... params) {
        List<Source> sources = new ArrayList<>();
        synchronized (lock) {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                for (int i = 0; i < params.length; i++) {
                    ps.setObject(i + 1, params[i]);
                }
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        sources.add(new Source(
                            rs.getLong("id"),
                            rs.getString("name"),
                            rs.getString("url"),
                            rs.getInt("enabled") == 1,
                            Instant.ofEpochMilli(rs.getLong("created_at")),
                            Instant.ofEpochMilli(rs.getLong("updated_at"))
                        ));
                    }
                }
            } catch (SQLException e) {
                throw new StoreException("Failed to query sources", e);
            }
        }
        return sources;
    }

    // === Settings ===

    @Override
    public Map<String, String> loadSettings() {
        Map<String, String> settings = new LinkedHashMap<>();
        synchronized (lock) {
            try (Statement stmt = conn.createStatement();
                 ResultSet rs = stmt.executeQuery("SELECT key, value FROM settings ORDER BY key")) {
                while (rs.next()) {
                    settings.put(rs.getString("key"), rs.getString("value"));
                }
            } catch (SQLException e) {
                throw new StoreException("Failed to load settings", e);
            }
        }
        return settings;
    }

    @Override
    public void putSetting(String key, String value) {
        writeSetting("""
            INSERT INTO settings (key, value, updated_at) VALUES (?, ?, ?)
            ON CONFLICT(key) DO UPDATE SET value = excluded.value, updated_at = excluded.updated_at
            """, key, value);
    }

    @Override
    public void putSettingIfAbsent(String key, String value) {
        writeSetting("""
            INSERT INTO settings (key, value, updated_at) VALUES (?, ?, ?)
            ON CONFLICT(key) DO NOTHING
            """, key, value);
    }

    private void writeSetting(String sql, String key, String value) {
        synchronized (lock) {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, key);
                ps.setString(2, value == null ? "" : value);
                ps.setLong(3, System.currentTimeMillis());
                ps.executeUpdate();
            } catch (SQLException e) {
                throw new StoreException("Failed to write setting " + key, e);
            }
        }
    }

    // === Helpers ===

    private boolean deleteById(String table, long id) {
        synchronized (lock) {
            try (PreparedStatement ps = conn.prepareStatement("DELETE FROM " + table + " WHERE id = ?")) {
                ps.setLong(1, id);
                return ps.executeUpdate() > 0;
            } catch (SQLException e) {
                throw new StoreException("Failed to delete from " + table + ": " + id, e);
            }
        }
    }

    private static long toMillis(Instant instant) {
        return instant.toEpochMilli();
    }

    private static Long toMillisOrNull(Instant instant) {
        return instant != null ? instant.toEpochMilli() : null;
    }

    private static Instant fromMillis(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : Instant.ofEpochMilli(value);
    }

    @Override
    public void close() {
        synchronized (lock) {
            try {
                conn.close();
                log.info("Closed news database");
            } catch (SQLException e) {
                log.warn("Failed to close database: {}", e.getMessage());
            }
        }
    }
}
