package com.newsdigest.news.store;

import com.newsdigest.ai.SettingsSource;
import com.newsdigest.news.model.Article;
import com.newsdigest.news.model.ArticleStatus;
import com.newsdigest.news.model.Source;

import java.util.List;
import java.util.Optional;

/**
 * Storage for sources, articles and settings.
 * Every method is safe to call from several threads at once.
 */
public interface NewsStore extends SettingsSource, AutoCloseable {

    // === Articles ===

    /**
     * Insert the candidate unless an article with the same link exists.
     * Concurrent callers with the same link produce exactly one row and exactly one {@code created}.
     */
    StoredArticle findOrCreateArticle(Article candidate);

    List<Article> findArticles(ArticleQuery query);

    Optional<Article> getArticle(long id);

    /**
     * @param status filter, or null for all articles
     */
    int countArticles(ArticleStatus status);

    /**
     * Update an existing article by id.
     */
    void saveArticle(Article article);

    boolean deleteArticle(long id);

    // === Sources ===

    Source createSource(String name, String url, boolean enabled);

    Optional<Source> getSource(long id);

    Optional<Source> findSourceByUrl(String url);

    List<Source> listSources();

    List<Source> listEnabledSources();

    boolean deleteSource(long id);

    int countSources(boolean enabledOnly);

    // === Settings ===

    /**
     * Upsert; the last write wins.
     */
    void putSetting(String key, String value);

    /**
     * Insert only when the key is absent, leaving user edits untouched.
     */
    void putSettingIfAbsent(String key, String value);

    @Override
    void close();
}
