package com.newsdigest.news.store;

import com.newsdigest.news.model.Article;

/**
 * Result of a find-or-create: the row as stored, and whether this call inserted it.
 */
public record StoredArticle(Article article, boolean created) {}
