package com.newsdigest.news.store;

import com.newsdigest.news.model.ArticleStatus;

import java.util.Set;

/**
 * Article listing filter. Results are always newest first by publication date.
 *
 * @param status     only this status, or all when null
 * @param excludeIds ids to leave out (items already attempted in the current drain)
 */
public record ArticleQuery(
    ArticleStatus status,
    Set<Long> excludeIds,
    int offset,
    int limit
) {
    public ArticleQuery {
        excludeIds = excludeIds == null ? Set.of() : Set.copyOf(excludeIds);
        if (offset < 0) offset = 0;
        if (limit <= 0) limit = 20;
    }

    public static ArticleQuery pending(int limit, Set<Long> excludeIds) {
        return new ArticleQuery(ArticleStatus.PENDING, excludeIds, 0, limit);
    }

    public static ArticleQuery page(ArticleStatus status, int page, int pageSize) {
        int safePage = Math.max(page, 1);
        return new ArticleQuery(status, Set.of(), (safePage - 1) * pageSize, pageSize);
    }
}
