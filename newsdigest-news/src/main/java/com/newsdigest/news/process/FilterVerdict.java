package com.newsdigest.news.process;

/**
 * The filter stage's decision for one article.
 */
public record FilterVerdict(boolean worth, String reason) {

    public FilterVerdict {
        if (reason == null) reason = "";
    }
}
