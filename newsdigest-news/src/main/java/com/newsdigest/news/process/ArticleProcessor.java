package com.newsdigest.news.process;

import com.newsdigest.ai.ModelException;
import com.newsdigest.ai.ModelGateway;
import com.newsdigest.ai.SettingKeys;
import com.newsdigest.news.model.Article;
import com.newsdigest.news.model.ArticleStatus;
import com.newsdigest.news.store.NewsStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;

/**
 * Moves one PENDING article to a terminal state: filter first, then summarize the ones worth reading.
 * A gateway error leaves the article PENDING.
 */
public class ArticleProcessor {

    private static final Logger log = LoggerFactory.getLogger(ArticleProcessor.class);

    private final NewsStore store;
    private final ModelGateway gateway;
    private final FilterVerdictParser verdictParser;
    private final Clock clock;

    public ArticleProcessor(NewsStore store, ModelGateway gateway) {
        this(store, gateway, new FilterVerdictParser(), Clock.systemUTC());
    }

    public ArticleProcessor(NewsStore store, ModelGateway gateway, FilterVerdictParser verdictParser, Clock clock) {
        this.store = store;
        this.gateway = gateway;
        this.verdictParser = verdictParser;
        this.clock = clock;
    }

    /**
     * @return the article as saved, in state FILTERED or PROCESSED
     * @throws ModelException if either model call fails; nothing is saved in that case
     */
    public Article process(Article article) throws ModelException {
        if (article.status() != ArticleStatus.PENDING) {
            throw new IllegalStateException("Article " + article.id() + " is already " + article.status());
        }

        // Prompts are read per article so edits apply to the next item
        Map<String, String> settings = store.loadSettings();
        String filterPrompt = settings.getOrDefault(SettingKeys.PROMPT_FILTER, DefaultSettings.FILTER_PROMPT);
        String summaryPrompt = settings.getOrDefault(SettingKeys.PROMPT_SUMMARY, DefaultSettings.SUMMARY_PROMPT);
        String rejectMarker = settings.getOrDefault(SettingKeys.FILTER_REJECT_MARKER,
            FilterVerdictParser.DEFAULT_REJECT_MARKER);

        String input = article.modelInput();

        String filterReply = gateway.classify(filterPrompt, input);
        FilterVerdict verdict = verdictParser.parse(filterReply, rejectMarker);

        Article result;
        if (!verdict.worth()) {
            result = article.filtered(verdict.reason(), clock.instant());
            log.debug("Filtered article {}: {}", article.id(), verdict.reason());
        } else {
            String summary = gateway.summarize(summaryPrompt, input);
            result = article.processed(summary, clock.instant());
            log.debug("Summarized article {} ({} chars)", article.id(), summary.length());
        }

        store.saveArticle(result);
        return result;
    }
}
