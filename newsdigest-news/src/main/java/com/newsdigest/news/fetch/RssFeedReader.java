package com.newsdigest.news.fetch;

import com.rometools.rome.feed.synd.SyndContent;
import com.rometools.rome.feed.synd.SyndEntry;
import com.rometools.rome.feed.synd.SyndFeed;
import com.rometools.rome.io.FeedException;
import com.rometools.rome.io.SyndFeedInput;
import com.rometools.rome.io.XmlReader;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.jsoup.Jsoup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;

/**
 * Reads RSS and Atom feeds over HTTP with ROME.
 */
public class RssFeedReader implements FeedReader {

    private static final Logger log = LoggerFactory.getLogger(RssFeedReader.class);
    private static final String USER_AGENT = "newsdigest/1.0 (+rss)";

    private final OkHttpClient httpClient;

    public RssFeedReader() {
        this(new OkHttpClient.Builder()
            .connectTimeout(Duration.ofSeconds(10))
            .readTimeout(Duration.ofSeconds(30))
            .followRedirects(true)
            .build());
    }

    public RssFeedReader(OkHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public List<FeedEntry> read(String feedUrl) throws FeedFetchException {
        Request request;
        try {
            request = new Request.Builder()
                .url(feedUrl)
                .header("User-Agent", USER_AGENT)
                .header("Accept", "application/rss+xml, application/atom+xml, application/xml, text/xml, */*")
                .get()
                .build();
        } catch (IllegalArgumentException e) {
            throw new FeedFetchException(feedUrl, "Invalid feed URL: " + feedUrl, e);
        }

        byte[] bytes;
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new FeedFetchException(feedUrl, "Feed returned HTTP " + response.code() + ": " + feedUrl);
            }
            ResponseBody body = response.body();
            bytes = body != null ? body.bytes() : new byte[0];
        } catch (IOException e) {
            throw new FeedFetchException(feedUrl, "Failed to download feed " + feedUrl + ": " + e.getMessage(), e);
        }

        SyndFeed feed;
        try {
            feed = new SyndFeedInput().build(new XmlReader(new ByteArrayInputStream(bytes)));
        } catch (FeedException | IOException | IllegalArgumentException e) {
            throw new FeedFetchException(feedUrl, "Failed to parse feed " + feedUrl + ": " + e.getMessage(), e);
        }

        List<FeedEntry> entries = new ArrayList<>();
        for (SyndEntry entry : feed.getEntries()) {
            entries.add(toEntry(entry));
        }
        log.debug("Read {} entries from {}", entries.size(), feedUrl);
        return entries;
    }

    private FeedEntry toEntry(SyndEntry entry) {
        String title = entry.getTitle() != null ? entry.getTitle().trim() : "";
        String link = entry.getLink() != null ? entry.getLink().trim() : "";
        return new FeedEntry(title, link, extractContent(entry), extractDate(entry));
    }

    private String extractContent(SyndEntry entry) {
        // Description first, then the first content block
        if (entry.getDescription() != null && entry.getDescription().getValue() != null) {
            return stripHtml(entry.getDescription().getValue());
        }
        if (entry.getContents() != null && !entry.getContents().isEmpty()) {
            SyndContent content = entry.getContents().get(0);
            if (content.getValue() != null) {
                return stripHtml(content.getValue());
            }
        }
        return "";
    }

    private Instant extractDate(SyndEntry entry) {
        Date date = entry.getPublishedDate() != null ? entry.getPublishedDate() : entry.getUpdatedDate();
        return date != null ? date.toInstant() : null;
    }

    static String stripHtml(String html) {
        if (html == null || html.isBlank()) return "";
        return Jsoup.parse(html).text();
    }
}
