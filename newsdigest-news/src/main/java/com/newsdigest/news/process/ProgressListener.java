package com.newsdigest.news.process;

@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = snapshot -> { };

    void onProgress(ProgressSnapshot snapshot);
}
