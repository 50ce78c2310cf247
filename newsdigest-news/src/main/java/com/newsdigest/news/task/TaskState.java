package com.newsdigest.news.task;

public enum TaskState {
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isDone() {
        return this != RUNNING;
    }
}
