package com.ukboards.network.http;

public class QueryTrialsExhaustedException extends RuntimeException {
    private final String url;
    private final int trials;

    public QueryTrialsExhaustedException(int trials, String url) {
        super("Failed " + trials + " attempt(s) querying " + url);
        this.url = url;
        this.trials = trials;
    }

    public String getUrl() {
        return url;
    }

    public int getTrials() {
        return trials;
    }
}
