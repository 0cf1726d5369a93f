package com.wordhmm.db;

public class Utterance {
    private final long id;
    private final String utteranceRelPath;
    private final String contentHash;
    private final long createdTs;

    public Utterance(long id, String utteranceRelPath, String contentHash, long createdTs) {
        this.id = id;
        this.utteranceRelPath = utteranceRelPath;
        this.contentHash = contentHash;
        this.createdTs = createdTs;
    }

    public long getId() {
        return id;
    }

    public String getUtteranceRelPath() {
        return utteranceRelPath;
    }

    public String getContentHash() {
        return contentHash;
    }

    public long getCreatedTs() {
        return createdTs;
    }

    @Override
    public String toString() {
        return "Utterance{id=" + id + ", path='" + utteranceRelPath + "'}";
    }
}
