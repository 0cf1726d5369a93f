package com.wordhmm.server.ai;

public class LabeledUtterance {
    public final String utteranceId;
    public final String label;
    public final double[][] emissions;

    public LabeledUtterance(String utteranceId, String label, double[][] emissions) {
        this.utteranceId = utteranceId;
        this.label = label;
        this.emissions = emissions;
    }
}
