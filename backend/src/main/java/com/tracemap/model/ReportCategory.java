package com.tracemap.model;

public enum ReportCategory {
    INAPPROPRIATE("Inappropriate Content"),
    SPAM("Spam/Fake Content"),
    TECHNICAL("Technical Issue"),
    OTHER("Other");

    private final String label;

    ReportCategory(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
