package org.example.progress.entity;

public enum MediumFormat {
    PAPER,
    EBOOK,
    AUDIO;

    public boolean isPageBased() {
        return this != AUDIO;
    }
}
