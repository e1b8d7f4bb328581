package com.scrapouille.dashboard.batch.model;

public record BatchProgress(int completed, int total) {

    public int percentage() {
        if (total == 0) {
            return 0;
        }
        return (int) Math.round(completed * 100.0 / total);
    }
}
