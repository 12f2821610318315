package com.codingbridge.client.model;

/** Context-window accounting reported by {@code token-budget} frames. Each report replaces the previous one. */
public record TokenUsage(int used, int total) {

    public double fraction() {
        return total <= 0 ? 0.0 : (double) used / total;
    }
}
