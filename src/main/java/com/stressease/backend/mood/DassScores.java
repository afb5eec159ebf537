package com.stressease.backend.mood;

/**
 * Today's single-item depression / anxiety / stress answers, each on the 1-5 quiz scale.
 */
public record DassScores(int depression, int anxiety, int stress) {
}
