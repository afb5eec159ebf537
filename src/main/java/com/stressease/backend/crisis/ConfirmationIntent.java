package com.stressease.backend.crisis;

public enum ConfirmationIntent {
    AFFIRMATIVE,
    NEGATIVE,
    UNCLEAR
}
