package com.example.latexmath.model;

public enum GenerationStatus {
    COMPLETED,
    PICKER_GAVE_UP,
    RETRIES_EXHAUSTED,
    STEP_LIMIT_REACHED
}
