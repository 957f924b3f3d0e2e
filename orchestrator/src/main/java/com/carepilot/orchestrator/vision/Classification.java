package com.carepilot.orchestrator.vision;

/**
 * Top label and its confidence as reported by the classifier.
 * Not range-checked here; the Imaging stage validates it.
 */
public record Classification(String label, double confidence) {}
