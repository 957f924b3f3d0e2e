package com.carepilot.orchestrator.inference;

/**
 * @param model       model identifier, e.g. "llama-3.3-70b-versatile"
 * @param temperature sampling temperature
 * @param maxTokens   completion token cap
 */
public record ModelParameters(String model, double temperature, int maxTokens) {}
