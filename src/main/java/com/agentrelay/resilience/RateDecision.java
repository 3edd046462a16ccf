package com.agentrelay.resilience;

import java.time.Instant;

/**
 * @param remaining slots left in the window after this decision
 * @param resetAt   when the oldest recorded call leaves the window
 */
public record RateDecision(boolean allowed, int remaining, Instant resetAt) {}
