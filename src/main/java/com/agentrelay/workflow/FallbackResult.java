package com.agentrelay.workflow;

import java.util.List;

/**
 * @param failedAttempts candidates tried before {@code agent} succeeded, in order
 */
public record FallbackResult(String agent, String text, List<FallbackAttempt> failedAttempts) {}
