package com.agentrelay.workflow;

public record FallbackAttempt(String agent, String errorType, String error) {}
