package com.agentrelay.router;

/**
 * @param phrase the delegation phrase that matched, lower-cased
 */
public record DelegationRequest(String agentName, String taskText, String phrase) {}
