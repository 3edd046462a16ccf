package com.agentrelay.router;

@FunctionalInterface
public interface LocalHandler {
    String handle(String taskText);
}
