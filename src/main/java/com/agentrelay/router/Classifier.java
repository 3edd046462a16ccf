package com.agentrelay.router;

@FunctionalInterface
public interface Classifier {
    Classification classify(String text);
}
