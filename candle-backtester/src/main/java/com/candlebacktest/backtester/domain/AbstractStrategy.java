package com.candlebacktest.backtester.domain;

/**
 * Base class holding the execution client a strategy trades through.
 */
public abstract class AbstractStrategy implements Strategy {

    private final ExecutionClient executionClient;

    protected AbstractStrategy(ExecutionClient executionClient) {
        if (executionClient == null) {
            throw new IllegalArgumentException("Execution client is required");
        }
        this.executionClient = executionClient;
    }

    @Override
    public ExecutionClient getExecutionClient() {
        return executionClient;
    }

    protected String base() {
        return getState().getBase();
    }
}
