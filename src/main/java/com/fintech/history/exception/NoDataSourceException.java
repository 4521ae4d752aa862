package com.fintech.history.exception;

import java.util.List;

/**
 * Every shard a query needed was unavailable.
 */
public class NoDataSourceException extends HistoryQueryException {

    private final List<String> unavailableShards;

    public NoDataSourceException(String message, List<String> unavailableShards) {
        super(ErrorCode.NO_DATA_SOURCE, message);
        this.unavailableShards = List.copyOf(unavailableShards);
    }

    public List<String> getUnavailableShards() {
        return unavailableShards;
    }
}
