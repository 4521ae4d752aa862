package com.fintech.history.exception;

/**
 * A specific shard could not be opened or borrowed. Transient: the shard is retried after its cool-down.
 */
public class ShardUnavailableException extends HistoryQueryException {

    private final String shardId;

    public ShardUnavailableException(String shardId, String message) {
        super(ErrorCode.SHARD_UNAVAILABLE, "Shard " + shardId + " unavailable: " + message);
        this.shardId = shardId;
    }

    public ShardUnavailableException(String shardId, String message, Throwable cause) {
        super(ErrorCode.SHARD_UNAVAILABLE, "Shard " + shardId + " unavailable: " + message, cause);
        this.shardId = shardId;
    }

    public String getShardId() {
        return shardId;
    }
}
