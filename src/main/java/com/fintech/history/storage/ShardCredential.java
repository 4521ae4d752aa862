package com.fintech.history.storage;

/**
 * Pre-resolved secret used to open encrypted shards. Where it comes from is the caller's concern.
 */
public final class ShardCredential {

    private static final ShardCredential NONE = new ShardCredential(null);

    private final String secret;

    private ShardCredential(String secret) {
        this.secret = secret;
    }

    public static ShardCredential of(String secret) {
        return secret == null || secret.isBlank() ? NONE : new ShardCredential(secret);
    }

    public static ShardCredential none() {
        return NONE;
    }

    public boolean isPresent() {
        return secret != null;
    }

    /**
     * Statement that unlocks a shard for this credential, or null when none is configured.
     * Stores without at-rest encryption ignore the pragma.
     */
    String keyPragma() {
        if (secret == null) {
            return null;
        }
        return "PRAGMA key = '" + secret.replace("'", "''") + "'";
    }

    @Override
    public String toString() {
        return isPresent() ? "ShardCredential[****]" : "ShardCredential[none]";
    }
}
