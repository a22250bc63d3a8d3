package com.telcobright.archive.core.routing;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * A compiled dispatch routine: the generated CREATE OR REPLACE FUNCTION
 * statement together with the content hash that identifies its version.
 */
public final class DispatchRoutine {

    /**
     * Prefix of the comment that records the installed version on the routine
     */
    public static final String HASH_COMMENT_PREFIX = "dispatch-sha256:";

    private final DispatchTable table;
    private final DispatchStrategy strategy;
    private final String source;
    private final String hash;

    public DispatchRoutine(DispatchTable table, DispatchStrategy strategy, String source) {
        this.table = table;
        this.strategy = strategy;
        this.source = source;
        this.hash = sha256(source);
    }

    public DispatchTable getTable() {
        return table;
    }

    public DispatchStrategy getStrategy() {
        return strategy;
    }

    public String getSource() {
        return source;
    }

    public String getHash() {
        return hash;
    }

    public String getHashComment() {
        return HASH_COMMENT_PREFIX + hash;
    }

    /**
     * Whether a comment read back from the store names this exact version.
     */
    public boolean matchesComment(String comment) {
        return comment != null && comment.equals(getHashComment());
    }

    private static String sha256(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
