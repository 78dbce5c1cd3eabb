/**
 * 
 */
package hep.afw;

/**
 * Error codes for pipeline operations
 */
public enum ErrorCode {
    // Chunk-local data errors (-1000 to -1999)
    DATA_ERROR(-1000, "Malformed or missing event data", false),
    STAGE_CONTRACT_VIOLATION(-1001, "Stage broke its declared contract", false),

    // Accumulator errors (-2000 to -2999)
    SCHEMA_MISMATCH(-2000, "Accumulator schema mismatch", true),
    SERIALIZATION_VERSION(-2001, "Unsupported accumulator serialization version", true),

    // Storage errors (-4000 to -4999)
    STORAGE_ERROR(-4000, "Skim storage error", false),
    STORAGE_OUTAGE(-4001, "Shared skim storage unavailable", true),
    STORAGE_LOCALITY(-4002, "Node-local skim storage used for multi-node execution", true),
    DUPLICATE_RECORD(-4003, "Skim record already persisted for chunk", false),
    RECONSTRUCTION_ERROR(-4004, "Baseline skim cannot be resolved", true),

    // General errors (-9000 to -9999)
    INVALID_CONFIGURATION(-9000, "Invalid configuration", true),
    CANCELLED(-9001, "Chunk task cancelled", false),
    INTERNAL_ERROR(-9002, "Internal error", true);

    private final int code;
    private final String message;
    private final boolean fatal;

    ErrorCode(int code, String message, boolean fatal) {
        this.code = code;
        this.message = message;
        this.fatal = fatal;
    }

    public int getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    /**
     * Fatal codes abort the whole run; the others are isolated to one chunk.
     */
    public boolean isFatal() {
        return fatal;
    }
}
