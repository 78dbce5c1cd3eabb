/**
 * 
 */
package hep.afw;

import java.io.IOException;

/**
 * Pipeline exception with error code classification.
 * This allows callers to distinguish chunk-local failures from run-level ones.
 */
public class PipelineException extends IOException {

    private final ErrorCode errorCode;
    private final Object context;

    public PipelineException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
        this.context = null;
    }

    public PipelineException(ErrorCode errorCode, String additionalMessage) {
        super(errorCode.getMessage() + " - " + additionalMessage);
        this.errorCode = errorCode;
        this.context = null;
    }

    public PipelineException(ErrorCode errorCode, String additionalMessage, Object context) {
        super(errorCode.getMessage() + " - " + additionalMessage);
        this.errorCode = errorCode;
        this.context = context;
    }

    public PipelineException(ErrorCode errorCode, String additionalMessage, Throwable cause) {
        super(errorCode.getMessage() + " - " + additionalMessage, cause);
        this.errorCode = errorCode;
        this.context = null;
    }

    /**
     * Get the error code for this exception
     * @return the error code
     */
    public ErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * Get the context object associated with this exception, typically the chunk
     * reference, histogram name or skim record involved
     * @return the context object, or null if not available
     */
    public Object getContext() {
        return context;
    }

    public boolean isErrorCode(ErrorCode code) {
        return this.errorCode == code;
    }

    public boolean isFatal() {
        return errorCode.isFatal();
    }

    public static PipelineException data(String fmt, Object... args) {
        return new PipelineException(ErrorCode.DATA_ERROR, String.format(fmt, args));
    }

    @Override
    public String toString() {
        return "PipelineException{" +
                "errorCode=" + errorCode +
                ", message=" + getMessage() +
                ", context=" + context +
                '}';
    }
}
