package kr.jemi.zcassa.seal.api;

public class SealException extends RuntimeException {

    private final SealFailure failure;

    public SealException(SealFailure failure, String message) {
        super(message);
        this.failure = failure;
    }

    public SealException(SealFailure failure, String message, Throwable cause) {
        super(message, cause);
        this.failure = failure;
    }

    public SealFailure getFailure() {
        return failure;
    }
}
