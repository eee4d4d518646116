package uk.gegc.creatorbilling.shared.exception;

/**
 * No authenticated principal could be resolved for the request.
 */
public class UnauthorizedException extends RuntimeException {
    public UnauthorizedException(String message) {
        super(message);
    }
}
