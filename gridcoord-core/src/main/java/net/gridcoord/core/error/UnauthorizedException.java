package net.gridcoord.core.error;

public class UnauthorizedException extends CoordinatorException {
    public UnauthorizedException(String message) {
        super(ErrorCode.UNAUTHORIZED, message);
    }
}
