package net.gridcoord.core.error;

public class NotFoundException extends CoordinatorException {
    public NotFoundException(String message) {
        super(ErrorCode.NOT_FOUND, message);
    }
}
