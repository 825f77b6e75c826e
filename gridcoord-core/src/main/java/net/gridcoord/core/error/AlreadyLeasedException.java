package net.gridcoord.core.error;

/** 동시 리스 경합에서 진 쪽이 받는다. 호출자는 poll을 다시 하면 된다 */
public class AlreadyLeasedException extends CoordinatorException {
    public AlreadyLeasedException(String message) {
        super(ErrorCode.ALREADY_LEASED, message);
    }
}
