package net.gridcoord.core.error;

/** 리스 보유자가 아니거나 이미 종료된 슬롯에 대한 제출. 슬롯 상태는 바뀌지 않는다 */
public class LeaseMismatchException extends CoordinatorException {
    public LeaseMismatchException(String message) {
        super(ErrorCode.LEASE_MISMATCH, message);
    }
}
