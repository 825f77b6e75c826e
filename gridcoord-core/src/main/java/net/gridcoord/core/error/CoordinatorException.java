package net.gridcoord.core.error;

/**
 * 코디네이터가 호출자에게 드러내는 오류의 공통 부모.
 * 매칭 불가(Ineligible)는 예외가 아니라 빈 결과로, stale abort는 내부 전이로 처리된다.
 */
public abstract class CoordinatorException extends RuntimeException {
    private final ErrorCode code;

    protected CoordinatorException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public ErrorCode code() {
        return code;
    }
}
