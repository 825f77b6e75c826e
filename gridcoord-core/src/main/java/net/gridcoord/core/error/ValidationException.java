package net.gridcoord.core.error;

/** 요청 형식 오류. 재시도 대상 아님 */
public class ValidationException extends CoordinatorException {
    public ValidationException(String message) {
        super(ErrorCode.VALIDATION, message);
    }
}
