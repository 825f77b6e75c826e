package net.gridcoord.core.spi;

import net.gridcoord.core.model.JobRequest;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface JobRequestRepository {
    void insert(JobRequest request) throws Exception;

    Optional<JobRequest> findById(String id) throws Exception;

    /** 같은 요청의 슬롯 종료 전이를 직렬화하기 위한 행 잠금 조회 (트랜잭션 범위) */
    Optional<JobRequest> lockById(String id) throws Exception;

    /** 낙관적 갱신: 저장된 version이 expectedVersion일 때만 반영하고 version+1. 경합에서 지면 false */
    boolean update(JobRequest request, long expectedVersion) throws Exception;

    /** 아직 ACTIVE이고 닫히지 않았는데 expiresAt이 지난 요청 */
    List<JobRequest> findOpenExpiredAt(Instant now, int limit) throws Exception;

    /** finishedAt < threshold 인 종료 요청과 그 슬롯 삭제. 삭제한 요청 수 */
    int deleteFinishedBefore(Instant threshold) throws Exception;
}
