package net.gridcoord.core.spi;

import net.gridcoord.core.model.Worker;

import java.util.List;
import java.util.Optional;

public interface WorkerRepository {
    void insert(Worker worker) throws Exception;

    Optional<Worker> findById(String id) throws Exception;

    Optional<Worker> findByName(String name) throws Exception;

    /** SELECT ... FOR UPDATE. 같은 워커에 대한 리스 부여를 트랜잭션 끝까지 직렬화한다 */
    Optional<Worker> lockById(String id) throws Exception;

    List<Worker> findAll() throws Exception;

    /** 카운터 갱신은 레코드 단위 CAS. 전역 카운터를 두지 않는다. */
    boolean update(Worker worker, long expectedVersion) throws Exception;
}
