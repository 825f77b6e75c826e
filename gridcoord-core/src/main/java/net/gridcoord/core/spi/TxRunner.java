package net.gridcoord.core.spi;

import java.util.concurrent.Callable;

/** 저장소 호출을 하나의 트랜잭션으로 묶는다. 진행 중인 트랜잭션이 있으면 참여한다 */
public interface TxRunner {
    <T> T required(Callable<T> body) throws Exception;
    default void required(Runnable body) throws Exception { required(() -> { body.run(); return null; }); }
}
