package net.gridcoord.adapter.memory;

import net.gridcoord.core.spi.TxRunner;

import java.util.concurrent.Callable;

public final class InMemoryTxRunner implements TxRunner {

    @Override
    public <T> T required(Callable<T> body) throws Exception {
        if (MemoryTxContext.get() != null) {
            // 이미 진행 중인 범위에 참여
            return body.call();
        }
        MemoryTxContext ctx = MemoryTxContext.open();
        try {
            return body.call();
        } finally {
            ctx.releaseAll();
            MemoryTxContext.set(null);
        }
    }
}
