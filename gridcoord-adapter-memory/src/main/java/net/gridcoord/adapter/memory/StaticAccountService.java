package net.gridcoord.adapter.memory;

import net.gridcoord.core.model.AccountVerdict;
import net.gridcoord.core.spi.AccountService;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** 고정된 API 키 목록으로 인증하는 AccountService (설정 카탈로그/테스트용) */
public final class StaticAccountService implements AccountService {
    private final Map<String, AccountVerdict> byKey = new ConcurrentHashMap<>();

    public StaticAccountService put(String apiKey, String accountId, int trustTier) {
        byKey.put(apiKey, new AccountVerdict(accountId, trustTier));
        return this;
    }

    public int size() {
        return byKey.size();
    }

    @Override
    public Optional<AccountVerdict> authenticate(String apiKey) {
        if (apiKey == null) return Optional.empty();
        return Optional.ofNullable(byKey.get(apiKey));
    }
}
