package net.gridcoord.bootstrap.catalog;

import net.gridcoord.adapter.memory.StaticAccountService;
import net.gridcoord.bootstrap.props.GridCoordProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/** 설정의 API 키 목록으로 계정 서비스를 만든다. 키 값은 로그에 남기지 않는다. */
public final class AccountCatalog {
    private static final Logger log = LoggerFactory.getLogger(AccountCatalog.class);

    private AccountCatalog() {}

    public static StaticAccountService load(List<GridCoordProperties.Account> accounts) {
        var service = new StaticAccountService();
        Set<String> ids = new HashSet<>();
        for (var a : accounts) {
            if (a.getKey() == null || a.getKey().isBlank() || a.getAccountId() == null || a.getAccountId().isBlank()) {
                throw new IllegalArgumentException("accounts[].key and accounts[].account-id are required: " + a);
            }
            if (a.getTrustTier() < 0) {
                throw new IllegalArgumentException("accounts[].trust-tier must not be negative: " + a);
            }
            service.put(a.getKey(), a.getAccountId(), a.getTrustTier());
            ids.add(a.getAccountId());
        }
        if (service.size() != accounts.size()) {
            throw new IllegalArgumentException("duplicate api key in gridcoord.accounts");
        }
        if (accounts.isEmpty()) {
            log.warn("No API keys configured (gridcoord.accounts); every client request will be rejected");
        } else {
            log.info("Account catalog loaded: {} key(s) for {} account(s)", service.size(), ids.size());
        }
        return service;
    }
}
