package net.gridcoord.core.spi;

import net.gridcoord.core.model.AccountVerdict;

import java.util.Optional;

/** 외부 Account 서비스: API 키 → 계정/신뢰 등급. 유효하지 않으면 empty */
public interface AccountService {
    Optional<AccountVerdict> authenticate(String apiKey) throws Exception;
}
