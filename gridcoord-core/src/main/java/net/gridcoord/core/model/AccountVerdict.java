package net.gridcoord.core.model;

/** Account 서비스의 인증 결과 */
public record AccountVerdict(String accountId, int trustTier) {}
