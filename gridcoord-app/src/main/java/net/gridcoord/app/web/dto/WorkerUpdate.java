package net.gridcoord.app.web.dto;

/** null 필드는 건드리지 않는다 */
public record WorkerUpdate(Boolean paused, Boolean maintenance, Boolean resetFaults) {}
