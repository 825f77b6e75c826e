package net.gridcoord.app.web.dto;

public record PopRequest(String workerId, WorkerSpec capabilities) {}
