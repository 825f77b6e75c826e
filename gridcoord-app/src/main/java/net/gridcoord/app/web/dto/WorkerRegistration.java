package net.gridcoord.app.web.dto;

public record WorkerRegistration(String name, WorkerSpec capabilities) {}
