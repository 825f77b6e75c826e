package net.gridcoord.app.web.dto;

public record ProgressRequest(String workerId, String id, int currentStep, int totalSteps) {}
