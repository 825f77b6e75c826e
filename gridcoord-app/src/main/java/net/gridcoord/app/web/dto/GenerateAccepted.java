package net.gridcoord.app.web.dto;

public record GenerateAccepted(String id) {}
