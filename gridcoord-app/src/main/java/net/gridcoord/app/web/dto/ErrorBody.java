package net.gridcoord.app.web.dto;

public record ErrorBody(String code, String message) {}
