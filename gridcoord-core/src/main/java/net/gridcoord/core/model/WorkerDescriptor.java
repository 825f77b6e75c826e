package net.gridcoord.core.model;

public record WorkerDescriptor(
        String ownerId,
        String name,
        WorkerCapabilities capabilities
) {}
