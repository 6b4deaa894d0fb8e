package net.storefleet.core.lifecycle;

public record IntakeReceipt(long tenantId, long jobId, long serverId) { }
