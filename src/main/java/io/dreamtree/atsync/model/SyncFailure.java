package io.dreamtree.atsync.model;

public record SyncFailure(String recordId, String reason) {}
