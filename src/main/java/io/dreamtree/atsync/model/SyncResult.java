package io.dreamtree.atsync.model;

import java.util.List;

/** Outcome of one sync run. {@code succeeded + failed == attempted}. */
public record SyncResult(
    int attempted,
    int succeeded,
    int failed,
    int created,
    int updated,
    List<SyncFailure> failures,
    long syncedAt) {}
