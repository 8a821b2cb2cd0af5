package com.gt.linker.reconcile.model;

import java.time.Instant;
import java.util.List;

public record SyncStatus(boolean syncing, int pendingCount, Instant lastSyncInstant, List<String> recentErrors) { }
