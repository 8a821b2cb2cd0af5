package com.gt.linker.reconcile.model;

public enum ConflictReason {
    RemoteUnreachable,
    RemoteRejected,
    Unidentifiable,
    Cancelled
}
