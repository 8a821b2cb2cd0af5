package com.gt.linker.session;

public record AuthenticatedEvent(long ownerId) { }
