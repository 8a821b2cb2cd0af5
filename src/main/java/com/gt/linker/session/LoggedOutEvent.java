package com.gt.linker.session;

public record LoggedOutEvent(Long previousOwnerId) { }
