package com.gt.linker.model;

public enum Origin {
    Local,
    Remote
}
