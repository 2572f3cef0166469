package com.odin.share_relay_service.entity;

public enum ShareKind {
    FILE,
    COLLECTION
}
