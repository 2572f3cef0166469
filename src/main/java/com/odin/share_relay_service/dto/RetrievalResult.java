package com.odin.share_relay_service.dto;

public enum RetrievalResult {
    DELIVERED,
    UNCHANGED,
    NOT_FOUND,
    UNAUTHORIZED,
    FAILED
}
