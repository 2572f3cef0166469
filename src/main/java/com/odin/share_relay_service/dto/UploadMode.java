package com.odin.share_relay_service.dto;

public enum UploadMode {
    IDLE,
    COLLECTING
}
