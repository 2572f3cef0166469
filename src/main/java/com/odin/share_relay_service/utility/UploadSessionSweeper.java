package com.odin.share_relay_service.utility;

import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import com.odin.share_relay_service.component.UploadComponent;

import lombok.extern.slf4j.Slf4j;

@Slf4j
@Component
public class UploadSessionSweeper {
    
    private final UploadComponent uploadComponent;

    public UploadSessionSweeper(UploadComponent uploadComponent) {
        this.uploadComponent = uploadComponent;
    }

    @Scheduled(fixedDelayString = "${share.relay.sweep-interval-ms:60000}")
    public void abandonIdleSessions() {
        int abandoned = uploadComponent.abandonIdleSessions();
        if (abandoned > 0) {
            log.info("UploadSessionSweeper: abandoned {} idle upload sessions", abandoned);
        }
    }
}
