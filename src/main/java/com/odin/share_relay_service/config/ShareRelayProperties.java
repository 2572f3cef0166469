package com.odin.share_relay_service.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Configuration properties for the upload pipeline, the durable item store
 * and the paged delivery of shares.
 *
 * All values are externalized in application.properties under {@code share.relay.*}.
 */
@Data
@Component
@ConfigurationProperties(prefix = "share.relay")
public class ShareRelayProperties {

    /**
     * Base directory of the durable item store.
     * Every relayed item gets its own folder named after its item key.
     *
     * Default: ./share-store
     */
    private String storeDir = "./share-store";

    /**
     * Maximum size accepted for a single relayed item in bytes.
     *
     * Default: 52428800 (50 MB)
     */
    private long maxItemSize = 52428800L; // 50 MB

    /**
     * Blocked file extensions (comma-separated).
     *
     * Default: exe,bat,sh,cmd,ps1,vbs,jar
     */
    private String blockedExtensions = "exe,bat,sh,cmd,ps1,vbs,jar";

    /**
     * Number of items (or list rows) shown per page.
     *
     * Default: 10
     */
    private int pageSize = 10;

    /**
     * Quiet period after the last item of a media group before the group is relayed.
     *
     * Default: 2 seconds
     */
    private Duration groupDebounce = Duration.ofSeconds(2);

    /**
     * Delay between delivering a page of items and rendering its navigation panel,
     * so the items show up above the controls.
     *
     * Default: 3 seconds
     */
    private Duration panelSettleDelay = Duration.ofSeconds(3);

    /**
     * Prefix of public share links. The share token is appended as-is.
     *
     * Example: https://share.example.com/s/AbCdEfGh123
     */
    private String linkBase = "https://share.example.com/s/";

    /**
     * How long a token that failed the gate is remembered for a retry.
     *
     * Default: 1 day
     */
    private Duration pendingTokenTtl = Duration.ofDays(1);

    /**
     * Collecting sessions idle for longer than this are abandoned by the sweeper.
     *
     * Default: 2 hours
     */
    private Duration sessionIdleTtl = Duration.ofHours(2);

    /**
     * Worker threads shared by all principal lanes (storage, gate and transport calls).
     *
     * Default: 8
     */
    private int laneWorkers = 8;

    /**
     * Threads firing debounce and settle timers.
     *
     * Default: 2
     */
    private int timerThreads = 2;

    /**
     * Characters of a caption shown in the owner's share list.
     *
     * Default: 25
     */
    private int listCaptionLength = 25;

    /**
     * Redis key prefix for viewer state.
     *
     * Full key format: {prefix}:pending:{principalId}
     */
    private String redisKeyPrefix = "share-relay";

    /**
     * Whether share-created audit events are published to Kafka.
     */
    private boolean auditEnabled = true;
}
