package com.odin.share_relay_service.service;

import com.odin.share_relay_service.dto.DeleteOutcome;
import com.odin.share_relay_service.dto.ItemRef;
import com.odin.share_relay_service.entity.ShareKind;
import com.odin.share_relay_service.entity.ShareRecord;
import com.odin.share_relay_service.exception.ForbiddenException;
import com.odin.share_relay_service.exception.NotFoundException;
import com.odin.share_relay_service.exception.PersistenceException;
import com.odin.share_relay_service.exception.RelayException;
import com.odin.share_relay_service.repo.OffsetLimitRequest;
import com.odin.share_relay_service.repo.ShareRecordRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Sole owner of share records. Records are created once, read many times and deleted
 * whole by their owner.
 */
@Slf4j
@Service
public class ShareRegistry {

    static final int MAX_TOKEN_ATTEMPTS = 3;

    private static final Sort NEWEST_FIRST = Sort.by(Sort.Order.desc("createdAt"), Sort.Order.asc("shareToken"));

    private final ShareRecordRepository shareRecordRepository;
    private final ShareTokenGenerator tokenGenerator;
    private final RelayPipeline relayPipeline;
    private final Clock clock;

    public ShareRegistry(ShareRecordRepository shareRecordRepository,
                         ShareTokenGenerator tokenGenerator,
                         RelayPipeline relayPipeline,
                         Clock clock) {
        this.shareRecordRepository = shareRecordRepository;
        this.tokenGenerator = tokenGenerator;
        this.relayPipeline = relayPipeline;
        this.clock = clock;
    }

    /**
     * Persist a new share under a fresh token. A token collision is retried with a new token.
     *
     * @return the share token
     * @throws PersistenceException if the record could not be written
     */
    public String create(String ownerPrincipalId, List<ItemRef> itemRefs, String caption, ShareKind kind) {
        for (int attempt = 1; attempt <= MAX_TOKEN_ATTEMPTS; attempt++) {
            String token = tokenGenerator.next();
            ShareRecord record = ShareRecord.builder()
                    .shareToken(token)
                    .itemRefs(new ArrayList<>(itemRefs))
                    .ownerPrincipalId(ownerPrincipalId)
                    .caption(caption)
                    .kind(kind)
                    .createdAt(clock.instant())
                    .build();
            try {
                shareRecordRepository.saveAndFlush(record);
                log.info("[SHARE-REGISTRY] Created share token={} owner={} items={} kind={}",
                        token, ownerPrincipalId, itemRefs.size(), kind);
                return token;
            } catch (DataIntegrityViolationException e) {
                log.warn("[SHARE-REGISTRY] Token collision on attempt {} token={} owner={}", attempt, token, ownerPrincipalId);
            } catch (DataAccessException e) {
                log.error("[SHARE-REGISTRY] Failed to save share owner={} items={}: {}",
                        ownerPrincipalId, itemRefs.size(), e.getMessage(), e);
                throw new PersistenceException("Could not save share", e);
            }
        }
        throw new PersistenceException("No free share token after " + MAX_TOKEN_ATTEMPTS + " attempts");
    }

    /**
     * @throws NotFoundException if no share has this token
     */
    public ShareRecord lookup(String shareToken) {
        try {
            return shareRecordRepository.findById(shareToken)
                    .orElseThrow(() -> new NotFoundException("Share " + shareToken + " not found"));
        } catch (DataAccessException e) {
            log.error("[SHARE-REGISTRY] Lookup failed token={}: {}", shareToken, e.getMessage(), e);
            throw new PersistenceException("Could not read share " + shareToken, e);
        }
    }

    /**
     * Shares of an owner, newest first.
     */
    public List<ShareRecord> listByOwner(String ownerPrincipalId, int offset, int limit) {
        try {
            return shareRecordRepository.findByOwnerPrincipalId(ownerPrincipalId,
                    new OffsetLimitRequest(offset, limit, NEWEST_FIRST));
        } catch (DataAccessException e) {
            log.error("[SHARE-REGISTRY] Listing failed owner={}: {}", ownerPrincipalId, e.getMessage(), e);
            throw new PersistenceException("Could not list shares", e);
        }
    }

    public long countByOwner(String ownerPrincipalId) {
        try {
            return shareRecordRepository.countByOwnerPrincipalId(ownerPrincipalId);
        } catch (DataAccessException e) {
            log.error("[SHARE-REGISTRY] Count failed owner={}: {}", ownerPrincipalId, e.getMessage(), e);
            throw new PersistenceException("Could not count shares", e);
        }
    }

    /**
     * Delete a share on behalf of its owner, then retract its items from the store.
     * The row delete stands even when retraction fails; such failures come back as warnings.
     *
     * @throws NotFoundException if no share has this token
     * @throws ForbiddenException if {@code requesterPrincipalId} is not the owner
     */
    public DeleteOutcome delete(String shareToken, String requesterPrincipalId) {
        ShareRecord record = lookup(shareToken);
        if (!record.getOwnerPrincipalId().equals(requesterPrincipalId)) {
            log.warn("[SHARE-REGISTRY] Delete refused token={} requester={} owner={}",
                    shareToken, requesterPrincipalId, record.getOwnerPrincipalId());
            throw new ForbiddenException("Only the owner may delete share " + shareToken);
        }

        try {
            shareRecordRepository.delete(record);
        } catch (DataAccessException e) {
            log.error("[SHARE-REGISTRY] Delete failed token={}: {}", shareToken, e.getMessage(), e);
            throw new PersistenceException("Could not delete share " + shareToken, e);
        }

        List<String> warnings = new ArrayList<>();
        int retracted = 0;
        for (ItemRef ref : record.getItemRefs()) {
            try {
                relayPipeline.retract(ref);
                retracted++;
            } catch (RelayException e) {
                log.warn("[SHARE-REGISTRY] Retraction failed token={} item={}: {}", shareToken, ref, e.getMessage());
                warnings.add(e.getMessage());
            }
        }
        log.info("[SHARE-REGISTRY] Deleted share token={} owner={} retracted={} warnings={}",
                shareToken, requesterPrincipalId, retracted, warnings.size());
        return new DeleteOutcome(shareToken, retracted, warnings);
    }
}
