package com.odin.share_relay_service.service;

import com.odin.share_relay_service.dto.InboundItem;
import com.odin.share_relay_service.dto.ItemRef;
import com.odin.share_relay_service.dto.StoredItem;
import com.odin.share_relay_service.exception.RelayException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Moves uploaded items into the durable item store and reads them back for delivery.
 *
 * A batch is all-or-nothing: refs come back in input order, and if any item fails the
 * items already written for that batch are removed before {@link RelayException} is thrown.
 */
@Slf4j
@Service
public class RelayPipeline {

    private final ItemStorageService itemStorageService;

    public RelayPipeline(ItemStorageService itemStorageService) {
        this.itemStorageService = itemStorageService;
    }

    public List<ItemRef> relay(String principalId, List<InboundItem> items) {
        List<ItemRef> refs = new ArrayList<>(items.size());
        for (InboundItem item : items) {
            try {
                refs.add(itemStorageService.store(item));
            } catch (IOException | RuntimeException e) {
                log.error("[RELAY] Relay failed principal={} message={} file={} after {} of {} items: {}",
                        principalId, item.getMessageId(), item.getFileName(), refs.size(), items.size(), e.getMessage());
                refs.forEach(this::retractQuietly);
                throw new RelayException("Could not relay " + items.size() + " item(s): " + e.getMessage(), e);
            }
        }
        log.info("[RELAY] Relayed {} item(s) principal={}", refs.size(), principalId);
        return refs;
    }

    public StoredItem load(ItemRef ref) {
        try {
            return itemStorageService.load(ref);
        } catch (IOException | RuntimeException e) {
            throw new RelayException("Could not load item " + ref + ": " + e.getMessage(), e);
        }
    }

    /**
     * Remove a relayed item. An item that is already gone counts as retracted.
     *
     * @throws RelayException on any other failure
     */
    public void retract(ItemRef ref) {
        try {
            if (!itemStorageService.delete(ref)) {
                log.debug("[RELAY] Item {} already gone", ref);
            }
        } catch (IOException | RuntimeException e) {
            throw new RelayException("Could not retract item " + ref + ": " + e.getMessage(), e);
        }
    }

    /**
     * Retract refs that no share will ever point at. Failures are only logged.
     */
    public void discard(String principalId, List<ItemRef> refs) {
        refs.forEach(ref -> {
            try {
                retract(ref);
            } catch (RelayException e) {
                log.warn("[RELAY] Orphaned item {} of principal={} left in store: {}", ref, principalId, e.getMessage());
            }
        });
    }

    private void retractQuietly(ItemRef ref) {
        try {
            retract(ref);
        } catch (RelayException e) {
            log.error("[RELAY] Failed to remove partial item {}: {}", ref, e.getMessage());
        }
    }
}
