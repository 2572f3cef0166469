package com.odin.share_relay_service.entity;

import com.odin.share_relay_service.dto.ItemRef;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PostLoad;
import jakarta.persistence.PostPersist;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.domain.Persistable;

import java.time.Instant;
import java.util.List;

/**
 * A published share: a public token pointing at an ordered list of relayed items.
 * Rows are only inserted and deleted, never updated, so saving a record with a token
 * that is already taken fails instead of overwriting it.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "share_records",
        indexes = @Index(name = "idx_share_owner", columnList = "owner_principal_id"))
public class ShareRecord implements Persistable<String> {

    @Id
    @Column(name = "share_token", length = 32, nullable = false, updatable = false)
    private String shareToken;

    @Convert(converter = ItemRefListConverter.class)
    @Column(name = "item_refs", length = 65535, nullable = false, updatable = false)
    private List<ItemRef> itemRefs;

    @Column(name = "owner_principal_id", length = 128, nullable = false, updatable = false)
    private String ownerPrincipalId;

    @Column(name = "caption", length = 512)
    private String caption;

    @Enumerated(EnumType.STRING)
    @Column(name = "kind", length = 16, nullable = false)
    private ShareKind kind;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Transient
    @Builder.Default
    private boolean fresh = true;

    @Override
    public String getId() {
        return shareToken;
    }

    @Override
    public boolean isNew() {
        return fresh;
    }

    @PostLoad
    @PostPersist
    void markPersisted() {
        this.fresh = false;
    }

    public int getItemCount() {
        return itemRefs == null ? 0 : itemRefs.size();
    }
}
