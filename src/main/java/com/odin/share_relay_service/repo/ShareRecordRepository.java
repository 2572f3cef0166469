package com.odin.share_relay_service.repo;

import com.odin.share_relay_service.entity.ShareRecord;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ShareRecordRepository extends JpaRepository<ShareRecord, String> {

    List<ShareRecord> findByOwnerPrincipalId(String ownerPrincipalId, Pageable pageable);

    long countByOwnerPrincipalId(String ownerPrincipalId);
}
