package com.filelink.api.repository;

import com.filelink.api.model.AuditAction;
import com.filelink.api.model.AuditRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface AuditRepository extends JpaRepository<AuditRecord, Long> {

    List<AuditRecord> findByFileIdAndAction(String fileId, AuditAction action);

    List<AuditRecord> findByUserIdAndAction(Long userId, AuditAction action);
}
