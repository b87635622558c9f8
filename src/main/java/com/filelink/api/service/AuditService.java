package com.filelink.api.service;

import com.filelink.api.model.AuditAction;
import com.filelink.api.model.AuditRecord;
import com.filelink.api.repository.AuditRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;

@Service
public class AuditService {

    private final AuditRepository auditRepository;
    private final Clock clock;

    public AuditService(AuditRepository auditRepository, Clock clock) {
        this.auditRepository = auditRepository;
        this.clock = clock;
    }

    @Transactional
    public void record(AuditAction action, String fileId, Long userId, String detail) {
        auditRepository.save(AuditRecord.builder()
                .action(action)
                .fileId(fileId)
                .userId(userId)
                .detail(detail)
                .createdAt(LocalDateTime.now(clock))
                .build());
    }
}
