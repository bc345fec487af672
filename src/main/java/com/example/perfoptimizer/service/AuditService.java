package com.example.perfoptimizer.service;

import com.example.perfoptimizer.domain.AuditLog;
import com.example.perfoptimizer.repository.AuditLogRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Audit trail for automated changes. Writes are async so scheduled tasks never wait on the database.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuditService {

    private final AuditLogRepository auditLogRepository;
    private final ObjectMapper objectMapper;

    @Async("eventExecutor")
    public void log(String actor, String action, String target, Map<String, Object> details, boolean success) {
        try {
            String detailsJson = details != null ? objectMapper.writeValueAsString(details) : null;
            AuditLog entry = AuditLog.builder()
                    .actor(actor)
                    .action(action)
                    .target(target)
                    .details(detailsJson)
                    .success(success)
                    .timestamp(Instant.now())
                    .build();
            auditLogRepository.save(entry);
            log.debug("Audit: [{}] {} -> {} ({})", actor, action, target, success ? "OK" : "FAIL");
        } catch (Exception e) {
            log.error("Failed to write audit log: {}", e.getMessage());
        }
    }

    @Async("eventExecutor")
    public void log(String actor, String action, String target, Map<String, Object> details) {
        log(actor, action, target, details, true);
    }

    public List<AuditLog> getRecent(int limit) {
        return auditLogRepository.findAllPaged(PageRequest.of(0, limit)).getContent();
    }

    /**
     * Most recent entries matching the action and/or target, newest first.
     */
    public List<AuditLog> filter(String action, String target, int limit) {
        if (action == null && target == null) {
            return getRecent(limit);
        }
        List<AuditLog> candidates = action != null
                ? auditLogRepository.findByActionOrderByTimestampDesc(action)
                : auditLogRepository.findByTargetOrderByTimestampDesc(target);
        return candidates.stream()
                .filter(entry -> target == null || target.equals(entry.getTarget()))
                .limit(limit)
                .collect(Collectors.toList());
    }

    public long countByAction(String action) {
        return auditLogRepository.countByAction(action);
    }
}
