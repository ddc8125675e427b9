package com.openforge.lexguard.moderation.admin;

import com.openforge.lexguard.domain.AdminAuditLog;
import com.openforge.lexguard.domain.AdminAuditLog.AdminAction;
import com.openforge.lexguard.moderation.ModerationTransactions;
import com.openforge.lexguard.repository.AdminAuditLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only record of who did what to which account. Joins the caller's
 * unit of work, so an admin action and its audit row commit together.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AdminAuditTrail {

    private final AdminAuditLogRepository repository;
    private final ModerationTransactions  tx;

    public AdminAuditLog record(Long adminId, AdminAction action, Long targetUserId, Map<String, Object> details) {
        return tx.execute("audit", () -> {
            AdminAuditLog entry = repository.save(AdminAuditLog.builder()
                    .adminId(adminId)
                    .action(action)
                    .targetUserId(targetUserId)
                    .details(details == null ? Map.of() : new LinkedHashMap<>(details))
                    .build());
            log.info("[Audit] admin={} {} target={}", adminId, action, targetUserId);
            return entry;
        });
    }

    public List<AdminAuditLog> forUser(Long targetUserId) {
        return repository.findByTargetUserIdOrderByIdAsc(targetUserId);
    }
}
