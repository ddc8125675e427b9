package com.openforge.lexguard.repository;

import com.openforge.lexguard.domain.AdminAuditLog;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface AdminAuditLogRepository extends JpaRepository<AdminAuditLog, Long> {

    List<AdminAuditLog> findByTargetUserIdOrderByIdAsc(Long targetUserId);
}
