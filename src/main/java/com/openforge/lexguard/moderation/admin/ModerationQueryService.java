package com.openforge.lexguard.moderation.admin;

import com.openforge.lexguard.domain.Suspension;
import com.openforge.lexguard.domain.Suspension.SuspensionStatus;
import com.openforge.lexguard.domain.User;
import com.openforge.lexguard.domain.User.AccountStatus;
import com.openforge.lexguard.domain.Violation;
import com.openforge.lexguard.domain.Violation.ViolationType;
import com.openforge.lexguard.repository.SuspensionRepository;
import com.openforge.lexguard.repository.UserRepository;
import com.openforge.lexguard.repository.ViolationRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.EnumSet;

/** Read-only back-office views over violations, suspensions and restricted accounts. */
@Service
@RequiredArgsConstructor
public class ModerationQueryService {

    private final ViolationRepository  violationRepository;
    private final SuspensionRepository suspensionRepository;
    private final UserRepository       userRepository;
    private final Clock                clock;

    public Page<Violation> listViolations(Long userId, ViolationType type, Pageable pageable) {
        if (userId != null && type != null) {
            return violationRepository.findByUserIdAndViolationType(userId, type, pageable);
        }
        if (userId != null) {
            return violationRepository.findByUserId(userId, pageable);
        }
        if (type != null) {
            return violationRepository.findByViolationType(type, pageable);
        }
        return violationRepository.findAll(pageable);
    }

    public Page<Suspension> listSuspensions(Long userId, SuspensionStatus status, Pageable pageable) {
        if (userId != null && status != null) {
            return suspensionRepository.findByUserIdAndStatus(userId, status, pageable);
        }
        if (userId != null) {
            return suspensionRepository.findByUserId(userId, pageable);
        }
        if (status != null) {
            return suspensionRepository.findByStatus(status, pageable);
        }
        return suspensionRepository.findAll(pageable);
    }

    /** Accounts that are currently SUSPENDED or BANNED. */
    public Page<User> listRestrictedAccounts(Pageable pageable) {
        return userRepository.findByAccountStatusIn(EnumSet.of(AccountStatus.SUSPENDED, AccountStatus.BANNED), pageable);
    }

    public ModerationStats stats() {
        LocalDateTime now = LocalDateTime.now(clock);
        return new ModerationStats(
                violationRepository.count(),
                suspensionRepository.count(),
                userRepository.countByAccountStatus(AccountStatus.BANNED),
                userRepository.countByAccountStatus(AccountStatus.SUSPENDED),
                violationRepository.countByCreateTimeGreaterThanEqual(now.minusHours(24)),
                violationRepository.countByCreateTimeGreaterThanEqual(now.minusDays(7)),
                violationRepository.countByCreateTimeGreaterThanEqual(now.minusDays(30)));
    }

    public record ModerationStats(
            long totalViolations,
            long totalSuspensions,
            long bannedAccounts,
            long suspendedAccounts,
            long violationsLast24h,
            long violationsLast7d,
            long violationsLast30d
    ) {
    }
}
