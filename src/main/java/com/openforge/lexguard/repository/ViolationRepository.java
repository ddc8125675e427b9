package com.openforge.lexguard.repository;

import com.openforge.lexguard.domain.Violation;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface ViolationRepository extends JpaRepository<Violation, Long> {

    /** Dedup probe: the first record of the same content inside the window. */
    Optional<Violation> findFirstByUserIdAndContentIdAndViolationTypeAndCreateTimeAfterOrderByIdAsc(
            Long userId, String contentId, Violation.ViolationType violationType, LocalDateTime after);

    /** Most recent first; used to collect the strikes behind a suspension. */
    List<Violation> findByUserIdOrderByIdDesc(Long userId, Pageable pageable);

    Page<Violation> findByUserId(Long userId, Pageable pageable);

    Page<Violation> findByViolationType(Violation.ViolationType violationType, Pageable pageable);

    Page<Violation> findByUserIdAndViolationType(Long userId, Violation.ViolationType violationType,
                                                 Pageable pageable);

    List<Violation> findByUserIdOrderByIdAsc(Long userId);

    long countByCreateTimeGreaterThanEqual(LocalDateTime since);

    @Modifying
    @Query("delete from Violation v where v.userId = :userId")
    int deleteByUserId(@Param("userId") Long userId);
}
