package com.openforge.lexguard.repository;

import com.openforge.lexguard.domain.Suspension;
import com.openforge.lexguard.domain.Suspension.SuspensionStatus;
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
public interface SuspensionRepository extends JpaRepository<Suspension, Long> {

    Optional<Suspension> findFirstByUserIdAndStatusOrderByIdDesc(Long userId, SuspensionStatus status);

    List<Suspension> findByUserIdOrderByIdAsc(Long userId);

    long countByUserIdAndStatus(Long userId, SuspensionStatus status);

    Page<Suspension> findByUserId(Long userId, Pageable pageable);

    Page<Suspension> findByStatus(SuspensionStatus status, Pageable pageable);

    Page<Suspension> findByUserIdAndStatus(Long userId, SuspensionStatus status, Pageable pageable);

    /** Candidates for the background sweep. */
    @Query("select s.id from Suspension s where s.status = :status and s.endsAt is not null and s.endsAt <= :now")
    List<Long> findIdsDueForExpiry(@Param("status") SuspensionStatus status, @Param("now") LocalDateTime now);

    default List<Long> findDueForExpiry(LocalDateTime now) {
        return findIdsDueForExpiry(SuspensionStatus.ACTIVE, now);
    }

    /** Owner lookup that does not load the suspension into the persistence context. */
    @Query("select s.userId from Suspension s where s.id = :id")
    Optional<Long> findUserIdById(@Param("id") Long id);

    @Modifying
    @Query("delete from Suspension s where s.userId = :userId")
    int deleteByUserId(@Param("userId") Long userId);
}
