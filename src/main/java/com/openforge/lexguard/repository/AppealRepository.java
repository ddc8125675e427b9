package com.openforge.lexguard.repository;

import com.openforge.lexguard.domain.Appeal;
import com.openforge.lexguard.domain.Appeal.AppealStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface AppealRepository extends JpaRepository<Appeal, Long> {

    boolean existsBySuspensionId(Long suspensionId);

    List<Appeal> findByUserIdOrderByIdDesc(Long userId);

    Page<Appeal> findByStatus(AppealStatus status, Pageable pageable);

    long countByStatus(AppealStatus status);

    @Query("select a.userId from Appeal a where a.id = :id")
    Optional<Long> findUserIdById(@Param("id") Long id);

    @Modifying
    @Query("delete from Appeal a where a.userId = :userId")
    int deleteByUserId(@Param("userId") Long userId);
}
