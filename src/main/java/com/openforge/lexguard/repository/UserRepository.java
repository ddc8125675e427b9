package com.openforge.lexguard.repository;

import com.openforge.lexguard.domain.User;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.Optional;

@Repository
public interface UserRepository extends JpaRepository<User, Long> {

    boolean existsByUsername(String username);

    boolean existsByEmail(String email);

    Optional<User> findByUsername(String username);

    /**
     * Login helper: allow username or email.
     */
    Optional<User> findByUsernameOrEmail(String username, String email);

    /**
     * Row-level write lock on the account. Every moderation mutation starts
     * here, which serialises concurrent writers for the same user while
     * leaving other accounts untouched.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "5000"))
    @Query("select u from User u where u.id = :id")
    Optional<User> findByIdForUpdate(@Param("id") Long id);

    long countByAccountStatus(User.AccountStatus accountStatus);

    Page<User> findByAccountStatusIn(Collection<User.AccountStatus> statuses, Pageable pageable);
}
