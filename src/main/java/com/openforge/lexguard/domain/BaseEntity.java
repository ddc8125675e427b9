package com.openforge.lexguard.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.time.LocalDateTime;

/**
 * Canonical audit columns shared by every moderation table.
 *
 * - create_time  : set once on INSERT, never touched again
 * - update_time  : refreshed on every UPDATE
 * - version      : JPA @Version, the optimistic-lock counter that backs the
 *                  row lock taken by AccountStatusStore
 */
@Getter
@Setter
@MappedSuperclass
@EntityListeners(AuditingEntityListener.class)
public abstract class BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @CreatedDate
    @Column(name = "create_time", nullable = false, updatable = false)
    private LocalDateTime createTime;

    @LastModifiedDate
    @Column(name = "update_time", nullable = false)
    private LocalDateTime updateTime;

    /**
     * Two writers flushing the same row: the second one gets an
     * OptimisticLockException and the whole unit of work is retried.
     */
    @Version
    @Column(nullable = false)
    private Integer version = 0;
}
