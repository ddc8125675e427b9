package com.openforge.lexguard.moderation.dto;

import com.openforge.lexguard.domain.Appeal;

import java.time.LocalDateTime;

public record AppealResponse(
        Long          id,
        Long          userId,
        Long          suspensionId,
        String        appealReason,
        String        additionalContext,
        String        status,
        Long          reviewedBy,
        LocalDateTime reviewedAt,
        String        adminNotes,
        String        rejectionReason,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {

    public static AppealResponse from(Appeal a) {
        return new AppealResponse(
                a.getId(),
                a.getUserId(),
                a.getSuspensionId(),
                a.getAppealReason(),
                a.getAdditionalContext(),
                a.getStatus().name(),
                a.getReviewedBy(),
                a.getReviewedAt(),
                a.getAdminNotes(),
                a.getRejectionReason(),
                a.getCreateTime(),
                a.getUpdateTime()
        );
    }
}
