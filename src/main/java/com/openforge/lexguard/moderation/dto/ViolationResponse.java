package com.openforge.lexguard.moderation.dto;

import com.openforge.lexguard.domain.Violation;

import java.time.LocalDateTime;
import java.util.Map;

public record ViolationResponse(
        Long                  id,
        Long                  userId,
        String                violationType,
        String                contentId,
        String                contentText,
        Map<String, Boolean>  flaggedCategories,
        Map<String, Double>   categoryScores,
        String                violationSummary,
        String                source,
        Long                  adminId,
        String                actionTaken,
        int                   strikeCountAfter,
        int                   suspensionCountAfter,
        LocalDateTime         createdAt
) {

    public static ViolationResponse from(Violation v) {
        return new ViolationResponse(
                v.getId(),
                v.getUserId(),
                v.getViolationType().name(),
                v.getContentId(),
                v.getContentText(),
                v.getFlaggedCategories(),
                v.getCategoryScores(),
                v.getViolationSummary(),
                v.getSource().name(),
                v.getAdminId(),
                v.getActionTaken().name(),
                v.getStrikeCountAfter(),
                v.getSuspensionCountAfter(),
                v.getCreateTime()
        );
    }
}
