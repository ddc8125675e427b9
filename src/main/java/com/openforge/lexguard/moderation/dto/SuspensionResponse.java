package com.openforge.lexguard.moderation.dto;

import com.openforge.lexguard.domain.Suspension;

import java.time.LocalDateTime;
import java.util.List;

public record SuspensionResponse(
        Long          id,
        Long          userId,
        String        suspensionType,
        String        status,
        String        reason,
        List<Long>    violationIds,
        int           suspensionNumber,
        int           strikesAtSuspension,
        LocalDateTime startedAt,
        LocalDateTime endsAt,
        LocalDateTime liftedAt,
        Long          liftedBy,
        String        liftedReason
) {

    public static SuspensionResponse from(Suspension s) {
        return new SuspensionResponse(
                s.getId(),
                s.getUserId(),
                s.getSuspensionType().name(),
                s.getStatus().name(),
                s.getReason(),
                s.getViolationIds(),
                s.getSuspensionNumber(),
                s.getStrikesAtSuspension(),
                s.getStartedAt(),
                s.getEndsAt(),
                s.getLiftedAt(),
                s.getLiftedBy(),
                s.getLiftedReason()
        );
    }
}
