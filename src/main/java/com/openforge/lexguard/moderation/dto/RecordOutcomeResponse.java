package com.openforge.lexguard.moderation.dto;

import com.openforge.lexguard.moderation.violation.RecordOutcome;

import java.time.LocalDateTime;

public record RecordOutcomeResponse(
        Long          violationId,
        String        actionTaken,
        int           strikeCount,
        int           suspensionCount,
        String        accountStatus,
        LocalDateTime suspensionEnd,
        Long          suspensionId,
        boolean       duplicate,
        String        message
) {

    public static RecordOutcomeResponse from(RecordOutcome o) {
        return new RecordOutcomeResponse(
                o.violation().getId(),
                o.actionTaken().name(),
                o.account().strikeCount(),
                o.account().suspensionCount(),
                o.account().status().name(),
                o.account().suspensionEnd(),
                o.suspension() == null ? null : o.suspension().getId(),
                o.duplicate(),
                o.message()
        );
    }
}
