package com.openforge.lexguard.moderation.appeal;

public record AppealStats(
        long pending,
        long underReview,
        long approved,
        long rejected,
        long total
) {
}
