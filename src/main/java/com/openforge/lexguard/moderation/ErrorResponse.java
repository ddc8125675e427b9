package com.openforge.lexguard.moderation;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.time.LocalDateTime;
import java.util.List;

@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
        String        errorCode,
        String        message,
        int           status,
        LocalDateTime timestamp,
        String        path,
        List<String>  details
) {
}
