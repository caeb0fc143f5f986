package com.yerin.pipeline.dto.request;

import com.yerin.pipeline.domain.DataTier;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Size;

public record ReprocessRequest(
        @Schema(description = "리소스 종류 (youtube | url | content)", example = "youtube")
        String kind,

        @Size(max = 2048)
        @Schema(description = "외부 식별자 또는 URL. 비어 있으면 contentId 를 사용", example = "dQw4w9WgXcQ")
        String identifier,

        @Schema(description = "보존 등급 (compact | full)", example = "compact")
        DataTier dataTier,

        @Size(max = 255)
        @Schema(description = "멱등키", example = "reprocess-2024-01-01")
        String idempotencyKey
) {
    public static ReprocessRequest empty() {
        return new ReprocessRequest(null, null, null, null);
    }
}
