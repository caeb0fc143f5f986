package com.yerin.pipeline.service;

import com.yerin.pipeline.domain.DataTier;

public record SubmitCommand(String contentId,
                            String resourceKey,
                            DataTier dataTier,
                            String idempotencyKey) {
}
