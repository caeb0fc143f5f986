package com.yerin.pipeline.controller;

import com.yerin.pipeline.dto.request.ReprocessRequest;
import com.yerin.pipeline.dto.response.ReprocessResponse;
import com.yerin.pipeline.global.dto.DataResponse;
import com.yerin.pipeline.service.ReprocessService;
import io.swagger.v3.oas.annotations.Parameter;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/content")
@RequiredArgsConstructor
public class ContentController {

    private final ReprocessService reprocessService;

    @PostMapping("/{contentId}/reprocess")
    public ResponseEntity<DataResponse<ReprocessResponse>> reprocess(
            @PathVariable String contentId,
            @RequestParam(defaultValue = "false")
            @Parameter(description = "완료된 콘텐츠도 다시 처리")
            boolean force,
            @RequestBody(required = false) @Valid ReprocessRequest request) {
        ReprocessResponse response = reprocessService.reprocess(contentId, force, request);
        return ResponseEntity.ok(DataResponse.from(response));
    }
}
