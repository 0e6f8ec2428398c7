package com.examify.api.controller;

import com.examify.api.dto.request.QueryRequest;
import com.examify.api.dto.response.QueryResponse;
import com.examify.core.query.ImageQueryService;
import com.examify.core.query.RetrievalEngine;
import com.examify.core.query.model.RetrievalAnswer;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/query")
@RequiredArgsConstructor
@Slf4j
public class QueryController {

    private final RetrievalEngine retrievalEngine;
    private final ImageQueryService imageQueryService;

    @PostMapping
    public ResponseEntity<QueryResponse> query(
            @Valid @RequestBody QueryRequest request,
            Authentication authentication
    ) {
        UUID userId = UUID.fromString(authentication.getName());
        return ResponseEntity.ok(toResponse(retrievalEngine.ask(userId, request.getQuestionText())));
    }

    @PostMapping(value = "/image", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<QueryResponse> queryImage(
            @RequestParam("image") MultipartFile image,
            Authentication authentication
    ) throws IOException {
        UUID userId = UUID.fromString(authentication.getName());
        log.debug("[API] Image query | userId={} | fileName={} | sizeBytes={}",
            userId, image.getOriginalFilename(), image.getSize());
        RetrievalAnswer answer = imageQueryService.ask(userId, image.getOriginalFilename(), image.getBytes());
        return ResponseEntity.ok(toResponse(answer));
    }

    private static QueryResponse toResponse(RetrievalAnswer answer) {
        return QueryResponse.builder()
            .answer(answer.getAnswer())
            .sessionId(answer.getSessionId())
            .usedChunkIds(answer.getUsedChunkIds())
            .grounded(answer.isGrounded())
            .build();
    }
}
