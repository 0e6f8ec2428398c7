package com.examify.api.controller;

import com.examify.api.dto.response.MaterialResponse;
import com.examify.api.dto.response.SummaryResponse;
import com.examify.core.material.StudyMaterialService;
import com.examify.data.entity.StudyMaterial;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.util.UUID;

@RestController
@RequestMapping("/api/v1/materials")
@RequiredArgsConstructor
@Slf4j
public class MaterialController {

    private final StudyMaterialService materialService;

    @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<MaterialResponse> upload(
            @RequestParam("file") MultipartFile file,
            @RequestParam(value = "title", required = false) String title,
            @RequestParam(value = "courseId", required = false) String courseId,
            Authentication authentication
    ) {
        UUID userId = UUID.fromString(authentication.getName());
        log.debug("[API] Upload received | userId={} | fileName={} | sizeBytes={}",
            userId, file.getOriginalFilename(), file.getSize());
        StudyMaterial material = materialService.upload(userId, file, title, courseId);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(MaterialResponse.from(material));
    }

    @GetMapping
    public ResponseEntity<Page<MaterialResponse>> list(Pageable pageable, Authentication authentication) {
        UUID userId = UUID.fromString(authentication.getName());
        return ResponseEntity.ok(materialService.listMaterials(userId, pageable).map(MaterialResponse::from));
    }

    @GetMapping("/{materialId}")
    public ResponseEntity<MaterialResponse> status(@PathVariable UUID materialId, Authentication authentication) {
        UUID userId = UUID.fromString(authentication.getName());
        return ResponseEntity.ok(MaterialResponse.from(materialService.getMaterial(userId, materialId)));
    }

    @PostMapping("/{materialId}/summary")
    public ResponseEntity<SummaryResponse> summarize(@PathVariable UUID materialId, Authentication authentication) {
        UUID userId = UUID.fromString(authentication.getName());
        return ResponseEntity.ok(new SummaryResponse(materialId, materialService.summarize(userId, materialId)));
    }
}
