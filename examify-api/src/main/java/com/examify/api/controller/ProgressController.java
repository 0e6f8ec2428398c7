package com.examify.api.controller;

import com.examify.api.dto.response.ProfileResponse;
import com.examify.core.ledger.ProgressLedger;
import com.examify.data.entity.UserProfile;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api/v1/progress")
@RequiredArgsConstructor
public class ProgressController {

    private final ProgressLedger progressLedger;

    @GetMapping("/me")
    public ResponseEntity<ProfileResponse> myProgress(Authentication authentication) {
        UUID userId = UUID.fromString(authentication.getName());
        UserProfile profile = progressLedger.getProfile(userId);
        return ResponseEntity.ok(ProfileResponse.builder()
            .userId(profile.getUserId())
            .mockExamsCompleted(profile.getMockExamsCompleted())
            .averageMockExamScore(profile.getAverageMockExamScore())
            .studyMaterialsUploadedCount(profile.getStudyMaterialsUploadedCount())
            .totalPoints(profile.getTotalPoints())
            .build());
    }
}
