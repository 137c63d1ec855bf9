package com.sarkariexams.backend.modules.stepup.presentation;

import com.sarkariexams.backend.global.security.SecurityUtils;
import com.sarkariexams.backend.global.web.DataResponse;
import com.sarkariexams.backend.modules.stepup.application.StepUpService;
import com.sarkariexams.backend.modules.stepup.application.StepUpService.IssuedStepUp;
import com.sarkariexams.backend.modules.stepup.presentation.dto.StepUpRequest;
import com.sarkariexams.backend.modules.stepup.presentation.dto.StepUpResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Step-up", description = "Re-authentication for sensitive admin actions")
public class StepUpController {

    private final StepUpService stepUpService;

    public StepUpController(StepUpService stepUpService) {
        this.stepUpService = stepUpService;
    }

    @PostMapping("/auth/admin/step-up")
    @Operation(summary = "Issue a step-up token", description = "Re-checks password and second factor for the current session")
    public ResponseEntity<DataResponse<StepUpResponse>> stepUp(@Valid @RequestBody StepUpRequest request) {
        IssuedStepUp issued = stepUpService.issueStepUp(
                SecurityUtils.currentActor(),
                request.email(),
                request.password(),
                request.code()
        );
        return ResponseEntity.ok(DataResponse.of(new StepUpResponse(issued.token(), issued.expiresAt(), issued.singleUse())));
    }
}
