package com.backlinkqc.api;

import com.backlinkqc.pipeline.ValidationOutcome;
import com.backlinkqc.pipeline.ValidationService;
import com.backlinkqc.preflight.PreflightMatrix;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/qc")
public class ValidationController {

    private final ValidationService validationService;

    public ValidationController(ValidationService validationService) {
        this.validationService = validationService;
    }

    /** auto_fix defaults to false when omitted. */
    @PostMapping("/validate")
    public ValidationOutcome validate(@RequestBody ValidationRequest request) {
        return validationService.validate(request.articleText(), request.matrix(),
            Boolean.TRUE.equals(request.autoFix()));
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record ValidationRequest(String articleText, PreflightMatrix matrix, Boolean autoFix) {}
}
