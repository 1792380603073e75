package com.caremate.triage.controller;

import com.caremate.triage.dto.TriageRequest;
import com.caremate.triage.service.TriageOrchestrator;
import com.caremate.triage.triage.TriageResult;
import com.caremate.triage.utils.UrgencyLevel;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Locale;

@RestController
@RequestMapping("/api/triage")
public class TriageController {

    private static final Logger log = LoggerFactory.getLogger(TriageController.class);

    private final TriageOrchestrator orchestrator;

    public TriageController(TriageOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @PostMapping("/requests")
    public ResponseEntity<TriageResult> process(@RequestBody TriageRequest body) {
        if (StringUtils.isBlank(body.getPatientId())) {
            throw new IllegalArgumentException("patientId is required");
        }
        UrgencyLevel priority = StringUtils.isBlank(body.getPriority())
                ? null
                : UrgencyLevel.valueOf(body.getPriority().trim().toUpperCase(Locale.ROOT));
        log.info("Request from patient {} bed {}", body.getPatientId(), body.getBedId());
        return ResponseEntity.ok(orchestrator.process(body.getText(), body.getPatientId(), body.getBedId(), priority));
    }
}
