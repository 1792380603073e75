package com.caremate.triage.controller;

import com.caremate.triage.dto.ResolveApprovalRequest;
import com.caremate.triage.entity.ApprovalQueueEntry;
import com.caremate.triage.service.ApprovalQueueService;
import com.caremate.triage.utils.ApprovalStatus;
import org.apache.commons.lang3.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Locale;

@RestController
@RequestMapping("/api/approvals")
public class ApprovalController {

    private final ApprovalQueueService approvalQueueService;

    public ApprovalController(ApprovalQueueService approvalQueueService) {
        this.approvalQueueService = approvalQueueService;
    }

    @GetMapping("/pending")
    public List<ApprovalQueueEntry> pending() {
        return approvalQueueService.listPending();
    }

    @GetMapping
    public List<ApprovalQueueEntry> byPatient(@RequestParam("patientId") String patientId) {
        return approvalQueueService.listByPatient(patientId);
    }

    @GetMapping("/{id}")
    public ApprovalQueueEntry get(@PathVariable("id") String id) {
        return approvalQueueService.get(id);
    }

    @PostMapping("/{id}/resolve")
    public ApprovalQueueEntry resolve(@PathVariable("id") String id, @RequestBody ResolveApprovalRequest body) {
        if (StringUtils.isBlank(body.getOutcome())) {
            throw new IllegalArgumentException("outcome is required");
        }
        if (StringUtils.isBlank(body.getStaffId())) {
            throw new IllegalArgumentException("staffId is required");
        }
        ApprovalStatus outcome = ApprovalStatus.valueOf(body.getOutcome().trim().toUpperCase(Locale.ROOT));
        return approvalQueueService.resolve(id, outcome, body.getStaffId(), body.getNotes());
    }
}
