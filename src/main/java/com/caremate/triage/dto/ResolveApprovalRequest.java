package com.caremate.triage.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

@Getter
@Setter
@ToString
@NoArgsConstructor
@AllArgsConstructor
public class ResolveApprovalRequest {

    /** APPROVED or REJECTED. */
    private String outcome;

    private String staffId;

    private String notes;
}
