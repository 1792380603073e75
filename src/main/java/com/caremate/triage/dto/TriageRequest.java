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
public class TriageRequest {

    private String patientId;

    private String bedId;

    private String text;

    /** Optional; LOW, MEDIUM, HIGH or CRITICAL. */
    private String priority;
}
