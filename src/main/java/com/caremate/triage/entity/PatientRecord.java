package com.caremate.triage.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "patient_record")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PatientRecord {

    /** Hospital patient id, e.g. P001. */
    @Id
    @Column(name = "hospital_id", length = 50)
    private String hospitalId;

    @Column(length = 100)
    private String name;

    @Column(name = "bed_number", length = 30)
    private String bedNumber;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "patient_medication", joinColumns = @JoinColumn(name = "hospital_id"))
    @Column(name = "medication", length = 100)
    @Builder.Default
    private List<String> medications = new ArrayList<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "patient_allergy", joinColumns = @JoinColumn(name = "hospital_id"))
    @Column(name = "allergy", length = 100)
    @Builder.Default
    private List<String> allergies = new ArrayList<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "patient_restriction", joinColumns = @JoinColumn(name = "hospital_id"))
    @Column(name = "restriction", length = 100)
    @Builder.Default
    private List<String> restrictions = new ArrayList<>();

    @Column(name = "primary_nurse_id", length = 50)
    private String primaryNurseId;

    @Column(name = "attending_physician_id", length = 50)
    private String attendingPhysicianId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
    }
}
