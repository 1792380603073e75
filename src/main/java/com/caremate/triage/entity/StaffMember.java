package com.caremate.triage.entity;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "staff_member")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StaffMember {

    public enum Role { NURSE, DOCTOR, EMERGENCY_TEAM }

    @Id
    @Column(name = "staff_id", length = 50)
    private String staffId;

    @Column(length = 100)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Role role;

    /** E.164 number used for SMS alerts. */
    @Column(length = 30)
    private String phone;

    @Column(nullable = false)
    @Builder.Default
    private boolean active = true;
}
