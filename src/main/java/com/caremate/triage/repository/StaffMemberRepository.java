package com.caremate.triage.repository;

import com.caremate.triage.entity.StaffMember;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface StaffMemberRepository extends JpaRepository<StaffMember, String> {

    Optional<StaffMember> findByStaffIdAndActiveTrue(String staffId);
}
