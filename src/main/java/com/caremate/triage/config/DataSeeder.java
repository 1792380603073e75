package com.caremate.triage.config;

import com.caremate.triage.entity.PatientRecord;
import com.caremate.triage.entity.StaffMember;
import com.caremate.triage.repository.PatientRecordRepository;
import com.caremate.triage.repository.StaffMemberRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Configuration
@ConditionalOnProperty(name = "caremate.seed-demo-data", havingValue = "true", matchIfMissing = true)
public class DataSeeder {

    private static final Logger log = LoggerFactory.getLogger(DataSeeder.class);

    @Bean
    CommandLineRunner seedData(StaffMemberRepository staffRepo, PatientRecordRepository patientRepo) {
        return args -> {
            if (staffRepo.count() > 0) {
                log.info("Staff already seeded, skipping");
                return;
            }

            List<StaffMember> staff = new ArrayList<>();
            staff.add(StaffMember.builder().staffId("N001").name("Nurse Priya Shah").role(StaffMember.Role.NURSE).phone("+15550100001").build());
            staff.add(StaffMember.builder().staffId("N002").name("Nurse Tom Baker").role(StaffMember.Role.NURSE).phone("+15550100002").build());
            staff.add(StaffMember.builder().staffId("NURSE_ON_DUTY").name("Charge Nurse").role(StaffMember.Role.NURSE).phone("+15550100009").build());
            staff.add(StaffMember.builder().staffId("D001").name("Dr Elena Ruiz").role(StaffMember.Role.DOCTOR).phone("+15550100101").build());
            staff.add(StaffMember.builder().staffId("D002").name("Dr Sam Okafor").role(StaffMember.Role.DOCTOR).phone("+15550100102").build());
            staff.add(StaffMember.builder().staffId("DR_ON_CALL").name("On-call Physician").role(StaffMember.Role.DOCTOR).phone("+15550100109").build());
            staff.add(StaffMember.builder().staffId("RAPID_RESPONSE").name("Rapid Response Team").role(StaffMember.Role.EMERGENCY_TEAM).phone("+15550100911").build());
            staffRepo.saveAll(staff);

            List<PatientRecord> patients = new ArrayList<>();
            patients.add(PatientRecord.builder()
                    .hospitalId("P001")
                    .name("John Smith")
                    .bedNumber("101A")
                    .medications(new ArrayList<>(List.of("Lisinopril 10mg", "Metformin 500mg")))
                    .allergies(new ArrayList<>(List.of("Penicillin")))
                    .restrictions(new ArrayList<>(List.of("Low sodium diet")))
                    .primaryNurseId("N001")
                    .attendingPhysicianId("D001")
                    .build());
            patients.add(PatientRecord.builder()
                    .hospitalId("P002")
                    .name("Maria Garcia")
                    .bedNumber("102B")
                    .medications(new ArrayList<>(List.of("Atorvastatin 20mg")))
                    .allergies(new ArrayList<>())
                    .restrictions(new ArrayList<>(List.of("Fall risk")))
                    .primaryNurseId("N002")
                    .attendingPhysicianId("D002")
                    .build());
            patients.add(PatientRecord.builder()
                    .hospitalId("P003")
                    .name("Robert Chen")
                    .bedNumber("103A")
                    .medications(new ArrayList<>(List.of("Warfarin 5mg", "Furosemide 40mg")))
                    .allergies(new ArrayList<>(List.of("Sulfa drugs", "Latex")))
                    .restrictions(new ArrayList<>(List.of("Fluid restriction 1.5L", "Bed rest")))
                    .primaryNurseId("N001")
                    .attendingPhysicianId("D002")
                    .build());
            patientRepo.saveAll(patients);
            log.info("Seeded {} staff members and {} patients", staff.size(), patients.size());
        };
    }
}
