package com.caremate.triage.component;

import org.springframework.stereotype.Component;

import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Patient-facing phrases. Every reply the system speaks comes from here; nothing is generated,
 * so no reply can carry medical advice.
 */
@Component
public class ResponsePhrases {

    private static final DateTimeFormatter CLOCK = DateTimeFormatter.ofPattern("hh:mm a", Locale.ENGLISH);

    public String emergencyDispatched() {
        return "I've immediately notified the emergency response team. "
                + "Someone will be with you right away. Please stay calm and remain where you are.";
    }

    public String staffNotified(String staffType) {
        return "I understand you need assistance. I've notified your " + staffType + " about your request. "
                + "They will be with you shortly to help. Is there anything else I can assist you with while you wait?";
    }

    public String water() {
        return "I'll let your nurse know you'd like some water. They'll bring it to you shortly.";
    }

    public String roomTemperature() {
        return "I can help with that. I'll notify your nurse to adjust the room temperature. "
                + "In the meantime, would you like an extra blanket?";
    }

    public String television() {
        return "The TV remote should be on your bedside table. If you can't find it, I'll have your nurse bring you one.";
    }

    public String lights() {
        return "You can adjust the lights using the control panel on the side of your bed. "
                + "Would you like me to have your nurse help you with that?";
    }

    public String visitingHours() {
        return "Visiting hours are from 10 AM to 8 PM daily. Visitors should check in at the nurse's station.";
    }

    public String currentTime(LocalTime now) {
        return "The current time is " + CLOCK.format(now) + ".";
    }

    public String requestNoted() {
        return "I've noted your request and will let your nurse know. They'll assist you as soon as possible.";
    }

    public String coordinatingWithCareTeam() {
        return "I've received your request and am coordinating with the care team. Someone will be with you shortly.";
    }

    public String staffAlert(String patientId, String bedId, String escalation, String text) {
        String bed = bedId != null && !bedId.isBlank() ? " (bed " + bedId + ")" : "";
        return "[" + escalation + "] Patient " + patientId + bed + ": \"" + text + "\"";
    }

    public String slaBreachAlert(String entryId, String patientId, int slaMinutes) {
        return "[SLA BREACH] Approval " + entryId + " for patient " + patientId
                + " has been pending longer than " + slaMinutes + " minutes";
    }
}
