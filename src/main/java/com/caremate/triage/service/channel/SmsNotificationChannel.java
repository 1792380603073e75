package com.caremate.triage.service.channel;

import com.caremate.triage.entity.StaffMember;
import com.caremate.triage.exception.NotificationDeliveryException;
import com.caremate.triage.repository.StaffMemberRepository;
import com.caremate.triage.utils.NotificationChannelType;
import com.caremate.triage.utils.UrgencyLevel;
import com.twilio.Twilio;
import com.twilio.exception.TwilioException;
import com.twilio.rest.api.v2010.account.Message;
import com.twilio.type.PhoneNumber;
import jakarta.annotation.PostConstruct;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Texts critical alerts to the staff member's phone on file through Twilio.
 */
@Component
public class SmsNotificationChannel implements NotificationChannel {

    private static final Logger log = LoggerFactory.getLogger(SmsNotificationChannel.class);

    /** Twilio splits longer bodies into several segments. */
    private static final int MAX_BODY_LENGTH = 320;

    private final StaffMemberRepository staffMemberRepository;

    @Value("${twilio.accountSid:${twilio.account-sid:}}")
    private String accountSid;

    @Value("${twilio.authToken:${twilio.auth-token:}}")
    private String authToken;

    @Value("${twilio.sms-from:}")
    private String fromNumber;

    public SmsNotificationChannel(StaffMemberRepository staffMemberRepository) {
        this.staffMemberRepository = staffMemberRepository;
    }

    @PostConstruct
    void init() {
        if (isConfigured()) {
            Twilio.init(accountSid, authToken);
            log.info("Twilio SMS channel enabled, sending from {}", fromNumber);
        } else {
            log.warn("Twilio credentials not set; SMS alerts disabled");
        }
    }

    @Override
    public NotificationChannelType type() {
        return NotificationChannelType.SMS;
    }

    @Override
    public boolean isConfigured() {
        return StringUtils.isNoneBlank(accountSid, authToken, fromNumber);
    }

    @Override
    public void deliver(String recipientId, String message, UrgencyLevel priority) {
        if (!isConfigured()) {
            throw new NotificationDeliveryException(type(), recipientId, "Twilio credentials not set");
        }
        String phone = staffMemberRepository.findByStaffIdAndActiveTrue(recipientId)
                .map(StaffMember::getPhone)
                .filter(StringUtils::isNotBlank)
                .orElseThrow(() -> new NotificationDeliveryException(type(), recipientId, "no phone number on file"));
        String body = StringUtils.abbreviate(message, MAX_BODY_LENGTH);
        try {
            Message sent = Message.creator(new PhoneNumber(phone), new PhoneNumber(fromNumber), body).create();
            log.info("SMS {} sent to {} ({})", sent.getSid(), recipientId, priority);
        } catch (TwilioException e) {
            throw new NotificationDeliveryException(type(), recipientId, e);
        }
    }
}
