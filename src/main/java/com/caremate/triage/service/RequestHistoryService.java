package com.caremate.triage.service;

import com.caremate.triage.entity.RequestHistory;
import com.caremate.triage.repository.RequestHistoryRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@Service
@RequiredArgsConstructor
public class RequestHistoryService {

    private final RequestHistoryRepository repository;

    /** The patient's last few request texts, oldest first. */
    @Transactional(readOnly = true)
    public List<String> recentRequests(String patientId) {
        List<String> texts = new ArrayList<>();
        for (RequestHistory h : repository.findTop3ByPatientIdOrderByCreatedAtDesc(patientId)) {
            texts.add(h.getContent());
        }
        Collections.reverse(texts);
        return texts;
    }

    @Transactional
    public void append(String patientId, String requestId, String content) {
        repository.save(RequestHistory.builder()
                .patientId(patientId)
                .requestId(requestId)
                .content(content)
                .build());
    }
}
