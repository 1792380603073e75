package com.caremate.triage.utils;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IdGeneratorTest {

    @Test
    void idsAreTimeOrderedWithRandomSuffix() {
        String id = IdGenerator.next(IdGenerator.APPROVAL_PREFIX, Instant.parse("2026-10-19T08:15:02Z"));

        assertTrue(id.matches("APR-20261019081502-[0-9a-f]{12}"), id);
    }

    @Test
    void sameInstantGivesDistinctIds() {
        Instant at = Instant.parse("2026-10-19T08:15:02Z");
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 1000; i++) {
            ids.add(IdGenerator.next(IdGenerator.AUDIT_PREFIX, at));
        }
        assertEquals(1000, ids.size());
    }
}
