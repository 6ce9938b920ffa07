package com.lernify.road.progression;

import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

import static org.junit.jupiter.api.Assertions.*;

class ProgressionLockStripesTest {

    private final ProgressionService service = new ProgressionService(null, null, null, null);

    @Test
    void sameUserAndDomainAlwaysShareALock() {
        assertSame(service.lockFor("u-1", "backend"), service.lockFor("u-1", "backend"));
    }

    @Test
    void lockPoolStaysBoundedForManyUsers() {
        Set<ReentrantLock> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        for (int i = 0; i < 10_000; i++) {
            seen.add(service.lockFor("user-" + i, "backend"));
            seen.add(service.lockFor("user-" + i, "frontend"));
        }
        assertTrue(seen.size() <= ProgressionService.LOCK_STRIPES);
    }
}
