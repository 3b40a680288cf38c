package io.bulkaction.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DaemonThreadFactoryTest {

    @Test
    void createsDaemonThreadsWithPrefix() {
        DaemonThreadFactory factory = new DaemonThreadFactory("bulkaction-worker-");

        Thread thread = factory.newThread(() -> {
        });

        assertTrue(thread.isDaemon());
        assertTrue(thread.getName().startsWith("bulkaction-worker-"));
    }

    @Test
    void numbersThreadsInCreationOrder() {
        DaemonThreadFactory factory = new DaemonThreadFactory("poller-");

        assertEquals("poller-1", factory.newThread(() -> { }).getName());
        assertEquals("poller-2", factory.newThread(() -> { }).getName());
    }

    @Test
    void nullPrefixThrows() {
        assertThrows(NullPointerException.class, () -> new DaemonThreadFactory(null));
    }
}
