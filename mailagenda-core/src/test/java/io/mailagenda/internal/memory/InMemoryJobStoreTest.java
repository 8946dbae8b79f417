package io.mailagenda.internal.memory;

import io.mailagenda.core.AbstractJobStoreTest;
import io.mailagenda.core.JobStore;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryJobStoreTest extends AbstractJobStoreTest {

    @Override
    protected JobStore newStore() {
        return new InMemoryJobStore();
    }

    @Test
    void idsShouldSortInCreationOrder() {
        String first = store.create(spec("a@example.com", T0), T0);
        String second = store.create(spec("b@example.com", T0), T0);

        assertTrue(first.compareTo(second) < 0);
    }
}
