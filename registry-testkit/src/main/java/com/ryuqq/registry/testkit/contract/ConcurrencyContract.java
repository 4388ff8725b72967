package com.ryuqq.registry.testkit.contract;

import com.ryuqq.registry.core.error.RegistryErrorCode;
import com.ryuqq.registry.core.error.RegistryException;
import com.ryuqq.registry.core.event.RecordCreated;
import com.ryuqq.registry.core.model.Identity;
import com.ryuqq.registry.core.model.RecordId;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.LongStream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: single-writer serialization under concurrent callers.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Concurrent creates → ids 1..n, no gaps, no duplicates, events in id order</li>
 *   <li>Concurrent grants of one identity → exactly one succeeds</li>
 *   <li>Concurrent deactivations of one record → exactly one succeeds</li>
 * </ul>
 *
 * @author Registry Team
 * @since 1.0.0
 */
public abstract class ConcurrencyContract extends AbstractRegistryContractTest {

    private static final int THREADS = 8;
    private static final int CREATES_PER_THREAD = 25;

    @Test
    public void testConcurrentCreates_IdsContiguousAndUnique() throws Exception {
        // Given
        List<Identity> contributors = new ArrayList<>();
        for (int i = 0; i < THREADS; i++) {
            Identity identity = Identity.of("0xC0" + i);
            grant(identity, "Lab " + i);
            contributors.add(identity);
        }
        events.clear();

        // When
        List<Callable<List<RecordId>>> tasks = new ArrayList<>();
        for (Identity contributor : contributors) {
            tasks.add(() -> {
                List<RecordId> ids = new ArrayList<>();
                for (int n = 0; n < CREATES_PER_THREAD; n++) {
                    ids.add(createRecordAs(contributor, "Species " + n));
                }
                return ids;
            });
        }
        List<List<RecordId>> perThread = runConcurrently(tasks);

        // Then
        long total = (long) THREADS * CREATES_PER_THREAD;
        List<Long> allocated = perThread.stream()
            .flatMap(List::stream)
            .map(RecordId::getValue)
            .sorted()
            .collect(Collectors.toList());
        assertEquals(LongStream.rangeClosed(1, total).boxed().collect(Collectors.toList()), allocated);
        assertEquals(total, registry.recordCount());

        for (int i = 0; i < THREADS; i++) {
            assertEquals(perThread.get(i), registry.getContributorRecords(contributors.get(i)),
                    "Index must list the contributor's ids in creation order");
        }

        List<Long> eventIds = events.eventsOfType(RecordCreated.class).stream()
            .map(created -> created.recordId().getValue())
            .collect(Collectors.toList());
        assertEquals(allocated, eventIds, "RecordCreated events must follow commit order");
    }

    @Test
    public void testConcurrentGrants_ExactlyOneSucceeds() throws Exception {
        // When
        List<Callable<RegistryErrorCode>> tasks = new ArrayList<>();
        for (int i = 0; i < THREADS; i++) {
            String name = "Lab " + i;
            tasks.add(() -> attempt(() -> registry.grantContributor(OWNER, ALICE, name)));
        }
        List<RegistryErrorCode> results = runConcurrently(tasks);

        // Then
        assertEquals(1, results.stream().filter(code -> code == null).count());
        assertEquals(THREADS - 1, results.stream().filter(code -> code == RegistryErrorCode.ALREADY_AUTHORIZED).count());
        assertEquals(1, events.size());
    }

    @Test
    public void testConcurrentDeactivations_ExactlyOneSucceeds() throws Exception {
        // Given
        grant(ALICE, "Lab A");
        RecordId id = createRecordAs(ALICE, "Rana temporaria");

        // When: creator and owner race
        List<Callable<RegistryErrorCode>> tasks = new ArrayList<>();
        for (int i = 0; i < THREADS; i++) {
            Identity caller = i % 2 == 0 ? ALICE : OWNER;
            tasks.add(() -> attempt(() -> registry.deactivateRecord(caller, id)));
        }
        List<RegistryErrorCode> results = runConcurrently(tasks);

        // Then
        assertEquals(1, results.stream().filter(code -> code == null).count());
        assertEquals(THREADS - 1, results.stream().filter(code -> code == RegistryErrorCode.INACTIVE).count());
        assertFalse(registry.getRecord(id).isActive());
    }

    /**
     * Runs the call and returns the rejection code, or null on success.
     */
    private static RegistryErrorCode attempt(Runnable call) {
        try {
            call.run();
            return null;
        } catch (RegistryException e) {
            return e.getErrorCode();
        }
    }

    /**
     * Starts all tasks behind a common gate and collects results in task order.
     */
    private static <T> List<T> runConcurrently(List<Callable<T>> tasks) throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(tasks.size());
        CountDownLatch gate = new CountDownLatch(1);
        try {
            List<Future<T>> futures = new ArrayList<>();
            for (Callable<T> task : tasks) {
                futures.add(executor.submit(() -> {
                    gate.await();
                    return task.call();
                }));
            }
            gate.countDown();

            List<T> results = new ArrayList<>();
            for (Future<T> future : futures) {
                results.add(future.get(30, TimeUnit.SECONDS));
            }
            return results;
        } finally {
            executor.shutdownNow();
        }
    }
}
