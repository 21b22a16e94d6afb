package com.flagship.accounting.sequence;

import com.flagship.accounting.support.AbstractIntegrationTest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.transaction.IllegalTransactionStateException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class DocumentSequenceServiceTest extends AbstractIntegrationTest {

    private static final LocalDate DAY = LocalDate.of(2024, 9, 3);

    @Autowired
    private DocumentSequenceService sequenceService;

    @Autowired
    private TransactionTemplate transactionTemplate;

    private String next(String prefix, LocalDate date) {
        return transactionTemplate.execute(status -> sequenceService.next(prefix, date));
    }

    @Test
    @DisplayName("Counters are per prefix and per day")
    void testNext_Scopes() {
        assertEquals("JV-20240903-0001", next("JV", DAY));
        assertEquals("JV-20240903-0002", next("JV", DAY));
        assertEquals("PAY-20240903-0001", next("PAY", DAY));
        assertEquals("JV-20240904-0001", next("JV", DAY.plusDays(1)));
    }

    @Test
    @DisplayName("Rolled-back callers release their number")
    void testNext_RollbackReleases() {
        transactionTemplate.executeWithoutResult(status -> {
            sequenceService.next("RCP", DAY);
            status.setRollbackOnly();
        });

        assertEquals("RCP-20240903-0001", next("RCP", DAY));
    }

    @Test
    @DisplayName("Issuing a number requires a surrounding transaction")
    void testNext_RequiresTransaction() {
        assertThrows(IllegalTransactionStateException.class, () -> sequenceService.next("JV", DAY));
    }

    @Test
    @DisplayName("Concurrent callers never receive the same number")
    void testNext_Concurrent() throws Exception {
        int threads = 10;
        int perThread = 20;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<List<String>>> futures = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            futures.add(executor.submit(() -> {
                start.await();
                List<String> issued = new ArrayList<>();
                for (int i = 0; i < perThread; i++) {
                    issued.add(next("JV", DAY));
                }
                return issued;
            }));
        }
        start.countDown();

        Set<String> numbers = new HashSet<>();
        for (Future<List<String>> future : futures) {
            numbers.addAll(future.get(60, TimeUnit.SECONDS));
        }
        executor.shutdown();

        assertEquals(threads * perThread, numbers.size());
        assertTrue(numbers.contains("JV-20240903-0200"));
        assertFalse(numbers.contains("JV-20240903-0201"));
    }
}
