package com.flagship.fundraising_ledger.support;

import com.flagship.fundraising_ledger.allocation.AllocationGuard;
import com.flagship.fundraising_ledger.hierarchy.HierarchyResolver;
import com.flagship.fundraising_ledger.ledger.IdempotencyService;
import com.flagship.fundraising_ledger.ledger.LedgerEntryMapper;
import com.flagship.fundraising_ledger.ledger.LedgerEntryPersistenceService;
import com.flagship.fundraising_ledger.ledger.LedgerEntryService;
import com.flagship.fundraising_ledger.ledger.LedgerEntryValidator;
import com.flagship.fundraising_ledger.observability.FinancialMetrics;
import com.flagship.fundraising_ledger.outbox.OutboxService;
import com.flagship.fundraising_ledger.recalc.RecalculationCoordinator;
import com.flagship.fundraising_ledger.recalc.RecomputeLocks;
import com.flagship.fundraising_ledger.rollup.RollupCalculator;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.mockito.Mockito.mock;

/**
 * The rollup engine wired by hand over in-memory stores, for tests that
 * need real collaborators but no database. Outbox writes go to a mock.
 */
public class RollupFixture implements AutoCloseable {

    public static final int MAX_ATTEMPTS = 3;

    public final InMemoryLedgerRecordStore records = new InMemoryLedgerRecordStore();
    public final InMemoryHierarchyStore hierarchy = new InMemoryHierarchyStore();
    public final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    public final FinancialMetrics metrics = new FinancialMetrics(meterRegistry);
    public final LedgerEntryMapper mapper = new LedgerEntryMapper();
    public final RollupCalculator calculator = new RollupCalculator();
    public final OutboxService outboxService = mock(OutboxService.class);

    public final HierarchyResolver resolver;
    public final AllocationGuard allocationGuard;
    public final RecomputeLocks locks = new RecomputeLocks();
    public final RecalculationCoordinator coordinator;
    public final LedgerEntryService ledgerEntryService;

    private final ExecutorService executor;

    public RollupFixture() {
        this(5, 2000);
    }

    public RollupFixture(int concurrency, long timeoutMs) {
        this.executor = Executors.newFixedThreadPool(10);
        this.resolver = new HierarchyResolver(records, hierarchy, mapper, executor, metrics, concurrency, timeoutMs);
        this.allocationGuard = new AllocationGuard(resolver, metrics);
        RetryRegistry retryRegistry = RetryRegistry.of(RetryConfig.custom()
                .maxAttempts(MAX_ATTEMPTS)
                .waitDuration(Duration.ofMillis(1))
                .build());
        this.coordinator = new RecalculationCoordinator(resolver, hierarchy, calculator,
                allocationGuard, locks, metrics, retryRegistry);
        LedgerEntryPersistenceService persistence =
                new LedgerEntryPersistenceService(records, mapper, outboxService);
        this.ledgerEntryService = new LedgerEntryService(new LedgerEntryValidator(), resolver, persistence,
                allocationGuard, coordinator, new IdempotencyService(records, Optional.empty()), metrics);
    }

    public double counter(String name, String... tags) {
        Counter counter = meterRegistry.find(name).tags(tags).counter();
        return counter == null ? 0 : counter.count();
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
