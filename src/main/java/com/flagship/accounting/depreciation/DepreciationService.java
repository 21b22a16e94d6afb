package com.flagship.accounting.depreciation;

import com.flagship.accounting.config.AccountingProperties;
import com.flagship.accounting.event.DepreciationRecordedEvent;
import com.flagship.accounting.exception.FailureKind;
import com.flagship.accounting.exception.ReferenceNotFoundException;
import com.flagship.accounting.exception.ValidationFailureException;
import com.flagship.accounting.ledger.JournalEntry;
import com.flagship.accounting.ledger.JournalEntryType;
import com.flagship.accounting.ledger.JournalService;
import com.flagship.accounting.ledger.PostingLine;
import com.flagship.accounting.ledger.PostingRequest;
import com.flagship.accounting.ledger.SourceRef;
import com.flagship.accounting.observability.AccountingMetrics;
import com.flagship.accounting.observability.CorrelationContext;
import com.flagship.accounting.outbox.OutboxService;
import com.flagship.accounting.period.FinancialPeriodService;
import com.flagship.accounting.sequence.DocumentSequenceService;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Monthly depreciation batch.
 *
 * Every asset is handled in its own transaction, so a failure leaves earlier assets
 * committed and later ones untouched. Re-running a month is safe: an asset that already
 * has an entry for the month is skipped, and the (asset, period_date) unique key backs that up.
 */
@Service
@Slf4j
public class DepreciationService {

    static final String DEPRECIATION_PREFIX = "DEP";
    static final String SOURCE_TYPE = SourceRef.DEPRECIATION;
    private static final String AGGREGATE_TYPE = "FixedAsset";

    private final FixedAssetRepository assetRepository;
    private final AssetCategoryRepository categoryRepository;
    private final DepreciationEntryRepository entryRepository;
    private final JournalService journalService;
    private final FinancialPeriodService periodService;
    private final DocumentSequenceService sequenceService;
    private final OutboxService outboxService;
    private final AccountingProperties properties;
    private final AccountingMetrics metrics;
    private final TransactionTemplate perAssetTransaction;

    public DepreciationService(FixedAssetRepository assetRepository,
                               AssetCategoryRepository categoryRepository,
                               DepreciationEntryRepository entryRepository,
                               JournalService journalService,
                               FinancialPeriodService periodService,
                               DocumentSequenceService sequenceService,
                               OutboxService outboxService,
                               AccountingProperties properties,
                               AccountingMetrics metrics,
                               PlatformTransactionManager transactionManager) {
        this.assetRepository = assetRepository;
        this.categoryRepository = categoryRepository;
        this.entryRepository = entryRepository;
        this.journalService = journalService;
        this.periodService = periodService;
        this.sequenceService = sequenceService;
        this.outboxService = outboxService;
        this.properties = properties;
        this.metrics = metrics;
        this.perAssetTransaction = new TransactionTemplate(transactionManager);
        this.perAssetTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    /**
     * Depreciates the ACTIVE assets (or only {@code assetIds}) for the month containing {@code periodDate}.
     */
    public DepreciationRunResult run(LocalDate periodDate, Collection<UUID> assetIds, String user) {
        requireArguments(periodDate, user);
        LocalDate period = DepreciationCalculator.periodEnd(periodDate);

        List<UUID> targets;
        Map<UUID, String> skipped = new LinkedHashMap<>();
        if (assetIds == null || assetIds.isEmpty()) {
            targets = assetRepository.findIdsByStatus(AssetStatus.ACTIVE);
        } else {
            targets = assetRepository.findIdsByStatusAndIdIn(AssetStatus.ACTIVE, assetIds);
            for (UUID requested : assetIds) {
                if (!targets.contains(requested)) {
                    skipped.put(requested, "not found or not ACTIVE");
                }
            }
        }

        List<DepreciationEntry> entries = new ArrayList<>();
        Map<UUID, String> failed = new LinkedHashMap<>();
        for (UUID assetId : targets) {
            Outcome outcome = inAssetTransaction(assetId, failed, () -> depreciate(assetId, period, user));
            if (outcome == null) {
                continue;
            }
            if (outcome.entry() != null) {
                entries.add(outcome.entry());
            } else {
                skipped.put(assetId, outcome.skipReason());
            }
        }

        log.info("Depreciation run for {} by {}: {} entries, {} skipped, {} failed",
            period, user, entries.size(), skipped.size(), failed.size());
        return new DepreciationRunResult(period, entries, skipped, failed);
    }

    /**
     * Posts entries of the month that were recorded without a journal entry, now that
     * their category accounts or an OPEN period exist.
     */
    public DepreciationRunResult postPending(LocalDate periodDate, String user) {
        requireArguments(periodDate, user);
        LocalDate period = DepreciationCalculator.periodEnd(periodDate);

        List<DepreciationEntry> posted = new ArrayList<>();
        Map<UUID, String> skipped = new LinkedHashMap<>();
        Map<UUID, String> failed = new LinkedHashMap<>();
        for (UUID entryId : entryRepository.findUnpostedIds(period)) {
            Outcome outcome = inAssetTransaction(entryId, failed, () -> postEntry(entryId, user));
            if (outcome == null) {
                continue;
            }
            if (outcome.entry() != null) {
                posted.add(outcome.entry());
            } else {
                skipped.put(entryId, outcome.skipReason());
            }
        }

        log.info("Posted {} pending depreciation entries for {} ({} skipped, {} failed)",
            posted.size(), period, skipped.size(), failed.size());
        return new DepreciationRunResult(period, posted, skipped, failed);
    }

    private Outcome inAssetTransaction(UUID id, Map<UUID, String> failed, Supplier<Outcome> work) {
        MDC.put(CorrelationContext.ASSET_ID_MDC_KEY, id.toString());
        try {
            return perAssetTransaction.execute(status -> work.get());
        } catch (RuntimeException e) {
            log.error("Depreciation failed for {}: {}", id, e.getMessage(), e);
            failed.put(id, e.getMessage());
            return null;
        } finally {
            MDC.remove(CorrelationContext.ASSET_ID_MDC_KEY);
        }
    }

    private Outcome depreciate(UUID assetId, LocalDate period, String user) {
        FixedAssetEntity entity = assetRepository.findByIdForUpdate(assetId)
            .orElseThrow(() -> ReferenceNotFoundException.of(FailureKind.ASSET_NOT_FOUND, "Asset", assetId));
        FixedAsset asset = entity.toDomain();

        if (asset.getStatus() != AssetStatus.ACTIVE) {
            return Outcome.skip("asset is " + asset.getStatus());
        }
        if (asset.getAcquisitionDate().isAfter(period)) {
            return Outcome.skip("acquired after " + period);
        }
        if (entryRepository.existsByAssetIdAndPeriodDate(assetId, period)) {
            return Outcome.skip("already depreciated for " + period);
        }
        if (asset.isFullyDepreciated()) {
            return Outcome.skip("fully depreciated");
        }

        AssetCategory category = loadCategory(asset.getCategoryId());
        DepreciationMethod method = asset.effectiveMethod(category);
        BigDecimal rate = asset.effectiveRate(category);
        BigDecimal amount = DepreciationCalculator.monthlyAmount(method, rate,
            asset.getCapitalizedValue(), asset.getCurrentBookValue(), asset.getSalvageValue());
        if (amount.signum() == 0) {
            return Outcome.skip("fully depreciated");
        }

        String unpostableReason = unpostableReason(category, period);
        if (unpostableReason != null
                && properties.getDepreciation().getUnpostedPolicy() == AccountingProperties.UnpostedPolicy.SKIP) {
            return Outcome.skip(unpostableReason);
        }

        String reference = sequenceService.next(DEPRECIATION_PREFIX, period);
        FixedAsset depreciated = asset.depreciate(amount, period);
        DepreciationEntry entry = DepreciationEntry.compute(reference, asset, depreciated, period, method, rate, amount, user);
        if (unpostableReason == null) {
            JournalEntry journalEntry = postToLedger(entry, asset, category, user);
            entry = entry.markPosted(journalEntry.getId());
        } else {
            log.warn("Depreciation {} for asset {} recorded without posting: {}",
                reference, asset.getAssetCode(), unpostableReason);
        }

        entryRepository.save(DepreciationEntryEntity.fromDomain(entry));
        entity.updateFromDomain(depreciated);
        assetRepository.save(entity);
        outboxService.saveEvent(AGGREGATE_TYPE, DepreciationRecordedEvent.from(depreciated, entry));
        metrics.recordDepreciationEntry(method.name(), entry.isPosted());

        log.info("Depreciated asset {} by {} for {} ({} -> {})", asset.getAssetCode(), amount, period,
            asset.getCurrentBookValue(), depreciated.getCurrentBookValue());
        return Outcome.of(entry);
    }

    private Outcome postEntry(UUID entryId, String user) {
        DepreciationEntryEntity entity = entryRepository.findByIdForUpdate(entryId)
            .orElseThrow(() -> new IllegalStateException("Depreciation entry disappeared: " + entryId));
        DepreciationEntry entry = entity.toDomain();
        if (entry.isPosted()) {
            return Outcome.skip("already posted");
        }
        FixedAsset asset = assetRepository.findById(entry.getAssetId())
            .map(FixedAssetEntity::toDomain)
            .orElseThrow(() -> ReferenceNotFoundException.of(FailureKind.ASSET_NOT_FOUND, "Asset", entry.getAssetId()));
        AssetCategory category = loadCategory(asset.getCategoryId());
        String unpostableReason = unpostableReason(category, entry.getPeriodDate());
        if (unpostableReason != null) {
            return Outcome.skip(unpostableReason);
        }

        JournalEntry journalEntry = postToLedger(entry, asset, category, user);
        DepreciationEntry posted = entry.markPosted(journalEntry.getId());
        entity.updateFromDomain(posted);
        entryRepository.save(entity);
        outboxService.saveEvent(AGGREGATE_TYPE, DepreciationRecordedEvent.from(asset, posted));
        metrics.recordDepreciationEntry(posted.getMethod().name(), true);
        return Outcome.of(posted);
    }

    private String unpostableReason(AssetCategory category, LocalDate period) {
        if (!category.canPost()) {
            return "category " + category.getCode() + " has no depreciation accounts";
        }
        if (!periodService.hasOpenPeriod(period)) {
            return "no open period for " + period;
        }
        return null;
    }

    private JournalEntry postToLedger(DepreciationEntry entry, FixedAsset asset, AssetCategory category, String user) {
        PostingRequest request = PostingRequest.builder()
            .entryDate(entry.getPeriodDate())
            .entryType(JournalEntryType.DEPRECIATION)
            .narration("Depreciation for " + asset.getName() + " - "
                + DepreciationCalculator.monthLabel(entry.getPeriodDate()))
            .source(SourceRef.of(SOURCE_TYPE, entry.getId(), entry.getReferenceNumber()))
            .line(PostingLine.debit(category.getDepreciationExpenseAccountId(), entry.getAmount(),
                "Depreciation expense - " + asset.getName()))
            .line(PostingLine.credit(category.getAccumulatedDepreciationAccountId(), entry.getAmount(),
                "Accumulated depreciation - " + asset.getName()))
            .createdBy(user)
            .build();
        return journalService.post(request);
    }

    private AssetCategory loadCategory(UUID categoryId) {
        return categoryRepository.findById(categoryId)
            .map(AssetCategoryEntity::toDomain)
            .orElseThrow(() -> ReferenceNotFoundException.of(FailureKind.CATEGORY_NOT_FOUND, "Asset category", categoryId));
    }

    private static void requireArguments(LocalDate periodDate, String user) {
        if (periodDate == null) {
            throw new ValidationFailureException(FailureKind.MISSING_FIELD, "Period date is required");
        }
        if (user == null || user.isBlank()) {
            throw new ValidationFailureException(FailureKind.MISSING_FIELD, "Acting user is required");
        }
    }

    private record Outcome(DepreciationEntry entry, String skipReason) {
        static Outcome of(DepreciationEntry entry) {
            return new Outcome(entry, null);
        }

        static Outcome skip(String reason) {
            return new Outcome(null, reason);
        }
    }
}
