package com.flagship.accounting.ledger;

import com.flagship.accounting.costcenter.CostCenterService;
import com.flagship.accounting.event.JournalEntryPostedEvent;
import com.flagship.accounting.event.JournalEntryReversedEvent;
import com.flagship.accounting.exception.FailureKind;
import com.flagship.accounting.exception.ReferenceNotFoundException;
import com.flagship.accounting.exception.StateConflictException;
import com.flagship.accounting.exception.ValidationFailureException;
import com.flagship.accounting.observability.AccountingMetrics;
import com.flagship.accounting.observability.CorrelationContext;
import com.flagship.accounting.outbox.OutboxService;
import com.flagship.accounting.period.FinancialPeriod;
import com.flagship.accounting.period.FinancialPeriodService;
import com.flagship.accounting.sequence.DocumentSequenceService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Journal engine: the only writer of general ledger rows and account balances.
 *
 * Every posting runs in one transaction:
 * 1. Validates the request (balanced, non-zero, lines well formed)
 * 2. Resolves the single OPEN period for the entry date, holding a shared lock on it
 * 3. Locks the touched account rows in id order and checks each is an active leaf
 * 4. Writes the entry and its lines
 * 5. Writes one ledger row per line with the account's balance after that line, and moves the balance
 * 6. Writes the JournalEntryPosted event to the outbox
 *
 * A failure at any step rolls the whole posting back. The balance trigger on
 * journal lines re-checks debits against credits at commit.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JournalService {

    static final String JOURNAL_PREFIX = "JV";
    private static final String AGGREGATE_TYPE = "JournalEntry";
    private static final Set<String> OWNED_SOURCE_TYPES = Set.of(SourceRef.VOUCHER, SourceRef.DEPRECIATION);
    // open bounds for list queries without a date filter
    private static final LocalDate LIST_FLOOR = LocalDate.of(1900, 1, 1);
    private static final LocalDate LIST_CEILING = LocalDate.of(9999, 12, 31);

    private final JournalEntryRepository journalEntryRepository;
    private final AccountRepository accountRepository;
    private final FinancialPeriodService periodService;
    private final CostCenterService costCenterService;
    private final DocumentSequenceService sequenceService;
    private final OutboxService outboxService;
    private final AccountingMetrics metrics;
    private final JdbcTemplate jdbcTemplate;

    /**
     * Posts a balanced entry.
     *
     * @param request the entry to post
     * @param idempotencyKey optional; a repeated key returns the entry created by the first call
     * @return the POSTED entry
     */
    @Transactional
    public JournalEntry post(PostingRequest request, String idempotencyKey) {
        if (idempotencyKey != null) {
            Optional<JournalEntryEntity> existing = journalEntryRepository.findByIdempotencyKey(idempotencyKey);
            if (existing.isPresent()) {
                log.info("Idempotency key {} already used by journal entry {}",
                    idempotencyKey, existing.get().getEntryNumber());
                return existing.get().toDomain();
            }
        }
        return postNew(request, idempotencyKey, null);
    }

    @Transactional
    public JournalEntry post(PostingRequest request) {
        return post(request, null);
    }

    /**
     * Reverses a POSTED entry by posting its exact debit/credit mirror on {@code reversalDate}.
     * The original keeps status POSTED and is flagged reversed; both entries link to each other.
     * Entries owned by a voucher or a depreciation entry are refused here and must be reversed
     * through their document.
     */
    @Transactional
    public JournalEntry reverse(UUID entryId, LocalDate reversalDate, String reason, String user) {
        return reverse(entryId, null, reversalDate, reason, user);
    }

    /**
     * Reverses an entry on behalf of the document that owns it.
     *
     * @param ownerType source type the entry must carry, e.g. {@link SourceRef#VOUCHER}
     */
    @Transactional
    public JournalEntry reverseOwned(UUID entryId, String ownerType, LocalDate reversalDate, String reason,
                                     String user) {
        return reverse(entryId, ownerType, reversalDate, reason, user);
    }

    private JournalEntry reverse(UUID entryId, String ownerType, LocalDate reversalDate, String reason, String user) {
        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.JOURNAL_ENTRY_ID_MDC_KEY, entryId.toString());
        try {
            if (reversalDate == null) {
                throw new ValidationFailureException(FailureKind.MISSING_FIELD, "Reversal date is required");
            }
            JournalEntryEntity originalEntity = journalEntryRepository.findByIdForUpdate(entryId)
                .orElseThrow(() -> ReferenceNotFoundException.of(FailureKind.JOURNAL_ENTRY_NOT_FOUND, "Journal entry", entryId));
            JournalEntry original = originalEntity.toDomain();

            if (!original.isPosted()) {
                throw new StateConflictException(FailureKind.INVALID_TRANSITION,
                    String.format("Only posted journal entries can be reversed; %s is %s",
                        original.getEntryNumber(), original.getStatus()));
            }
            if (original.isReversed()) {
                throw new StateConflictException(FailureKind.ALREADY_REVERSED,
                    "Journal entry " + original.getEntryNumber() + " is already reversed");
            }
            requireOwner(original, ownerType);

            String narration = "Reversal of " + original.getEntryNumber()
                + (reason != null && !reason.isBlank() ? ": " + reason : "");
            PostingRequest reversalRequest = PostingRequest.builder()
                .entryDate(reversalDate)
                .entryType(JournalEntryType.REVERSAL)
                .narration(narration)
                .source(original.getSourceType() != null
                    ? SourceRef.of(original.getSourceType(), original.getSourceId(), original.getSourceNumber())
                    : null)
                .lines(original.getLines().stream()
                    .map(line -> line.toPostingLine()
                        .swapped("Reversal: " + (line.getDescription() != null ? line.getDescription() : "")))
                    .toList())
                .createdBy(user)
                .build();

            JournalEntry reversal = postNew(reversalRequest, null, original.getId());

            JournalEntry marked = original.markReversed(reversal.getId());
            originalEntity.updateFromDomain(marked);
            journalEntryRepository.save(originalEntity);

            outboxService.saveEvent(AGGREGATE_TYPE, original.getId(),
                JournalEntryReversedEvent.EVENT_TYPE, JournalEntryReversedEvent.from(marked, reversal, reason));

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordJournalReversed("success");
            metrics.recordLatency("journal_reverse", duration);
            log.info("Reversed journal entry {} with {}, duration={}ms",
                original.getEntryNumber(), reversal.getEntryNumber(), duration);
            return reversal;
        } catch (RuntimeException e) {
            metrics.recordJournalReversed("error");
            log.warn("Journal reversal failed: error={}", e.getMessage());
            throw e;
        } finally {
            MDC.remove(CorrelationContext.JOURNAL_ENTRY_ID_MDC_KEY);
        }
    }

    private static void requireOwner(JournalEntry entry, String ownerType) {
        String sourceType = entry.getSourceType();
        if (ownerType == null) {
            if (sourceType != null && OWNED_SOURCE_TYPES.contains(sourceType)) {
                throw new StateConflictException(FailureKind.INVALID_TRANSITION,
                    String.format("Journal entry %s belongs to %s %s and can only be reversed through it",
                        entry.getEntryNumber(), sourceType, entry.getSourceNumber()));
            }
        } else if (!ownerType.equals(sourceType)) {
            throw new StateConflictException(FailureKind.INVALID_TRANSITION,
                String.format("Journal entry %s is not owned by a %s", entry.getEntryNumber(), ownerType));
        }
    }

    /**
     * Stores a balanced DRAFT entry without touching the ledger.
     * Drafts block closing of the period they are dated in.
     */
    @Transactional
    public JournalEntry createDraft(PostingRequest request) {
        request.validate();
        FinancialPeriod period = periodService.requireOpenPeriod(request.getEntryDate());
        Set<UUID> accountIds = accountIdsOf(request.getLines());
        Map<UUID, AccountEntity> accounts = accountRepository.findAllById(accountIds).stream()
            .collect(Collectors.toMap(AccountEntity::getId, Function.identity()));
        checkAccounts(accountIds, accounts, request.getEntryType());
        costCenterService.requireActive(costCenterIdsOf(request.getLines()));

        String number = request.getEntryNumber() != null
            ? request.getEntryNumber()
            : sequenceService.next(JOURNAL_PREFIX, request.getEntryDate());
        JournalEntry draft = JournalEntry.fromRequest(request, number, period.getId(), JournalEntryStatus.DRAFT, null);
        journalEntryRepository.save(JournalEntryEntity.fromDomain(draft, null));
        log.info("Created draft journal entry {} for {}", number, request.getDebitTotal());
        return draft;
    }

    /**
     * Posts a DRAFT entry through the same path as {@link #post(PostingRequest, String)}.
     */
    @Transactional
    public JournalEntry postDraft(UUID entryId, String user) {
        MDC.put(CorrelationContext.JOURNAL_ENTRY_ID_MDC_KEY, entryId.toString());
        try {
            JournalEntryEntity entity = journalEntryRepository.findByIdForUpdate(entryId)
                .orElseThrow(() -> ReferenceNotFoundException.of(FailureKind.JOURNAL_ENTRY_NOT_FOUND, "Journal entry", entryId));
            JournalEntry draft = entity.toDomain();
            if (!draft.getStatus().canTransitionTo(JournalEntryStatus.POSTED)) {
                throw new StateConflictException(FailureKind.INVALID_TRANSITION,
                    String.format("Journal entry %s is %s, only DRAFT entries can be posted",
                        draft.getEntryNumber(), draft.getStatus()));
            }
            FinancialPeriod period = periodService.requireOpenPeriod(draft.getEntryDate());
            Map<UUID, AccountEntity> accounts = lockAccounts(accountIdsOf(draft.toPostingRequest().getLines()),
                draft.getEntryType());

            JournalEntry posted = draft.post(user, period.getId());
            entity.updateFromDomain(posted);
            journalEntryRepository.saveAndFlush(entity);
            applyToLedger(posted, accounts);

            outboxService.saveEvent(AGGREGATE_TYPE, posted.getId(),
                JournalEntryPostedEvent.EVENT_TYPE, JournalEntryPostedEvent.from(posted));
            metrics.recordJournalPosted(posted.getEntryType().name(), "success");
            log.info("Posted draft journal entry {} by {}", posted.getEntryNumber(), user);
            return posted;
        } finally {
            MDC.remove(CorrelationContext.JOURNAL_ENTRY_ID_MDC_KEY);
        }
    }

    @Transactional
    public JournalEntry cancelDraft(UUID entryId, String user) {
        JournalEntryEntity entity = journalEntryRepository.findByIdForUpdate(entryId)
            .orElseThrow(() -> ReferenceNotFoundException.of(FailureKind.JOURNAL_ENTRY_NOT_FOUND, "Journal entry", entryId));
        JournalEntry draft = entity.toDomain();
        if (!draft.getStatus().canTransitionTo(JournalEntryStatus.CANCELLED)) {
            throw new StateConflictException(FailureKind.INVALID_TRANSITION,
                String.format("Journal entry %s is %s, only DRAFT entries can be cancelled",
                    draft.getEntryNumber(), draft.getStatus()));
        }
        JournalEntry cancelled = draft.cancel(user);
        entity.updateFromDomain(cancelled);
        journalEntryRepository.save(entity);
        log.info("Cancelled draft journal entry {} by {}", cancelled.getEntryNumber(), user);
        return cancelled;
    }

    @Transactional(readOnly = true)
    public JournalEntry findById(UUID entryId) {
        return journalEntryRepository.findById(entryId)
            .map(JournalEntryEntity::toDomain)
            .orElseThrow(() -> ReferenceNotFoundException.of(FailureKind.JOURNAL_ENTRY_NOT_FOUND, "Journal entry", entryId));
    }

    @Transactional(readOnly = true)
    public JournalEntry findByNumber(String entryNumber) {
        return journalEntryRepository.findByEntryNumber(entryNumber)
            .map(JournalEntryEntity::toDomain)
            .orElseThrow(() -> new ReferenceNotFoundException(FailureKind.JOURNAL_ENTRY_NOT_FOUND,
                "Journal entry not found: " + entryNumber));
    }

    @Transactional(readOnly = true)
    public Optional<JournalEntry> findByIdempotencyKey(String idempotencyKey) {
        return journalEntryRepository.findByIdempotencyKey(idempotencyKey).map(JournalEntryEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public List<JournalEntry> listEntries(LocalDate from, LocalDate to, JournalEntryStatus status) {
        LocalDate start = from != null ? from : LIST_FLOOR;
        LocalDate end = to != null ? to : LIST_CEILING;
        return journalEntryRepository.findEntries(start, end, status).stream()
            .map(JournalEntryEntity::toDomain)
            .toList();
    }

    private JournalEntry postNew(PostingRequest request, String idempotencyKey, UUID reversalOfId) {
        long startTime = System.currentTimeMillis();
        try {
            request.validate();
            FinancialPeriod period = periodService.requireOpenPeriod(request.getEntryDate());
            Map<UUID, AccountEntity> accounts = lockAccounts(accountIdsOf(request.getLines()), request.getEntryType());
            costCenterService.requireActive(costCenterIdsOf(request.getLines()));

            String number = request.getEntryNumber() != null
                ? request.getEntryNumber()
                : sequenceService.next(JOURNAL_PREFIX, request.getEntryDate());
            JournalEntry entry = JournalEntry.fromRequest(request, number, period.getId(),
                JournalEntryStatus.POSTED, reversalOfId);
            MDC.put(CorrelationContext.JOURNAL_ENTRY_ID_MDC_KEY, entry.getId().toString());

            // lines must exist before ledger rows reference them
            journalEntryRepository.saveAndFlush(JournalEntryEntity.fromDomain(entry, idempotencyKey));
            applyToLedger(entry, accounts);

            outboxService.saveEvent(AGGREGATE_TYPE, entry.getId(),
                JournalEntryPostedEvent.EVENT_TYPE, JournalEntryPostedEvent.from(entry));

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordJournalPosted(entry.getEntryType().name(), "success");
            metrics.recordLatency("journal_post", duration);
            log.info("Posted journal entry {}: amount={}, lines={}, duration={}ms",
                entry.getEntryNumber(), entry.getTotalDebit(), entry.getLines().size(), duration);
            return entry;
        } catch (RuntimeException e) {
            metrics.recordJournalPosted(request.getEntryType() != null ? request.getEntryType().name() : null, "error");
            log.warn("Journal posting failed: error={}", e.getMessage());
            throw e;
        }
    }

    /**
     * Writes a ledger row per line and moves each account balance by the line's signed delta.
     * Accounts must already be locked by the caller's transaction.
     */
    private void applyToLedger(JournalEntry entry, Map<UUID, AccountEntity> lockedAccounts) {
        for (JournalLine line : entry.getLines()) {
            AccountEntity account = lockedAccounts.get(line.getAccountId());
            BigDecimal delta = account.getAccountType().signedDelta(line.getDebit(), line.getCredit());
            BigDecimal runningBalance = account.applyDelta(delta);
            jdbcTemplate.update(
                "INSERT INTO general_ledger (id, account_id, period_id, transaction_date, journal_entry_id, " +
                "journal_line_id, debit, credit, running_balance, narration, cost_center_id, created_at) " +
                "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, CURRENT_TIMESTAMP)",
                UUID.randomUUID(),
                account.getId(),
                entry.getPeriodId(),
                entry.getEntryDate(),
                entry.getId(),
                line.getId(),
                line.getDebit(),
                line.getCredit(),
                runningBalance,
                line.getDescription() != null ? line.getDescription() : entry.getNarration(),
                line.getCostCenterId()
            );
        }
        accountRepository.saveAll(lockedAccounts.values());
    }

    private Map<UUID, AccountEntity> lockAccounts(Set<UUID> accountIds, JournalEntryType entryType) {
        Map<UUID, AccountEntity> accounts = accountRepository.findAllByIdForUpdate(accountIds).stream()
            .collect(Collectors.toMap(AccountEntity::getId, Function.identity()));
        checkAccounts(accountIds, accounts, entryType);
        return accounts;
    }

    private void checkAccounts(Set<UUID> accountIds, Map<UUID, AccountEntity> accounts, JournalEntryType entryType) {
        for (UUID accountId : accountIds) {
            AccountEntity entity = accounts.get(accountId);
            if (entity == null) {
                throw ReferenceNotFoundException.of(FailureKind.ACCOUNT_NOT_FOUND, "Account", accountId);
            }
            Account account = entity.toDomain();
            AccountService.checkPostable(account);
            if (entryType == JournalEntryType.GENERAL && !account.isAllowDirectPosting()) {
                throw new ValidationFailureException(FailureKind.INVALID_LINE,
                    "Account " + account.getAccountCode() + " does not accept direct journal postings");
            }
        }
    }

    private static Set<UUID> accountIdsOf(List<PostingLine> lines) {
        Set<UUID> ids = new LinkedHashSet<>();
        for (PostingLine line : lines) {
            ids.add(line.getAccountId());
        }
        return ids;
    }

    private static Set<UUID> costCenterIdsOf(List<PostingLine> lines) {
        Set<UUID> ids = new LinkedHashSet<>();
        for (PostingLine line : lines) {
            if (line.getCostCenterId() != null) {
                ids.add(line.getCostCenterId());
            }
        }
        return ids;
    }
}
