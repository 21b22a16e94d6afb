package com.flagship.accounting.voucher;

import com.flagship.accounting.event.VoucherPostedEvent;
import com.flagship.accounting.event.VoucherReversedEvent;
import com.flagship.accounting.exception.FailureKind;
import com.flagship.accounting.exception.StateConflictException;
import com.flagship.accounting.exception.ValidationFailureException;
import com.flagship.accounting.ledger.JournalEntry;
import com.flagship.accounting.ledger.JournalEntryType;
import com.flagship.accounting.ledger.JournalService;
import com.flagship.accounting.ledger.PostingRequest;
import com.flagship.accounting.ledger.SourceRef;
import com.flagship.accounting.observability.AccountingMetrics;
import com.flagship.accounting.observability.CorrelationContext;
import com.flagship.accounting.outbox.OutboxService;
import com.flagship.accounting.period.FinancialPeriod;
import com.flagship.accounting.period.FinancialPeriodService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Turns APPROVED vouchers into journal entries and reverses POSTED ones.
 *
 * A voucher and its journal entry commit together: if the journal engine rejects
 * the posting, the voucher stays APPROVED.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VoucherPostingService {

    static final String SOURCE_TYPE = SourceRef.VOUCHER;
    private static final String AGGREGATE_TYPE = "Voucher";

    private final VoucherService voucherService;
    private final VoucherRepository voucherRepository;
    private final JournalService journalService;
    private final FinancialPeriodService periodService;
    private final OutboxService outboxService;
    private final AccountingMetrics metrics;

    @Transactional
    public Voucher post(UUID voucherId, String user) {
        VoucherService.requireUser(user);
        MDC.put(CorrelationContext.VOUCHER_ID_MDC_KEY, voucherId.toString());
        try {
            VoucherEntity entity = voucherService.loadForUpdate(voucherId);
            return post(entity, entity.toDomain(), user);
        } finally {
            MDC.remove(CorrelationContext.VOUCHER_ID_MDC_KEY);
        }
    }

    /**
     * Posts an already locked voucher. Used by approve-with-auto-post inside its own transaction.
     */
    Voucher post(VoucherEntity entity, Voucher voucher, String user) {
        if (!voucher.getStatus().canTransitionTo(VoucherStatus.POSTED)) {
            metrics.recordVoucherTransition("post", "rejected");
            throw new StateConflictException(FailureKind.INVALID_TRANSITION,
                String.format("Voucher %s is %s, only APPROVED vouchers can be posted",
                    voucher.getVoucherNumber(), voucher.getStatus()));
        }

        PostingRequest request = PostingRequest.builder()
            .entryDate(voucher.getVoucherDate())
            .entryType(JournalEntryType.VOUCHER)
            .narration(voucher.getNarration() != null
                ? voucher.getNarration()
                : voucher.getVoucherType() + " voucher " + voucher.getVoucherNumber())
            .source(SourceRef.of(SOURCE_TYPE, voucher.getId(), voucher.getVoucherNumber()))
            .lines(voucher.toPostingLines())
            .createdBy(user)
            .entryNumber("JV-" + voucher.getVoucherNumber())
            .build();
        JournalEntry entry = journalService.post(request, null);

        Voucher posted = voucher.post(user, entry.getId());
        entity.updateFromDomain(posted);
        voucherRepository.save(entity);
        outboxService.saveEvent(AGGREGATE_TYPE, VoucherPostedEvent.from(posted));

        metrics.recordVoucherTransition("post", "success");
        log.info("Posted voucher {} as journal entry {} by {}",
            posted.getVoucherNumber(), entry.getEntryNumber(), user);
        return posted;
    }

    /**
     * Creates and posts the mirror voucher of a POSTED voucher. The original voucher stays POSTED
     * and is linked to its reversal; its journal entry is reversed through the journal engine.
     *
     * @return the reversal voucher, already POSTED
     */
    @Transactional
    public Voucher reverse(UUID voucherId, LocalDate reversalDate, String reason, String user) {
        VoucherService.requireUser(user);
        if (reversalDate == null) {
            throw new ValidationFailureException(FailureKind.MISSING_FIELD, "Reversal date is required");
        }
        if (reason == null || reason.isBlank()) {
            throw new ValidationFailureException(FailureKind.MISSING_FIELD, "Reversal reason is required");
        }
        MDC.put(CorrelationContext.VOUCHER_ID_MDC_KEY, voucherId.toString());
        try {
            VoucherEntity entity = voucherService.loadForUpdate(voucherId);
            Voucher original = entity.toDomain();
            if (original.getStatus() != VoucherStatus.POSTED) {
                throw new StateConflictException(FailureKind.INVALID_TRANSITION,
                    String.format("Voucher %s is %s, only POSTED vouchers can be reversed",
                        original.getVoucherNumber(), original.getStatus()));
            }
            if (original.isReversed()) {
                throw new StateConflictException(FailureKind.ALREADY_REVERSED,
                    "Voucher " + original.getVoucherNumber() + " is already reversed");
            }
            FinancialPeriod period = periodService.requireOpenPeriod(reversalDate);

            Voucher reversal = Voucher.reversalOf(original, reversalDate, period.getId(), reason, user);
            JournalEntry reversalEntry = journalService.reverseOwned(original.getJournalEntryId(), SOURCE_TYPE,
                reversalDate, reason, user);
            Voucher postedReversal = reversal.post(user, reversalEntry.getId());
            voucherRepository.saveAndFlush(VoucherEntity.fromDomain(postedReversal));

            Voucher marked = original.markReversed(postedReversal.getId());
            entity.updateFromDomain(marked);
            voucherRepository.save(entity);

            outboxService.saveEvent(AGGREGATE_TYPE, VoucherReversedEvent.from(marked, postedReversal, reason));
            outboxService.saveEvent(AGGREGATE_TYPE, VoucherPostedEvent.from(postedReversal));
            metrics.recordVoucherTransition("reverse", "success");
            log.info("Reversed voucher {} with {} on {} by {}",
                original.getVoucherNumber(), postedReversal.getVoucherNumber(), reversalDate, user);
            return postedReversal;
        } finally {
            MDC.remove(CorrelationContext.VOUCHER_ID_MDC_KEY);
        }
    }
}
