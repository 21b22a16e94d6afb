package com.flagship.accounting.ledger;

import com.flagship.accounting.exception.FailureKind;
import com.flagship.accounting.exception.ValidationFailureException;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Input to the journal engine.
 *
 * Invariant checked by {@link #validate()}: lines non-empty and sum of debits equals
 * sum of credits, both greater than zero.
 */
@Value
@Builder(toBuilder = true)
public class PostingRequest {
    LocalDate entryDate;
    @Builder.Default
    JournalEntryType entryType = JournalEntryType.GENERAL;
    String narration;
    SourceRef source;
    @Singular
    List<PostingLine> lines;
    String createdBy;
    /** Optional fixed entry number; a sequence number is issued when null. */
    String entryNumber;

    public BigDecimal getDebitTotal() {
        return lines.stream()
            .map(PostingLine::getDebit)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public BigDecimal getCreditTotal() {
        return lines.stream()
            .map(PostingLine::getCredit)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public boolean isBalanced() {
        return getDebitTotal().compareTo(getCreditTotal()) == 0;
    }

    public void validate() {
        if (entryDate == null) {
            throw new ValidationFailureException(FailureKind.MISSING_FIELD, "Entry date is required");
        }
        if (createdBy == null || createdBy.isBlank()) {
            throw new ValidationFailureException(FailureKind.MISSING_FIELD, "Creating user is required");
        }
        if (lines == null || lines.isEmpty()) {
            throw new ValidationFailureException(FailureKind.MISSING_FIELD, "Journal entry requires at least one line");
        }
        if (!isBalanced()) {
            throw new ValidationFailureException(FailureKind.INVALID_BALANCE,
                String.format("Journal entry is not balanced: debits=%s, credits=%s",
                    getDebitTotal(), getCreditTotal()));
        }
        if (getDebitTotal().signum() <= 0) {
            throw new ValidationFailureException(FailureKind.ZERO_AMOUNT, "Journal entry total must be greater than zero");
        }
    }
}
