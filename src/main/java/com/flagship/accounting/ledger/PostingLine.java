package com.flagship.accounting.ledger;

import com.flagship.accounting.exception.FailureKind;
import com.flagship.accounting.exception.ValidationFailureException;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.UUID;

/**
 * One side of a posting: exactly one of {@code debit} or {@code credit} is positive, the other is zero.
 */
@Value
public class PostingLine {

    /** Decimal places stored for amounts. */
    public static final int AMOUNT_SCALE = 4;

    UUID accountId;
    BigDecimal debit;
    BigDecimal credit;
    String description;
    UUID costCenterId;

    private PostingLine(UUID accountId, BigDecimal debit, BigDecimal credit, String description, UUID costCenterId) {
        if (accountId == null) {
            throw new ValidationFailureException(FailureKind.MISSING_FIELD, "Line account is required");
        }
        BigDecimal d = Objects.requireNonNullElse(debit, BigDecimal.ZERO);
        BigDecimal c = Objects.requireNonNullElse(credit, BigDecimal.ZERO);
        if (d.signum() < 0 || c.signum() < 0) {
            throw new ValidationFailureException(FailureKind.INVALID_LINE,
                "Line amounts cannot be negative: account " + accountId);
        }
        if (d.signum() == 0 && c.signum() == 0) {
            throw new ValidationFailureException(FailureKind.ZERO_AMOUNT,
                "Line for account " + accountId + " has zero amount");
        }
        if (d.signum() > 0 && c.signum() > 0) {
            throw new ValidationFailureException(FailureKind.INVALID_LINE,
                "Line for account " + accountId + " has both debit and credit");
        }
        if (d.stripTrailingZeros().scale() > AMOUNT_SCALE || c.stripTrailingZeros().scale() > AMOUNT_SCALE) {
            throw new ValidationFailureException(FailureKind.INVALID_LINE,
                String.format("Line for account %s has more than %d decimal places", accountId, AMOUNT_SCALE));
        }
        this.accountId = accountId;
        this.debit = d;
        this.credit = c;
        this.description = description;
        this.costCenterId = costCenterId;
    }

    public static PostingLine of(UUID accountId, BigDecimal debit, BigDecimal credit,
                                 String description, UUID costCenterId) {
        return new PostingLine(accountId, debit, credit, description, costCenterId);
    }

    public static PostingLine debit(UUID accountId, BigDecimal amount, String description) {
        return new PostingLine(accountId, amount, BigDecimal.ZERO, description, null);
    }

    public static PostingLine credit(UUID accountId, BigDecimal amount, String description) {
        return new PostingLine(accountId, BigDecimal.ZERO, amount, description, null);
    }

    public PostingLine withCostCenter(UUID costCenterId) {
        return new PostingLine(accountId, debit, credit, description, costCenterId);
    }

    /**
     * The same line with debit and credit exchanged.
     */
    public PostingLine swapped(String newDescription) {
        return new PostingLine(accountId, credit, debit, newDescription, costCenterId);
    }

    public EntryType getSide() {
        return debit.signum() > 0 ? EntryType.DEBIT : EntryType.CREDIT;
    }

    public BigDecimal getAmount() {
        return debit.signum() > 0 ? debit : credit;
    }
}
