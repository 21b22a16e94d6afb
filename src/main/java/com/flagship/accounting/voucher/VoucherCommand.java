package com.flagship.accounting.voucher;

import com.flagship.accounting.ledger.PostingLine;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Content of a voucher as entered: used for both create and update of a DRAFT.
 */
@Value
@Builder(toBuilder = true)
public class VoucherCommand {
    VoucherType voucherType;
    LocalDate voucherDate;
    String partyType;
    UUID partyId;
    String partyName;
    String referenceNumber;
    LocalDate referenceDate;
    String narration;
    String gstin;
    String placeOfSupply;
    boolean reverseCharge;
    PaymentMode paymentMode;
    UUID bankAccountId;
    String chequeNumber;
    LocalDate chequeDate;
    @Singular
    List<PostingLine> lines;
    @Singular
    List<Allocation> allocations;

    public BigDecimal getDebitTotal() {
        return lines.stream().map(PostingLine::getDebit).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public BigDecimal getCreditTotal() {
        return lines.stream().map(PostingLine::getCredit).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    @Value
    public static class Allocation {
        AllocationSourceType sourceType;
        UUID sourceId;
        String sourceNumber;
        BigDecimal documentAmount;
        BigDecimal allocatedAmount;
        BigDecimal tdsAmount;

        VoucherAllocation toAllocation() {
            return new VoucherAllocation(UUID.randomUUID(), sourceType, sourceId, sourceNumber,
                documentAmount, allocatedAmount, tdsAmount != null ? tdsAmount : BigDecimal.ZERO);
        }
    }
}
