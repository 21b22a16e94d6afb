package com.flagship.accounting.event;

import com.flagship.accounting.voucher.Voucher;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
public class VoucherPostedEvent implements AccountingEvent {
    UUID eventId;
    UUID voucherId;
    String voucherNumber;
    String voucherType;
    LocalDate voucherDate;
    UUID partyId;
    BigDecimal totalAmount;
    UUID journalEntryId;
    String postedBy;
    Instant occurredAt;

    public static final String EVENT_TYPE = "VoucherPosted";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public UUID getAggregateId() {
        return voucherId;
    }

    public static VoucherPostedEvent from(Voucher voucher) {
        return new VoucherPostedEvent(
            UUID.randomUUID(),
            voucher.getId(),
            voucher.getVoucherNumber(),
            voucher.getVoucherType().name(),
            voucher.getVoucherDate(),
            voucher.getPartyId(),
            voucher.getTotalAmount(),
            voucher.getJournalEntryId(),
            voucher.getPostedBy(),
            Instant.now()
        );
    }
}
