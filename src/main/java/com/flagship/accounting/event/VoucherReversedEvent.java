package com.flagship.accounting.event;

import com.flagship.accounting.voucher.Voucher;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
public class VoucherReversedEvent implements AccountingEvent {
    UUID eventId;
    UUID voucherId;
    String voucherNumber;
    UUID reversalVoucherId;
    String reversalVoucherNumber;
    LocalDate reversalDate;
    String reason;
    String reversedBy;
    Instant occurredAt;

    public static final String EVENT_TYPE = "VoucherReversed";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public UUID getAggregateId() {
        return voucherId;
    }

    public static VoucherReversedEvent from(Voucher original, Voucher reversal, String reason) {
        return new VoucherReversedEvent(
            UUID.randomUUID(),
            original.getId(),
            original.getVoucherNumber(),
            reversal.getId(),
            reversal.getVoucherNumber(),
            reversal.getVoucherDate(),
            reason,
            reversal.getCreatedBy(),
            Instant.now()
        );
    }
}
