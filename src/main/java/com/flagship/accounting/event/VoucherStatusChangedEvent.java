package com.flagship.accounting.event;

import com.flagship.accounting.voucher.Voucher;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Published on every workflow move of a voucher short of posting: submit, approve, reject, cancel.
 */
@Value
public class VoucherStatusChangedEvent implements AccountingEvent {
    UUID eventId;
    UUID voucherId;
    String voucherNumber;
    String voucherType;
    String fromStatus;
    String toStatus;
    BigDecimal totalAmount;
    String approvalLevel;
    String actor;
    String reason;
    Instant occurredAt;

    public static final String EVENT_TYPE = "VoucherStatusChanged";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public UUID getAggregateId() {
        return voucherId;
    }

    public static VoucherStatusChangedEvent of(Voucher before, Voucher after, String actor, String reason) {
        return new VoucherStatusChangedEvent(
            UUID.randomUUID(),
            after.getId(),
            after.getVoucherNumber(),
            after.getVoucherType().name(),
            before.getStatus().name(),
            after.getStatus().name(),
            after.getTotalAmount(),
            after.getApprovalLevel() != null ? after.getApprovalLevel().name() : null,
            actor,
            reason,
            Instant.now()
        );
    }
}
