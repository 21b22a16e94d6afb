package com.flagship.accounting.voucher.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.accounting.ledger.dto.PostingLineRequest;
import com.flagship.accounting.voucher.AllocationSourceType;
import com.flagship.accounting.voucher.PaymentMode;
import com.flagship.accounting.voucher.VoucherCommand;
import com.flagship.accounting.voucher.VoucherType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Value
public class VoucherRequest {

    @NotNull(message = "Voucher type is required")
    @JsonProperty("voucher_type")
    VoucherType voucherType;

    @NotNull(message = "Voucher date is required")
    @JsonProperty("voucher_date")
    LocalDate voucherDate;

    @JsonProperty("party_type")
    String partyType;

    @JsonProperty("party_id")
    UUID partyId;

    @JsonProperty("party_name")
    String partyName;

    @JsonProperty("reference_number")
    String referenceNumber;

    @JsonProperty("reference_date")
    LocalDate referenceDate;

    @JsonProperty("narration")
    String narration;

    @JsonProperty("gstin")
    String gstin;

    @JsonProperty("place_of_supply")
    String placeOfSupply;

    @JsonProperty("is_reverse_charge")
    boolean reverseCharge;

    @JsonProperty("payment_mode")
    PaymentMode paymentMode;

    @JsonProperty("bank_account_id")
    UUID bankAccountId;

    @JsonProperty("cheque_number")
    String chequeNumber;

    @JsonProperty("cheque_date")
    LocalDate chequeDate;

    @NotEmpty(message = "At least one line is required")
    @Valid
    @JsonProperty("lines")
    List<PostingLineRequest> lines;

    @Valid
    @JsonProperty("allocations")
    List<AllocationRequest> allocations;

    public VoucherCommand toCommand() {
        VoucherCommand.VoucherCommandBuilder builder = VoucherCommand.builder()
            .voucherType(voucherType)
            .voucherDate(voucherDate)
            .partyType(partyType)
            .partyId(partyId)
            .partyName(partyName)
            .referenceNumber(referenceNumber)
            .referenceDate(referenceDate)
            .narration(narration)
            .gstin(gstin)
            .placeOfSupply(placeOfSupply)
            .reverseCharge(reverseCharge)
            .paymentMode(paymentMode)
            .bankAccountId(bankAccountId)
            .chequeNumber(chequeNumber)
            .chequeDate(chequeDate);
        lines.forEach(line -> builder.line(line.toPostingLine()));
        if (allocations != null) {
            allocations.forEach(allocation -> builder.allocation(allocation.toAllocation()));
        }
        return builder.build();
    }

    @Value
    public static class AllocationRequest {

        @NotNull(message = "Source type is required")
        @JsonProperty("source_type")
        AllocationSourceType sourceType;

        @NotNull(message = "Source ID is required")
        @JsonProperty("source_id")
        UUID sourceId;

        @JsonProperty("source_number")
        String sourceNumber;

        @NotNull(message = "Document amount is required")
        @JsonProperty("document_amount")
        BigDecimal documentAmount;

        @NotNull(message = "Allocated amount is required")
        @JsonProperty("allocated_amount")
        BigDecimal allocatedAmount;

        @JsonProperty("tds_amount")
        BigDecimal tdsAmount;

        VoucherCommand.Allocation toAllocation() {
            return new VoucherCommand.Allocation(sourceType, sourceId, sourceNumber,
                documentAmount, allocatedAmount, tdsAmount);
        }
    }
}
