package com.flagship.accounting.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.accounting.ledger.JournalEntryType;
import com.flagship.accounting.ledger.PostingRequest;
import com.flagship.accounting.ledger.SourceRef;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Value
public class JournalEntryRequest {

    @NotNull(message = "Entry date is required")
    @JsonProperty("entry_date")
    LocalDate entryDate;

    @JsonProperty("entry_type")
    JournalEntryType entryType;

    @JsonProperty("narration")
    String narration;

    @JsonProperty("source_type")
    String sourceType;

    @JsonProperty("source_id")
    UUID sourceId;

    @JsonProperty("source_number")
    String sourceNumber;

    @NotEmpty(message = "At least one line is required")
    @Valid
    @JsonProperty("lines")
    List<PostingLineRequest> lines;

    public PostingRequest toPostingRequest(String user) {
        PostingRequest.PostingRequestBuilder builder = PostingRequest.builder()
            .entryDate(entryDate)
            .narration(narration)
            .createdBy(user);
        if (entryType != null) {
            builder.entryType(entryType);
        }
        if (sourceType != null) {
            builder.source(SourceRef.of(sourceType, sourceId, sourceNumber));
        }
        lines.forEach(line -> builder.line(line.toPostingLine()));
        return builder.build();
    }
}
