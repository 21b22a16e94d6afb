package com.flagship.accounting.depreciation;

import lombok.Value;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Outcome of a batch: entries written, plus assets skipped or failed with the reason.
 */
@Value
public class DepreciationRunResult {
    LocalDate periodDate;
    List<DepreciationEntry> entries;
    Map<UUID, String> skipped;
    Map<UUID, String> failed;

    public long getPostedCount() {
        return entries.stream().filter(DepreciationEntry::isPosted).count();
    }
}
