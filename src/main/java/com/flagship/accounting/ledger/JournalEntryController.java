package com.flagship.accounting.ledger;

import com.flagship.accounting.ledger.dto.JournalEntryRequest;
import com.flagship.accounting.ledger.dto.ReversalRequest;
import com.flagship.accounting.observability.AccountingMetrics;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Journal engine endpoints.
 *
 * POST /api/journal-entries is idempotent: a repeated Idempotency-Key returns the
 * entry created by the first call with 200 instead of 201.
 */
@RestController
@RequestMapping("/api/journal-entries")
@RequiredArgsConstructor
@Slf4j
public class JournalEntryController {

    static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";
    static final String USER_HEADER = "X-User-Id";

    private final JournalService journalService;
    private final PostingIdempotencyService idempotencyService;
    private final AccountingMetrics metrics;

    @PostMapping
    public ResponseEntity<JournalEntry> postEntry(@Valid @RequestBody JournalEntryRequest request,
                                                  @RequestHeader(IDEMPOTENCY_KEY_HEADER) String idempotencyKey,
                                                  @RequestHeader(USER_HEADER) String user) {
        Optional<UUID> existingId = idempotencyService.findEntryId(idempotencyKey);
        if (existingId.isPresent()) {
            metrics.recordIdempotencyHit();
            log.info("Idempotency key {} already used, returning entry {}", idempotencyKey, existingId.get());
            return ResponseEntity.ok(journalService.findById(existingId.get()));
        }
        metrics.recordIdempotencyMiss();

        JournalEntry entry;
        try {
            entry = journalService.post(request.toPostingRequest(user), idempotencyKey);
        } catch (DataIntegrityViolationException e) {
            // a concurrent first call with the same key won the unique constraint
            JournalEntry winner = journalService.findByIdempotencyKey(idempotencyKey).orElseThrow(() -> e);
            log.info("Concurrent post with idempotency key {} resolved to entry {}", idempotencyKey, winner.getEntryNumber());
            return ResponseEntity.ok(winner);
        }
        idempotencyService.remember(idempotencyKey, entry.getId());
        return ResponseEntity.status(HttpStatus.CREATED).body(entry);
    }

    @PostMapping("/drafts")
    public ResponseEntity<JournalEntry> createDraft(@Valid @RequestBody JournalEntryRequest request,
                                                    @RequestHeader(USER_HEADER) String user) {
        return ResponseEntity.status(HttpStatus.CREATED).body(journalService.createDraft(request.toPostingRequest(user)));
    }

    @PostMapping("/{id}/post")
    public JournalEntry postDraft(@PathVariable("id") UUID id, @RequestHeader(USER_HEADER) String user) {
        return journalService.postDraft(id, user);
    }

    @PostMapping("/{id}/cancel")
    public JournalEntry cancelDraft(@PathVariable("id") UUID id, @RequestHeader(USER_HEADER) String user) {
        return journalService.cancelDraft(id, user);
    }

    @PostMapping("/{id}/reverse")
    public ResponseEntity<JournalEntry> reverse(@PathVariable("id") UUID id,
                                                @Valid @RequestBody ReversalRequest request,
                                                @RequestHeader(USER_HEADER) String user) {
        JournalEntry reversal = journalService.reverse(id, request.getReversalDate(), request.getReason(), user);
        return ResponseEntity.status(HttpStatus.CREATED).body(reversal);
    }

    @GetMapping("/{id}")
    public JournalEntry getEntry(@PathVariable("id") UUID id) {
        return journalService.findById(id);
    }

    @GetMapping
    public List<JournalEntry> listEntries(
            @RequestParam(value = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(value = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
            @RequestParam(value = "status", required = false) JournalEntryStatus status) {
        return journalService.listEntries(from, to, status);
    }
}
