package com.flagship.accounting.voucher;

import com.flagship.accounting.ledger.dto.ReversalRequest;
import com.flagship.accounting.voucher.dto.ReasonRequest;
import com.flagship.accounting.voucher.dto.VoucherRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Voucher lifecycle. The acting user comes from X-User-Id and is checked against
 * the creator on approve and reject.
 */
@RestController
@RequestMapping("/api/vouchers")
@RequiredArgsConstructor
public class VoucherController {

    private static final String USER_HEADER = "X-User-Id";

    private final VoucherService voucherService;
    private final VoucherWorkflowService workflowService;
    private final VoucherPostingService postingService;

    @PostMapping
    public ResponseEntity<Voucher> create(@Valid @RequestBody VoucherRequest request,
                                          @RequestHeader(USER_HEADER) String user) {
        return ResponseEntity.status(HttpStatus.CREATED).body(voucherService.create(request.toCommand(), user));
    }

    @PutMapping("/{id}")
    public Voucher update(@PathVariable("id") UUID id, @Valid @RequestBody VoucherRequest request,
                          @RequestHeader(USER_HEADER) String user) {
        return voucherService.update(id, request.toCommand(), user);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable("id") UUID id, @RequestHeader(USER_HEADER) String user) {
        voucherService.delete(id, user);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/submit")
    public Voucher submit(@PathVariable("id") UUID id, @RequestHeader(USER_HEADER) String user) {
        return workflowService.submit(id, user);
    }

    @PostMapping("/{id}/approve")
    public Voucher approve(@PathVariable("id") UUID id,
                           @RequestParam(value = "autoPost", defaultValue = "false") boolean autoPost,
                           @RequestHeader(USER_HEADER) String user) {
        return workflowService.approve(id, user, autoPost);
    }

    @PostMapping("/{id}/reject")
    public Voucher reject(@PathVariable("id") UUID id, @Valid @RequestBody ReasonRequest request,
                          @RequestHeader(USER_HEADER) String user) {
        return workflowService.reject(id, user, request.getReason());
    }

    @PostMapping("/{id}/post")
    public Voucher post(@PathVariable("id") UUID id, @RequestHeader(USER_HEADER) String user) {
        return postingService.post(id, user);
    }

    @PostMapping("/{id}/cancel")
    public Voucher cancel(@PathVariable("id") UUID id, @Valid @RequestBody ReasonRequest request,
                          @RequestHeader(USER_HEADER) String user) {
        return workflowService.cancel(id, user, request.getReason());
    }

    @PostMapping("/{id}/reverse")
    public ResponseEntity<Voucher> reverse(@PathVariable("id") UUID id, @Valid @RequestBody ReversalRequest request,
                                           @RequestHeader(USER_HEADER) String user) {
        Voucher reversal = postingService.reverse(id, request.getReversalDate(), request.getReason(), user);
        return ResponseEntity.status(HttpStatus.CREATED).body(reversal);
    }

    @GetMapping("/{id}")
    public Voucher get(@PathVariable("id") UUID id) {
        return voucherService.findById(id);
    }

    @GetMapping
    public List<Voucher> list(
            @RequestParam(value = "status", required = false) VoucherStatus status,
            @RequestParam(value = "type", required = false) VoucherType type,
            @RequestParam(value = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(value = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        return voucherService.list(status, type, from, to);
    }

    @GetMapping("/summary")
    public VoucherSummary summary(
            @RequestParam("from") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam("to") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        return voucherService.summary(from, to);
    }

    @GetMapping("/pending-approvals")
    public List<Voucher> pendingApprovals(@RequestParam(value = "level", required = false) ApprovalLevel level) {
        return voucherService.pendingApprovals(level);
    }
}
