package com.flagship.accounting.ledger;

import com.flagship.accounting.ledger.dto.CreateAccountRequest;
import com.flagship.accounting.ledger.dto.UpdateAccountRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Chart of accounts, plus the per-account ledger view and balance recompute.
 */
@RestController
@RequestMapping("/api/accounts")
@RequiredArgsConstructor
public class AccountController {

    private final AccountService accountService;
    private final GeneralLedgerService generalLedgerService;

    @PostMapping
    public ResponseEntity<Account> createAccount(@Valid @RequestBody CreateAccountRequest request) {
        Account account = accountService.createAccount(
            request.getAccountCode(),
            request.getName(),
            request.getAccountType(),
            request.getSubType(),
            request.getParentId(),
            request.isGroup(),
            request.getOpeningBalance(),
            request.getAllowDirectPosting() == null || request.getAllowDirectPosting(),
            request.getDescription()
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(account);
    }

    @GetMapping
    public List<Account> listAccounts(@RequestParam(value = "type", required = false) AccountType type,
                                      @RequestParam(value = "activeOnly", defaultValue = "false") boolean activeOnly) {
        return accountService.listAccounts(type, activeOnly);
    }

    @GetMapping("/tree")
    public List<AccountService.AccountNode> accountTree() {
        return accountService.accountTree();
    }

    @GetMapping("/{id}")
    public Account getAccount(@PathVariable("id") UUID id) {
        return accountService.findById(id);
    }

    @PutMapping("/{id}")
    public Account updateAccount(@PathVariable("id") UUID id, @Valid @RequestBody UpdateAccountRequest request) {
        return accountService.updateAccount(id, request.getName(), request.getDescription(), request.isAllowDirectPosting());
    }

    @PostMapping("/{id}/deactivate")
    public Account deactivate(@PathVariable("id") UUID id) {
        return accountService.deactivate(id);
    }

    @PostMapping("/{id}/activate")
    public Account activate(@PathVariable("id") UUID id) {
        return accountService.activate(id);
    }

    @GetMapping("/{id}/ledger")
    public AccountLedger ledger(@PathVariable("id") UUID id,
                                @RequestParam("from") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
                                @RequestParam("to") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        return generalLedgerService.ledger(id, from, to);
    }

    @PostMapping("/{id}/recompute")
    public RecomputeResult recompute(@PathVariable("id") UUID id) {
        return generalLedgerService.recompute(id);
    }

    @GetMapping("/{id}/verify")
    public LedgerVerification verify(@PathVariable("id") UUID id) {
        return generalLedgerService.verifyAccount(id);
    }
}
