package com.flagship.accounting.ledger;

import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;

/**
 * Read-only financial statements derived from the general ledger.
 */
@RestController
@RequestMapping("/api/reports")
@RequiredArgsConstructor
public class ReportController {

    private final GeneralLedgerService generalLedgerService;

    @GetMapping("/trial-balance")
    public TrialBalance trialBalance(
            @RequestParam("asOf") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOf) {
        return generalLedgerService.trialBalance(asOf);
    }

    @GetMapping("/balance-sheet")
    public BalanceSheet balanceSheet(
            @RequestParam("asOf") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOf) {
        return generalLedgerService.balanceSheet(asOf);
    }

    @GetMapping("/profit-and-loss")
    public ProfitAndLoss profitAndLoss(
            @RequestParam("from") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam("to") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        return generalLedgerService.profitAndLoss(from, to);
    }
}
