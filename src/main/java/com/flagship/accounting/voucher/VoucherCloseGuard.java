package com.flagship.accounting.voucher;

import com.flagship.accounting.period.FinancialPeriod;
import com.flagship.accounting.period.PeriodCloseGuard;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.EnumSet;

@Component
@RequiredArgsConstructor
class VoucherCloseGuard implements PeriodCloseGuard {

    private static final EnumSet<VoucherStatus> UNFINISHED = EnumSet.of(
        VoucherStatus.DRAFT, VoucherStatus.PENDING_APPROVAL, VoucherStatus.APPROVED);

    private final VoucherRepository voucherRepository;

    @Override
    public long countBlockingDocuments(FinancialPeriod period) {
        return voucherRepository.countByDateRangeAndStatusIn(period.getStartDate(), period.getEndDate(), UNFINISHED);
    }

    @Override
    public String documentLabel() {
        return "unposted vouchers";
    }
}
