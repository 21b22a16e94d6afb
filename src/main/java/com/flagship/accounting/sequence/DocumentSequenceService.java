package com.flagship.accounting.sequence;

import com.flagship.accounting.config.AccountingProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/**
 * Issues human-readable document numbers of the form {@code PREFIX-YYYYMMDD-NNNN}.
 *
 * The counter lives in one row per (scope, day). The increment is a single upsert, so
 * concurrent callers queue on that row's lock and each receives a distinct value.
 * The row lock is held until the caller's transaction ends; a rolled-back caller
 * releases its number, which the next caller then reuses.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentSequenceService {

    private static final DateTimeFormatter DAY = DateTimeFormatter.BASIC_ISO_DATE;

    private static final String NEXT_VALUE_SQL = """
        INSERT INTO document_sequences (scope, seq_date, last_value, updated_at)
        VALUES (?, ?, 1, CURRENT_TIMESTAMP)
        ON CONFLICT (scope, seq_date)
        DO UPDATE SET last_value = document_sequences.last_value + 1, updated_at = CURRENT_TIMESTAMP
        RETURNING last_value
        """;

    private final JdbcTemplate jdbcTemplate;
    private final AccountingProperties properties;

    /**
     * Next number for {@code prefix} on {@code date}.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public String next(String prefix, LocalDate date) {
        Long value = jdbcTemplate.queryForObject(NEXT_VALUE_SQL, Long.class, prefix, date);
        if (value == null) {
            throw new IllegalStateException("Sequence upsert returned no value for " + prefix);
        }
        String number = format(prefix, date, value, properties.getSequence().getCounterWidth());
        log.debug("Issued document number {}", number);
        return number;
    }

    static String format(String prefix, LocalDate date, long value, int width) {
        String counter = String.valueOf(value);
        if (counter.length() < width) {
            counter = "0".repeat(width - counter.length()) + counter;
        }
        return prefix + "-" + DAY.format(date) + "-" + counter;
    }
}
