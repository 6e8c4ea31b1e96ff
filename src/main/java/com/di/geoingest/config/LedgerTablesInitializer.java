package com.di.geoingest.config;

import com.di.geoingest.load.TableManager;
import com.di.geoingest.load.metadata.LoadFailureRepository;
import com.di.geoingest.load.metadata.LoadJobRepository;
import com.di.geoingest.schema.TargetColumn;
import com.di.geoingest.warehouse.TableRef;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * At startup, creates the ledger dataset and the {@code load_jobs} / {@code load_failures} tables
 * when they are missing. A failure is logged and startup goes on: jobs still run, their ledger
 * writes fail and are logged in turn.
 */
@Component
@Order(1)
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(prefix = "geoingest.ledger", name = "bootstrap", havingValue = "true", matchIfMissing = true)
public class LedgerTablesInitializer implements ApplicationRunner {

    private final TableManager tableManager;
    private final LoadJobRepository jobRepository;
    private final LoadFailureRepository failureRepository;

    @Override
    public void run(ApplicationArguments args) {
        ensure(jobRepository.table(), LoadJobRepository.COLUMNS, "One row per finished load job");
        ensure(failureRepository.table(), LoadFailureRepository.COLUMNS, "Features rejected during load jobs");
    }

    private void ensure(TableRef table, List<TargetColumn> columns, String description) {
        try {
            if (tableManager.ensureTable(table, columns, description)) {
                log.info("[LEDGER-STARTUP] Created {}", table);
            }
        } catch (RuntimeException e) {
            log.error("[LEDGER-STARTUP] Could not ensure {}: {}", table, e.getMessage(), e);
        }
    }
}
