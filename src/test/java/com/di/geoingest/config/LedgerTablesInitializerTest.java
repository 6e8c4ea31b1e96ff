package com.di.geoingest.config;

import com.di.geoingest.load.TableManager;
import com.di.geoingest.load.TableVisibilityWaiter;
import com.di.geoingest.load.metadata.LoadFailureRepository;
import com.di.geoingest.load.metadata.LoadJobRepository;
import com.di.geoingest.warehouse.InMemoryWarehouseClient;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LedgerTablesInitializer Tests")
class LedgerTablesInitializerTest {

    private InMemoryWarehouseClient warehouse;
    private LoadJobRepository jobs;
    private LoadFailureRepository failures;
    private LedgerTablesInitializer initializer;

    @BeforeEach
    void setUp() {
        warehouse = new InMemoryWarehouseClient();
        GeoIngestProperties properties = new GeoIngestProperties();
        jobs = new LoadJobRepository(warehouse, properties);
        failures = new LoadFailureRepository(warehouse, new ObjectMapper(), properties);
        TableManager tableManager = new TableManager(warehouse, new TableVisibilityWaiter(warehouse,
                Duration.ofMillis(1), 2.0, Duration.ofMillis(1), Duration.ofMillis(10), millis -> { }));
        initializer = new LedgerTablesInitializer(tableManager, jobs, failures);
    }

    @Test
    @DisplayName("Creates both ledger tables when missing")
    void testRun_Creates() {
        initializer.run(new DefaultApplicationArguments());

        assertEquals(LoadJobRepository.COLUMNS, warehouse.getColumns(jobs.table()));
        assertEquals(LoadFailureRepository.COLUMNS, warehouse.getColumns(failures.table()));
        assertEquals("One row per finished load job", warehouse.description(jobs.table()));
    }

    @Test
    @DisplayName("Startup goes on when a ledger table never becomes visible")
    void testRun_Timeout() {
        warehouse.newTableInvisibleChecks = Integer.MAX_VALUE;

        assertDoesNotThrow(() -> initializer.run(new DefaultApplicationArguments()));
    }
}
