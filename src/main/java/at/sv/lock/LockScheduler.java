package at.sv.lock;

import at.sv.lock.api.AuditSink;
import at.sv.lock.api.DeviceActionGateway;
import at.sv.lock.api.DeviceInventory;
import at.sv.lock.api.InMemoryDeviceInventory;
import at.sv.lock.api.JsonFileDeviceInventory;
import at.sv.lock.api.LoggingAuditSink;
import at.sv.lock.api.LoggingDeviceActionGateway;
import at.sv.lock.api.OwnerDirectory;
import at.sv.lock.schedule.ScheduleConfig;
import at.sv.lock.store.ScheduleConfigMapper;
import at.sv.lock.store.SchedulePersistence;
import at.sv.lock.store.SchedulePersistenceFactory;
import at.sv.lock.store.ScheduleStore;
import at.sv.lock.store.ScheduleStoreImpl;
import at.sv.lock.store.StoreBackend;
import at.sv.lock.time.RecurrenceEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;

@Command(name = "LockScheduler", version = "0.1.0", mixinStandardHelpOptions = true, sortOptions = false)
public final class LockScheduler implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(LockScheduler.class);

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Option(names = "--store", paramLabel = "<backend>",
            defaultValue = "${env:STORE:-memory}",
            description = "Where schedules are kept: ${COMPLETION-CANDIDATES}. Default: ${DEFAULT-VALUE}")
    StoreBackend storeBackend;
    @Option(names = "--store-file", paramLabel = "<file>",
            defaultValue = "${env:STORE_FILE}",
            description = "The JSON document used by the file store. Created on the first change if missing.")
    Path storeFile;
    @Option(names = "--seed-config", paramLabel = "<file>",
            defaultValue = "${env:SEED_CONFIG}",
            description = "Optional schedule configuration imported at startup.")
    Path seedConfig;
    @Option(names = "--replace-on-seed",
            defaultValue = "${env:REPLACE_ON_SEED:-false}",
            description = "Replace the stored schedules with the seed configuration instead of merging new ones." +
                          " Default: ${DEFAULT-VALUE}")
    boolean replaceOnSeed;
    @Option(names = "--timezone", paramLabel = "<zone>",
            defaultValue = "${env:TIMEZONE:-UTC}",
            description = "The time zone of a newly created store, used to evaluate schedule windows." +
                          " Default: ${DEFAULT-VALUE}")
    String timezone;
    @Option(names = "--inventory-file", paramLabel = "<file>",
            defaultValue = "${env:INVENTORY_FILE}",
            description = "JSON file listing the known owners and devices.")
    Path inventoryFile;
    @Option(names = "--inventory-cache-invalidation-interval", paramLabel = "<interval>",
            defaultValue = "${env:INVENTORY_CACHE_INVALIDATION_INTERVAL:-5}",
            description = "The interval in which the inventory file is read again. Default: ${DEFAULT-VALUE} minutes.")
    int inventoryCacheInvalidationIntervalInMinutes;
    @Option(names = "--tick-interval", paramLabel = "<seconds>",
            defaultValue = "${env:TICK_INTERVAL:-60}",
            description = "The delay between two evaluations of all schedules. Default: ${DEFAULT-VALUE} seconds.")
    int tickIntervalInSeconds;
    @Option(names = "--shutdown-timeout", paramLabel = "<seconds>",
            defaultValue = "${env:SHUTDOWN_TIMEOUT:-10}",
            description = "How long to wait for a running evaluation on shutdown. Default: ${DEFAULT-VALUE} seconds.")
    int shutdownTimeoutInSeconds;

    public static void main(String[] args) {
        int execute = createCommandLine().execute(args);
        if (execute != 0) {
            System.exit(execute);
        }
    }

    static CommandLine createCommandLine() {
        return new CommandLine(new LockScheduler()).setCaseInsensitiveEnumValuesAllowed(true);
    }

    @Override
    public void run() {
        MDC.put("context", "init");
        assertConfigurationParameters();
        ScheduleStore store = createStore();
        importSeedConfig(store);
        DeviceInventory inventory;
        OwnerDirectory ownerDirectory;
        if (inventoryFile != null) {
            JsonFileDeviceInventory fileInventory = new JsonFileDeviceInventory(inventoryFile,
                    inventoryCacheInvalidationIntervalInMinutes);
            inventory = fileInventory;
            ownerDirectory = fileInventory;
        } else {
            LOG.warn("No inventory file given. Only literal MAC targets can be resolved.");
            InMemoryDeviceInventory emptyInventory = InMemoryDeviceInventory.empty();
            inventory = emptyInventory;
            ownerDirectory = emptyInventory;
        }
        DeviceActionGateway gateway = new LoggingDeviceActionGateway();
        AuditSink auditSink = new LoggingAuditSink();
        TickScheduler tickScheduler = new TickSchedulerImpl(Executors.newSingleThreadScheduledExecutor(),
                shutdownTimeoutInSeconds);
        ScheduleExecutor executor = new ScheduleExecutor(store, new RecurrenceEvaluator(),
                new TargetResolver(inventory, ownerDirectory), gateway, auditSink, tickScheduler, ZonedDateTime::now,
                tickIntervalInSeconds);
        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            executor.stop();
            stopped.countDown();
        }, "shutdown"));
        LOG.info("Loaded {} schedule(s) in time zone {}.", store.list().size(), store.getMetadata().timezone());
        MDC.remove("context");
        executor.start();
        try {
            stopped.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private ScheduleStore createStore() {
        SchedulePersistence persistence = SchedulePersistenceFactory.create(storeBackend, storeFile,
                () -> ScheduleConfig.empty(timezone, ZonedDateTime.now().toInstant()));
        return new ScheduleStoreImpl(persistence, ZonedDateTime::now);
    }

    private void importSeedConfig(ScheduleStore store) {
        if (seedConfig == null) {
            return;
        }
        ScheduleConfig config = new ScheduleConfigMapper().read(seedConfig);
        store.syncFromConfig(config, replaceOnSeed);
        LOG.info("Imported seed config '{}'.", seedConfig.toAbsolutePath());
    }

    private void assertConfigurationParameters() {
        if (tickIntervalInSeconds <= 0) {
            fail("--tick-interval must be > 0");
        }
        if (inventoryCacheInvalidationIntervalInMinutes <= 0) {
            fail("--inventory-cache-invalidation-interval must be > 0");
        }
        if (shutdownTimeoutInSeconds < 0) {
            fail("--shutdown-timeout must be >= 0");
        }
        if (storeBackend == StoreBackend.FILE && storeFile == null) {
            fail("--store file requires --store-file");
        }
        try {
            ZoneId.of(timezone);
        } catch (DateTimeException e) {
            fail("--timezone '" + timezone + "' is not a valid time zone");
        }
        assertReadable(seedConfig, "--seed-config");
        assertReadable(inventoryFile, "--inventory-file");
    }

    private void assertReadable(Path file, String option) {
        if (file != null && !Files.isReadable(file)) {
            fail(option + " '" + file.toAbsolutePath() + "' does not exist or is not readable");
        }
    }

    private void fail(String msg) {
        if (spec != null) {
            throw new CommandLine.ParameterException(spec.commandLine(), msg);
        }
        throw new IllegalArgumentException(msg);
    }
}
