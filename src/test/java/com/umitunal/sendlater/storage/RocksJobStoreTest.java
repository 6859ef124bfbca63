package com.umitunal.sendlater.storage;

import com.umitunal.sendlater.config.StorageConfig;
import com.umitunal.sendlater.core.DuplicateJobException;
import com.umitunal.sendlater.core.InvalidTransitionException;
import com.umitunal.sendlater.core.JobNotFoundException;
import com.umitunal.sendlater.core.ScheduledJob;
import com.umitunal.sendlater.core.StoreMetrics;
import com.umitunal.sendlater.model.DeliveryPayload;
import com.umitunal.sendlater.model.JobRecord;
import com.umitunal.sendlater.serialization.JsonCodec;
import com.umitunal.sendlater.serialization.KryoCodec;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.umitunal.sendlater.core.ScheduledJob.State.*;
import static org.assertj.core.api.Assertions.*;

class RocksJobStoreTest {

    private static final long NOW = 1_700_000_000_000L;
    private static final Clock CLOCK = Clock.fixed(Instant.ofEpochMilli(NOW), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    private RocksJobStore<DeliveryPayload> store;
    private StorageConfig config;

    @BeforeEach
    void setUp() throws Exception {
        config = StorageConfig.newBuilder(tempDir.resolve("jobs"))
                .withDurableWrites(false)
                .build();
        store = new RocksJobStore<>(config, new JsonCodec<>(DeliveryPayload.class), CLOCK);
    }

    @AfterEach
    void tearDown() {
        if (store != null) {
            store.close();
        }
    }

    @Test
    @DisplayName("Should store and read back a job")
    void testPutAndGet() throws Exception {
        // Given
        JobRecord<DeliveryPayload> job = job("job-1", "42", NOW + 10_000);

        // When
        store.put(job);

        // Then
        ScheduledJob<DeliveryPayload> stored = store.get("job-1");
        assertThat(stored.getOwnerId()).isEqualTo("42");
        assertThat(stored.getPayload()).isEqualTo(new DeliveryPayload("100", "message job-1"));
        assertThat(stored.getState()).isEqualTo(SCHEDULED);
        assertThat(store.find("missing")).isEmpty();
        assertThatThrownBy(() -> store.get("missing")).isInstanceOf(JobNotFoundException.class);
    }

    @Test
    @DisplayName("Should reject duplicate ids, including removed ones")
    void testDuplicateAndRetiredIds() throws Exception {
        // Given
        store.put(job("job-1", "42", NOW + 10_000));

        // Then
        assertThatThrownBy(() -> store.put(job("job-1", "42", NOW + 20_000)))
                .isInstanceOf(DuplicateJobException.class);

        // When
        store.remove("job-1");
        store.remove("job-1");

        // Then
        assertThat(store.find("job-1")).isEmpty();
        assertThat(store.listByOwner("42")).isEmpty();
        assertThatThrownBy(() -> store.put(job("job-1", "42", NOW + 20_000)))
                .isInstanceOf(DuplicateJobException.class);
    }

    @Test
    @DisplayName("Should follow the transition table")
    void testTransitions() throws Exception {
        // Given
        store.put(job("job-1", "42", NOW + 10_000));

        // When
        store.updateState("job-1", RUNNING, null);
        ScheduledJob<DeliveryPayload> failed = store.updateState("job-1", FAILED, "DELIVERY_REJECTED: nope");

        // Then
        assertThat(failed.getState()).isEqualTo(FAILED);
        assertThat(failed.getFailureReason()).isEqualTo("DELIVERY_REJECTED: nope");
        assertThat(failed.getLastModified()).isEqualTo(NOW);
        assertThat(((JobRecord<DeliveryPayload>) store.get("job-1")).getVersion()).isEqualTo(2);

        // Same terminal state again is a no-op
        ScheduledJob<DeliveryPayload> again = store.updateState("job-1", FAILED, "other");
        assertThat(again.getFailureReason()).isEqualTo("DELIVERY_REJECTED: nope");

        assertThatThrownBy(() -> store.updateState("job-1", SUCCEEDED, null))
                .isInstanceOfSatisfying(InvalidTransitionException.class, e -> {
                    assertThat(e.getFrom()).isEqualTo(FAILED);
                    assertThat(e.getTo()).isEqualTo(SUCCEEDED);
                });
        assertThatThrownBy(() -> store.updateState("missing", RUNNING, null))
                .isInstanceOf(JobNotFoundException.class);
    }

    @Test
    @DisplayName("Should not allow a scheduled job to skip RUNNING")
    void testNoShortcutToSucceeded() throws Exception {
        // Given
        store.put(job("job-1", "42", NOW + 10_000));

        // When / Then
        assertThatThrownBy(() -> store.updateState("job-1", SUCCEEDED, null))
                .isInstanceOf(InvalidTransitionException.class);
        assertThat(store.get("job-1").getState()).isEqualTo(SCHEDULED);
    }

    @Test
    @DisplayName("Should let exactly one of two racing transitions win")
    void testConcurrentTransitions() throws Exception {
        for (int round = 0; round < 20; round++) {
            // Given
            String jobId = "race-" + round;
            store.put(job(jobId, "42", NOW + 10_000));
            CountDownLatch go = new CountDownLatch(1);
            ExecutorService pool = Executors.newFixedThreadPool(2);

            // When
            Future<Boolean> run = pool.submit(() -> attempt(go, jobId, RUNNING));
            Future<Boolean> cancel = pool.submit(() -> attempt(go, jobId, CANCELLED));
            go.countDown();
            boolean runWon = run.get(10, TimeUnit.SECONDS);
            boolean cancelWon = cancel.get(10, TimeUnit.SECONDS);
            pool.shutdown();

            // Then
            assertThat(runWon ^ cancelWon).isTrue();
            assertThat(store.get(jobId).getState()).isEqualTo(runWon ? RUNNING : CANCELLED);
        }
    }

    @Test
    @DisplayName("Should list only the owner's jobs")
    void testListByOwner() throws Exception {
        // Given
        store.put(job("a", "1", NOW + 1000));
        store.put(job("b", "12", NOW + 1000));
        store.put(job("c", "1", NOW + 500));

        // When
        List<ScheduledJob<DeliveryPayload>> jobs = store.listByOwner("1");

        // Then
        assertThat(jobs).extracting(ScheduledJob::getId).containsExactly("a", "c");
        assertThat(store.listByOwner("12")).extracting(ScheduledJob::getId).containsExactly("b");
        assertThat(store.listByOwner("nobody")).isEmpty();
    }

    @Test
    @DisplayName("Should recover pending jobs in trigger order after reopening")
    void testRecoveryAfterReopen() throws Exception {
        // Given
        store.put(job("late", "1", NOW + 5000));
        store.put(job("early-b", "1", NOW + 1000));
        store.put(job("early-a", "1", NOW + 1000));
        store.put(job("done", "1", NOW + 100));
        store.updateState("done", CANCELLED, null);
        store.put(job("crashed-fresh", "1", NOW - 1000));
        store.updateState("crashed-fresh", RUNNING, null);
        store.put(job("crashed-stale", "1", NOW - 120_000));
        store.updateState("crashed-stale", RUNNING, null);
        store.close();

        // When
        store = new RocksJobStore<>(config, new JsonCodec<>(DeliveryPayload.class), CLOCK);
        List<ScheduledJob<DeliveryPayload>> pending = store.loadAllPending(NOW);

        // Then
        assertThat(pending).extracting(ScheduledJob::getId)
                .containsExactly("crashed-fresh", "early-a", "early-b", "late");
        assertThat(store.get("crashed-fresh").getState()).isEqualTo(SCHEDULED);
        assertThat(store.get("crashed-stale").getState()).isEqualTo(MISSED);
        assertThat(store.get("done").getState()).isEqualTo(CANCELLED);
    }

    @Test
    @DisplayName("Should purge terminal jobs older than the cutoff")
    void testPurgeTerminal() throws Exception {
        // Given
        store.put(job("finished", "1", NOW + 1000));
        store.updateState("finished", CANCELLED, null);
        store.put(job("waiting", "1", NOW + 1000));

        // When
        long none = store.purgeTerminalBefore(NOW);
        long purged = store.purgeTerminalBefore(NOW + 1);

        // Then
        assertThat(none).isZero();
        assertThat(purged).isEqualTo(1);
        assertThat(store.find("finished")).isEmpty();
        assertThat(store.find("waiting")).isPresent();
    }

    @Test
    @DisplayName("Should count jobs per state")
    void testMetrics() throws Exception {
        // Given
        store.put(job("a", "1", NOW + 1000));
        store.put(job("b", "1", NOW + 1000));
        store.put(job("c", "1", NOW + 1000));
        store.updateState("c", MISSED, null);

        // When
        StoreMetrics metrics = store.getMetrics();

        // Then
        assertThat(metrics.getTotalJobs()).isEqualTo(3);
        assertThat(metrics.getScheduledJobs()).isEqualTo(2);
        assertThat(metrics.getMissedJobs()).isEqualTo(1);
        assertThat(metrics.getRunningJobs()).isZero();
    }

    @Test
    @DisplayName("Should work with the Kryo payload codec")
    void testKryoCodec() throws Exception {
        // Given
        store.close();
        store = new RocksJobStore<>(config.withDataDirectory(tempDir.resolve("kryo")),
                new KryoCodec<>(DeliveryPayload.class), CLOCK);

        // When
        store.put(job("k", "7", NOW + 1000));

        // Then
        assertThat(store.get("k").getPayload()).isEqualTo(new DeliveryPayload("100", "message k"));
    }

    private boolean attempt(CountDownLatch go, String jobId, ScheduledJob.State target) throws Exception {
        go.await();
        try {
            store.updateState(jobId, target, null);
            return true;
        } catch (InvalidTransitionException e) {
            return false;
        }
    }

    private static JobRecord<DeliveryPayload> job(String id, String owner, long triggerTime) {
        return new JobRecord<>(id, owner, new DeliveryPayload("100", "message " + id), triggerTime, 60_000L, NOW);
    }
}
