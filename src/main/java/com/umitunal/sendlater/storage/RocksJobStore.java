package com.umitunal.sendlater.storage;

import com.umitunal.sendlater.config.StorageConfig;
import com.umitunal.sendlater.core.DuplicateJobException;
import com.umitunal.sendlater.core.InvalidTransitionException;
import com.umitunal.sendlater.core.JobNotFoundException;
import com.umitunal.sendlater.core.JobStore;
import com.umitunal.sendlater.core.JobStoreException;
import com.umitunal.sendlater.core.ScheduledJob;
import com.umitunal.sendlater.core.StoreMetrics;
import com.umitunal.sendlater.model.JobRecord;
import com.umitunal.sendlater.serialization.PayloadCodec;
import org.rocksdb.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.file.Files;
import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * RocksDB-backed implementation of JobStore.
 *
 * Column families:
 * - default: jobId -> serialized JobRecord
 * - owner_index: [ownerId length][ownerId][jobId] -> empty
 * - trigger_index: [triggerTime][jobId] -> empty, non-terminal jobs only
 * - retired_ids: jobId -> removal time, so removed ids are never reused
 *
 * All multi-key changes run in an optimistic transaction; a commit conflict
 * re-reads the record and re-applies the transition rules.
 *
 * @param <T> the type of job payload
 */
public class RocksJobStore<T> implements JobStore<T> {
    private static final Logger logger = LoggerFactory.getLogger(RocksJobStore.class);

    private static final byte[] OWNER_INDEX = "owner_index".getBytes(UTF_8);
    private static final byte[] TRIGGER_INDEX = "trigger_index".getBytes(UTF_8);
    private static final byte[] RETIRED_IDS = "retired_ids".getBytes(UTF_8);
    private static final byte[] EMPTY = new byte[0];
    private static final int MAX_TXN_ATTEMPTS = 5;

    private final OptimisticTransactionDB transactionDB;
    private final List<ColumnFamilyHandle> handles;
    private final ColumnFamilyHandle jobsCf;
    private final ColumnFamilyHandle ownerIndexCf;
    private final ColumnFamilyHandle triggerIndexCf;
    private final ColumnFamilyHandle retiredCf;
    private final PayloadCodec<T> codec;
    private final Clock clock;
    private final WriteOptions writeOpts;
    private final OptimisticTransactionOptions txnOpts;
    private final ReadOptions readOpts;
    private final ReadOptions scanReadOpts;
    private final DBOptions dbOptions;
    private final ColumnFamilyOptions cfOptions;
    private final Cache blockCache;
    private final Filter bloomFilter;

    public RocksJobStore(StorageConfig config, PayloadCodec<T> codec) throws JobStoreException {
        this(config, codec, Clock.systemUTC());
    }

    public RocksJobStore(StorageConfig config, PayloadCodec<T> codec, Clock clock) throws JobStoreException {
        this.codec = codec;
        this.clock = clock;

        RocksDB.loadLibrary();

        this.blockCache = new LRUCache(config.getBlockCacheSizeMB() * 1024L * 1024L);
        this.bloomFilter = new BloomFilter(10, false); // 10 bits per key

        BlockBasedTableConfig tableConfig = new BlockBasedTableConfig()
                .setBlockCache(blockCache)
                .setFilterPolicy(bloomFilter)
                .setCacheIndexAndFilterBlocks(true)
                .setPinL0FilterAndIndexBlocksInCache(true);

        this.cfOptions = new ColumnFamilyOptions()
                .setCompressionType(CompressionType.LZ4_COMPRESSION)
                .setWriteBufferSize(config.getMemoryBufferSizeMB() * 1024L * 1024L)
                .setMaxWriteBufferNumber(config.getMaxMemoryBuffers())
                .setTableFormatConfig(tableConfig);

        this.dbOptions = new DBOptions()
                .setCreateIfMissing(true)
                .setCreateMissingColumnFamilies(true)
                .setMaxBackgroundJobs(config.getBackgroundThreads())
                .setAllowConcurrentMemtableWrite(true)
                .setEnableWriteThreadAdaptiveYield(true)
                .setMaxOpenFiles(-1);

        List<ColumnFamilyDescriptor> descriptors = List.of(
                new ColumnFamilyDescriptor(RocksDB.DEFAULT_COLUMN_FAMILY, cfOptions),
                new ColumnFamilyDescriptor(OWNER_INDEX, cfOptions),
                new ColumnFamilyDescriptor(TRIGGER_INDEX, cfOptions),
                new ColumnFamilyDescriptor(RETIRED_IDS, cfOptions));
        this.handles = new ArrayList<>();

        try {
            Files.createDirectories(config.getDataDirectory());
            // Open as OptimisticTransactionDB for atomic state transitions
            this.transactionDB = OptimisticTransactionDB.open(
                    dbOptions, config.getDataDirectory().toString(), descriptors, handles);
        } catch (IOException | RocksDBException e) {
            closeOptions();
            throw new JobStoreException("Failed to open job store at " + config.getDataDirectory(), e);
        }

        this.jobsCf = handles.get(0);
        this.ownerIndexCf = handles.get(1);
        this.triggerIndexCf = handles.get(2);
        this.retiredCf = handles.get(3);

        // WAL stays on; sync decides whether each write waits for fsync
        this.writeOpts = new WriteOptions()
                .setSync(config.isDurableWrites());

        this.txnOpts = new OptimisticTransactionOptions()
                .setSetSnapshot(true);

        this.readOpts = new ReadOptions();
        // ReadOptions for scans - don't pollute cache with full table scans
        this.scanReadOpts = new ReadOptions()
                .setFillCache(false);

        logger.info("job store opened dir={} durableWrites={}", config.getDataDirectory(), config.isDurableWrites());
    }

    @Override
    public void put(ScheduledJob<T> job) throws JobStoreException {
        JobRecord<T> record = JobRecord.copyOf(job);
        byte[] key = idKey(record.getId());
        byte[] value = record.serialize(codec);

        inTransaction("put", record.getId(), txn -> {
            if (txn.getForUpdate(readOpts, jobsCf, key, true) != null
                    || txn.getForUpdate(readOpts, retiredCf, key, true) != null) {
                throw new DuplicateJobException(record.getId());
            }
            txn.put(jobsCf, key, value);
            txn.put(ownerIndexCf, JobRecord.createOwnerKey(record.getOwnerId(), record.getId()), EMPTY);
            if (!record.getState().isTerminal()) {
                txn.put(triggerIndexCf, JobRecord.createTriggerKey(record.getTriggerTime(), record.getId()), EMPTY);
            }
            return null;
        });
        logger.debug("job stored jobId={} ownerId={} triggerTime={}",
                record.getId(), record.getOwnerId(), record.getTriggerTime());
    }

    @Override
    public Optional<ScheduledJob<T>> find(String jobId) throws JobStoreException {
        try {
            byte[] value = transactionDB.get(jobsCf, readOpts, idKey(jobId));
            if (value == null) {
                return Optional.empty();
            }
            return Optional.of(JobRecord.deserialize(value, codec));
        } catch (RocksDBException e) {
            throw new JobStoreException("Failed to read job " + jobId, e);
        }
    }

    @Override
    public ScheduledJob<T> updateState(String jobId, ScheduledJob.State newState, String reason)
            throws JobStoreException {
        byte[] key = idKey(jobId);

        return inTransaction("updateState", jobId, txn -> {
            byte[] value = txn.getForUpdate(readOpts, jobsCf, key, true);
            if (value == null) {
                throw new JobNotFoundException(jobId);
            }

            JobRecord<T> record = JobRecord.deserialize(value, codec);
            ScheduledJob.State current = record.getState();

            if (current == newState && current.isTerminal()) {
                return record;
            }
            if (!current.canTransitionTo(newState)) {
                throw new InvalidTransitionException(jobId, current, newState);
            }

            applyTransition(txn, record, newState, reason);
            return record;
        });
    }

    @Override
    public List<ScheduledJob<T>> listByOwner(String ownerId) throws JobStoreException {
        byte[] prefix = JobRecord.createOwnerPrefix(ownerId);
        List<ScheduledJob<T>> jobs = new ArrayList<>();

        Snapshot snapshot = transactionDB.getSnapshot();
        try (ReadOptions snapshotRead = new ReadOptions().setSnapshot(snapshot).setFillCache(false);
             RocksIterator iter = transactionDB.newIterator(ownerIndexCf, snapshotRead)) {

            for (iter.seek(prefix); iter.isValid() && startsWith(iter.key(), prefix); iter.next()) {
                String jobId = JobRecord.jobIdFromOwnerKey(iter.key(), prefix.length);
                byte[] value = transactionDB.get(jobsCf, snapshotRead, idKey(jobId));
                if (value != null) {
                    jobs.add(JobRecord.deserialize(value, codec));
                }
            }
        } catch (RocksDBException e) {
            throw new JobStoreException("Failed to list jobs of owner " + ownerId, e);
        } finally {
            transactionDB.releaseSnapshot(snapshot);
        }

        return jobs;
    }

    @Override
    public void remove(String jobId) throws JobStoreException {
        byte[] key = idKey(jobId);

        inTransaction("remove", jobId, txn -> {
            byte[] value = txn.getForUpdate(readOpts, jobsCf, key, true);
            if (value == null) {
                return null;
            }
            JobRecord<T> record = JobRecord.deserialize(value, codec);
            txn.delete(jobsCf, key);
            txn.delete(ownerIndexCf, JobRecord.createOwnerKey(record.getOwnerId(), jobId));
            txn.delete(triggerIndexCf, JobRecord.createTriggerKey(record.getTriggerTime(), jobId));
            txn.put(retiredCf, key, ByteBuffer.allocate(8).putLong(clock.millis()).array());
            return null;
        });
    }

    @Override
    public List<ScheduledJob<T>> loadAllPending(long nowMillis) throws JobStoreException {
        List<String> indexedIds = new ArrayList<>();
        try (RocksIterator iter = transactionDB.newIterator(triggerIndexCf, scanReadOpts)) {
            for (iter.seekToFirst(); iter.isValid(); iter.next()) {
                indexedIds.add(JobRecord.jobIdFromTriggerKey(iter.key()));
            }
        }

        List<ScheduledJob<T>> pending = new ArrayList<>();
        for (String jobId : indexedIds) {
            ScheduledJob<T> job = recover(jobId, nowMillis);
            if (job != null) {
                pending.add(job);
            }
        }
        return pending;
    }

    private ScheduledJob<T> recover(String jobId, long nowMillis) throws JobStoreException {
        byte[] key = idKey(jobId);

        return inTransaction("recover", jobId, txn -> {
            byte[] value = txn.getForUpdate(readOpts, jobsCf, key, true);
            if (value == null) {
                return null;
            }
            JobRecord<T> record = JobRecord.deserialize(value, codec);

            if (record.getState() == ScheduledJob.State.SCHEDULED) {
                return record;
            }
            if (record.getState() == ScheduledJob.State.RUNNING) {
                // Nobody completed it; the previous process died mid-execution
                ScheduledJob.State next = record.isMisfired(nowMillis)
                        ? ScheduledJob.State.MISSED
                        : ScheduledJob.State.SCHEDULED;
                logger.warn("job left running by previous process jobId={} reclassifiedAs={}", jobId, next);
                applyTransition(txn, record, next, null);
                return next == ScheduledJob.State.SCHEDULED ? record : null;
            }
            // Terminal jobs do not belong in the trigger index
            txn.delete(triggerIndexCf, JobRecord.createTriggerKey(record.getTriggerTime(), jobId));
            return null;
        });
    }

    @Override
    public long purgeTerminalBefore(long cutoffMillis) throws JobStoreException {
        List<String> expired = new ArrayList<>();

        try (RocksIterator iter = transactionDB.newIterator(jobsCf, scanReadOpts)) {
            for (iter.seekToFirst(); iter.isValid(); iter.next()) {
                JobRecord<T> record = JobRecord.deserialize(iter.value(), codec);
                if (record.getState().isTerminal() && record.getLastModified() < cutoffMillis) {
                    expired.add(record.getId());
                }
            }
        }

        for (String jobId : expired) {
            remove(jobId);
        }
        return expired.size();
    }

    @Override
    public StoreMetrics getMetrics() {
        Map<ScheduledJob.State, Long> counts = new EnumMap<>(ScheduledJob.State.class);

        try (RocksIterator iter = transactionDB.newIterator(jobsCf, scanReadOpts)) {
            for (iter.seekToFirst(); iter.isValid(); iter.next()) {
                JobRecord<T> record = JobRecord.deserialize(iter.value(), codec);
                counts.merge(record.getState(), 1L, Long::sum);
            }
        }

        return new StoreMetrics(counts);
    }

    @Override
    public void close() {
        for (ColumnFamilyHandle handle : handles) {
            handle.close();
        }
        if (scanReadOpts != null) {
            scanReadOpts.close();
        }
        if (readOpts != null) {
            readOpts.close();
        }
        if (txnOpts != null) {
            txnOpts.close();
        }
        if (writeOpts != null) {
            writeOpts.close();
        }
        if (transactionDB != null) {
            transactionDB.close();
        }
        closeOptions();
    }

    private void closeOptions() {
        dbOptions.close();
        cfOptions.close();
        // BlockBasedTableConfig has no close(); cache and filter are released here
        blockCache.close();
        bloomFilter.close();
    }

    private void applyTransition(Transaction txn, JobRecord<T> record, ScheduledJob.State next, String reason)
            throws RocksDBException {
        record.moveTo(next, reason, clock.millis());
        txn.put(jobsCf, idKey(record.getId()), record.serialize(codec));
        if (next.isTerminal()) {
            txn.delete(triggerIndexCf, JobRecord.createTriggerKey(record.getTriggerTime(), record.getId()));
        }
    }

    /**
     * Run work in an optimistic transaction, retrying on commit conflicts.
     */
    private <R> R inTransaction(String operation, String jobId, TransactionWork<R> work) throws JobStoreException {
        for (int attempt = 1; ; attempt++) {
            try (Transaction txn = transactionDB.beginTransaction(writeOpts, txnOpts)) {
                R result = work.apply(txn);
                txn.commit();
                return result;
            } catch (RocksDBException e) {
                if (isConflict(e) && attempt < MAX_TXN_ATTEMPTS) {
                    logger.debug("{} conflict on job {}, attempt {}", operation, jobId, attempt);
                    continue;
                }
                throw new JobStoreException(operation + " failed for job " + jobId, e);
            }
        }
    }

    private static boolean isConflict(RocksDBException e) {
        Status status = e.getStatus();
        return status != null
                && (status.getCode() == Status.Code.Busy || status.getCode() == Status.Code.TryAgain);
    }

    private static byte[] idKey(String jobId) {
        return jobId.getBytes(UTF_8);
    }

    private static boolean startsWith(byte[] key, byte[] prefix) {
        if (key.length < prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if (key[i] != prefix[i]) {
                return false;
            }
        }
        return true;
    }

    @FunctionalInterface
    private interface TransactionWork<R> {
        R apply(Transaction txn) throws RocksDBException, JobStoreException;
    }
}
