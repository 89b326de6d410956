package com.umitunal.qrun.storage;

import com.umitunal.qrun.config.StorageConfig;
import com.umitunal.qrun.core.QueueConnectionException;
import com.umitunal.qrun.model.QueueRecordCodec;
import com.umitunal.qrun.serialization.JobSerializer;
import org.rocksdb.BlockBasedTableConfig;
import org.rocksdb.CompressionType;
import org.rocksdb.Options;
import org.rocksdb.ReadOptions;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;
import org.rocksdb.WriteOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Polling backend on RocksDB: one key per queue ({@code jobs:<queue>}) whose value is the
 * JSON blob of all its records.
 *
 * <p>Suited to low-volume queues. Each pop is a full scan of the queue and the
 * read-modify-write is not atomic across processes; see {@link AbstractBlobQueue}.</p>
 */
public class RocksPollingQueue extends AbstractBlobQueue {
    private static final Logger log = LoggerFactory.getLogger(RocksPollingQueue.class);

    static final String KEY_PREFIX = "jobs:";

    private final RocksDB database;
    private final Options dbOptions;
    private final WriteOptions writeOpts;
    private final ReadOptions scanReadOpts;

    public RocksPollingQueue(StorageConfig config, JobSerializer serializer) {
        this(config, serializer, Clock.systemUTC());
    }

    public RocksPollingQueue(StorageConfig config, JobSerializer serializer, Clock clock) {
        super(serializer, new QueueRecordCodec(), clock);

        RocksDB.loadLibrary();

        this.dbOptions = new Options()
                .setCreateIfMissing(true)
                .setCompressionType(CompressionType.LZ4_COMPRESSION)
                .setWriteBufferSize((long) config.getMemoryBufferSizeMB() * 1024 * 1024)
                .setMaxWriteBufferNumber(config.getMaxMemoryBuffers())
                .setMaxBackgroundJobs(config.getBackgroundThreads())
                .setTableFormatConfig(new BlockBasedTableConfig());

        this.writeOpts = new WriteOptions()
                .setSync(config.isDurableWrites())
                .setDisableWAL(!config.isDurableWrites());

        // Prefix scans over queue keys should not pollute the block cache
        this.scanReadOpts = new ReadOptions()
                .setFillCache(false);

        try {
            this.database = RocksDB.open(dbOptions, config.getDataDirectory());
        } catch (RocksDBException e) {
            writeOpts.close();
            scanReadOpts.close();
            dbOptions.close();
            throw new QueueConnectionException("Failed to open RocksDB at " + config.getDataDirectory(), e);
        }
        log.info("Opened polling queue store at {}", config.getDataDirectory());
    }

    @Override
    protected byte[] readBlob(String queueName) {
        try {
            return database.get(queueKey(queueName));
        } catch (RocksDBException e) {
            throw new QueueConnectionException("Failed to read queue '" + queueName + "'", e);
        }
    }

    @Override
    protected void writeBlob(String queueName, byte[] blob) {
        try {
            database.put(writeOpts, queueKey(queueName), blob);
        } catch (RocksDBException e) {
            throw new QueueConnectionException("Failed to write queue '" + queueName + "'", e);
        }
    }

    @Override
    protected void deleteBlob(String queueName) {
        try {
            database.delete(writeOpts, queueKey(queueName));
        } catch (RocksDBException e) {
            throw new QueueConnectionException("Failed to delete queue '" + queueName + "'", e);
        }
    }

    @Override
    public synchronized Set<String> queueNames() {
        Set<String> names = new LinkedHashSet<>();
        byte[] prefix = KEY_PREFIX.getBytes(UTF_8);

        try (final RocksIterator iter = database.newIterator(scanReadOpts)) {
            iter.seek(prefix);

            while (iter.isValid()) {
                byte[] key = iter.key();
                if (!startsWith(key, prefix)) {
                    break;
                }
                names.add(new String(Arrays.copyOfRange(key, prefix.length, key.length), UTF_8));
                iter.next();
            }
        }
        return names;
    }

    @Override
    public void close() {
        if (scanReadOpts != null) scanReadOpts.close();
        if (writeOpts != null) writeOpts.close();
        if (database != null) database.close();
        if (dbOptions != null) dbOptions.close();
    }

    private static byte[] queueKey(String queueName) {
        return (KEY_PREFIX + queueName).getBytes(UTF_8);
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
}
