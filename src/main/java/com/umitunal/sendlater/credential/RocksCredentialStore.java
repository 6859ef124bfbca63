package com.umitunal.sendlater.credential;

import com.umitunal.sendlater.config.StorageConfig;
import com.umitunal.sendlater.security.ClientSecrets;
import com.umitunal.sendlater.security.TokenCipher;
import com.umitunal.sendlater.serialization.CodecException;
import com.umitunal.sendlater.serialization.JsonCodec;
import com.umitunal.sendlater.serialization.PayloadCodec;
import org.rocksdb.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * RocksDB-backed credential store.
 *
 * Column families:
 * - default: ownerId -> AccountRecord (JSON)
 * - secrets: sha256(clientSecret) -> ownerId
 *
 * Linking is serialized; lookups are lock-free and read whole records, so a
 * concurrent re-link is seen either entirely before or entirely after.
 */
public class RocksCredentialStore implements CredentialStore, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(RocksCredentialStore.class);
    private static final byte[] SECRETS = "secrets".getBytes(UTF_8);

    private final RocksDB database;
    private final List<ColumnFamilyHandle> handles;
    private final ColumnFamilyHandle accountsCf;
    private final ColumnFamilyHandle secretsCf;
    private final DBOptions dbOptions;
    private final ColumnFamilyOptions cfOptions;
    private final WriteOptions writeOpts;
    private final TokenCipher cipher;
    private final PayloadCodec<AccountRecord> codec = new JsonCodec<>(AccountRecord.class);
    private final Clock clock;

    public RocksCredentialStore(StorageConfig config, TokenCipher cipher) throws CredentialStoreException {
        this(config, cipher, Clock.systemUTC());
    }

    public RocksCredentialStore(StorageConfig config, TokenCipher cipher, Clock clock)
            throws CredentialStoreException {
        this.cipher = cipher;
        this.clock = clock;

        RocksDB.loadLibrary();

        this.cfOptions = new ColumnFamilyOptions()
                .setWriteBufferSize(config.getMemoryBufferSizeMB() * 1024L * 1024L);
        this.dbOptions = new DBOptions()
                .setCreateIfMissing(true)
                .setCreateMissingColumnFamilies(true)
                .setMaxBackgroundJobs(config.getBackgroundThreads());

        List<ColumnFamilyDescriptor> descriptors = List.of(
                new ColumnFamilyDescriptor(RocksDB.DEFAULT_COLUMN_FAMILY, cfOptions),
                new ColumnFamilyDescriptor(SECRETS, cfOptions));
        this.handles = new ArrayList<>();

        try {
            Files.createDirectories(config.getDataDirectory());
            this.database = RocksDB.open(dbOptions, config.getDataDirectory().toString(), descriptors, handles);
        } catch (IOException | RocksDBException e) {
            dbOptions.close();
            cfOptions.close();
            throw new CredentialStoreException("Failed to open credential store at " + config.getDataDirectory(), e);
        }

        this.accountsCf = handles.get(0);
        this.secretsCf = handles.get(1);
        this.writeOpts = new WriteOptions().setSync(config.isDurableWrites());
    }

    @Override
    public synchronized String link(String ownerId, String upstreamToken) throws CredentialStoreException {
        String clientSecret = ClientSecrets.generate();
        byte[] digest = ClientSecrets.digest(clientSecret);
        byte[] ownerKey = ownerId.getBytes(UTF_8);
        AccountRecord account = new AccountRecord(ownerId, digest, cipher.encrypt(upstreamToken), clock.millis());

        try (WriteBatch batch = new WriteBatch()) {
            byte[] existing = database.get(accountsCf, ownerKey);
            if (existing != null) {
                // Re-linking replaces the old secret
                batch.delete(secretsCf, codec.decode(existing).getSecretDigest());
            }
            batch.put(secretsCf, digest, ownerKey);
            batch.put(accountsCf, ownerKey, codec.encode(account));
            database.write(writeOpts, batch);
        } catch (RocksDBException | CodecException e) {
            throw new CredentialStoreException("Failed to link account " + ownerId, e);
        }

        logger.info("account linked ownerId={} secret={}", ownerId, ClientSecrets.tail(clientSecret));
        return clientSecret;
    }

    @Override
    public Optional<String> findOwnerBySecret(String clientSecret) throws CredentialStoreException {
        try {
            byte[] owner = database.get(secretsCf, ClientSecrets.digest(clientSecret));
            return owner == null ? Optional.empty() : Optional.of(new String(owner, UTF_8));
        } catch (RocksDBException e) {
            throw new CredentialStoreException("Failed to look up client secret", e);
        }
    }

    @Override
    public String resolve(String ownerId) throws CredentialUnavailableException {
        AccountRecord account;
        try {
            byte[] value = database.get(accountsCf, ownerId.getBytes(UTF_8));
            if (value == null) {
                throw new CredentialUnavailableException(CredentialUnavailableException.Reason.NOT_FOUND,
                        "No credential stored for account " + ownerId);
            }
            account = codec.decode(value);
        } catch (RocksDBException | CodecException e) {
            throw new CredentialUnavailableException(CredentialUnavailableException.Reason.STORAGE_ERROR,
                    "Failed to read credential of account " + ownerId, e);
        }

        try {
            return cipher.decrypt(account.getEncryptedToken());
        } catch (TokenCipher.DecryptionException e) {
            throw new CredentialUnavailableException(CredentialUnavailableException.Reason.DECRYPTION_FAILED,
                    "Failed to decrypt credential of account " + ownerId, e);
        }
    }

    @Override
    public void close() {
        for (ColumnFamilyHandle handle : handles) {
            handle.close();
        }
        writeOpts.close();
        database.close();
        dbOptions.close();
        cfOptions.close();
    }
}
