package com.umitunal;

import com.umitunal.sendlater.config.ApplicationConfig;
import com.umitunal.sendlater.config.StorageConfig;
import com.umitunal.sendlater.credential.RocksCredentialStore;
import com.umitunal.sendlater.delivery.VkApiClient;
import com.umitunal.sendlater.model.DeliveryPayload;
import com.umitunal.sendlater.scheduler.DeliveryJobExecutor;
import com.umitunal.sendlater.scheduler.DeliveryScheduler;
import com.umitunal.sendlater.scheduler.LoggingSchedulerListener;
import com.umitunal.sendlater.security.TokenCipher;
import com.umitunal.sendlater.serialization.PayloadCodec;
import com.umitunal.sendlater.storage.RocksJobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Starts the stores and the delivery scheduler and runs until the process is stopped.
 * A transport layer calls into {@link com.umitunal.sendlater.api.SendLaterService}.
 * {@code Main genkey} prints a fresh ENCRYPTION_KEY instead.
 */
public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) throws Exception {
        if (args.length > 0 && args[0].equals("genkey")) {
            System.out.println(TokenCipher.generateKey());
            return;
        }

        ApplicationConfig config = ApplicationConfig.fromEnvironment(System.getenv());
        StorageConfig storage = config.getStorageConfig();
        TokenCipher cipher = TokenCipher.fromBase64Key(config.getEncryptionKey());
        PayloadCodec<DeliveryPayload> codec = PayloadCodec.named(config.getPayloadCodec(), DeliveryPayload.class);

        RocksJobStore<DeliveryPayload> jobStore =
                new RocksJobStore<>(storage.withDataDirectory(storage.getDataDirectory().resolve("jobs")), codec);
        RocksCredentialStore credentials =
                new RocksCredentialStore(storage.withDataDirectory(storage.getDataDirectory().resolve("accounts")), cipher);
        VkApiClient vk = new VkApiClient(config.getVkClientConfig());

        DeliveryScheduler scheduler = new DeliveryScheduler(jobStore,
                new DeliveryJobExecutor(credentials, vk), config.getSchedulerConfig());
        scheduler.addListener(new LoggingSchedulerListener());
        scheduler.start();

        logger.info("sendlater ready dataDir={} codec={} metrics={}",
                storage.getDataDirectory(), config.getPayloadCodec(), jobStore.getMetrics());

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("shutting down");
            scheduler.close();
            credentials.close();
            jobStore.close();
            stopped.countDown();
        }, "sendlater-shutdown"));

        stopped.await();
    }
}
