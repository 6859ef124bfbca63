package com.umitunal.sendlater.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoggingSchedulerListener implements SchedulerListener {
    private static final Logger logger = LoggerFactory.getLogger(LoggingSchedulerListener.class);

    @Override
    public void onEvent(SchedulerEvent event) {
        switch (event.getType()) {
            case FAILED -> logger.error("job failed jobId={} ownerId={} reason={}",
                    event.getJobId(), event.getOwnerId(), event.getDetail());
            case MISSED -> logger.warn("job missed jobId={} ownerId={} {}",
                    event.getJobId(), event.getOwnerId(), event.getDetail());
            case STARTED -> logger.debug("job started jobId={}", event.getJobId());
            default -> logger.info("job {} jobId={} ownerId={}",
                    event.getType().name().toLowerCase(), event.getJobId(), event.getOwnerId());
        }
    }
}
