package com.example.strmmirror.application.job;

import com.example.strmmirror.application.service.MirrorTaskService;
import com.example.strmmirror.common.config.AppMirrorProperties;
import com.example.strmmirror.common.exception.BusinessException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledFuture;
import javax.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Service;

@Service
public class MirrorScheduleJob {

    private static final Logger log = LoggerFactory.getLogger(MirrorScheduleJob.class);

    private final AppMirrorProperties appMirrorProperties;
    private final MirrorTaskService mirrorTaskService;
    private final TaskScheduler mirrorTaskScheduler;
    private final List<ScheduledFuture<?>> scheduled = new ArrayList<>();

    public MirrorScheduleJob(AppMirrorProperties appMirrorProperties,
                             MirrorTaskService mirrorTaskService,
                             TaskScheduler mirrorTaskScheduler) {
        this.appMirrorProperties = appMirrorProperties;
        this.mirrorTaskService = mirrorTaskService;
        this.mirrorTaskScheduler = mirrorTaskScheduler;
    }

    @EventListener(ApplicationReadyEvent.class)
    public synchronized void registerSchedules() {
        for (AppMirrorProperties.Source source : appMirrorProperties.getSources()) {
            if (!source.hasCron()) {
                log.warn("Mirror source has no cron, runs only on demand, sourceId={}", source.getId());
                continue;
            }
            String cron = AppMirrorProperties.normalizeCron(source.getCron());
            String sourceId = source.getId();
            ScheduledFuture<?> future = mirrorTaskScheduler.schedule(() -> fire(sourceId), new CronTrigger(cron));
            if (future != null) {
                scheduled.add(future);
            }
            log.info("MIRROR_SCHEDULE_REGISTERED sourceId={} cron={}", sourceId, cron);
        }
    }

    void fire(String sourceId) {
        log.info("Mirror schedule triggered, sourceId={}", sourceId);
        try {
            mirrorTaskService.trigger(sourceId);
        } catch (BusinessException e) {
            if ("409".equals(e.getCode())) {
                log.info("Mirror schedule skipped due to active run, sourceId={}", sourceId);
            } else {
                log.warn("Mirror schedule trigger failed, sourceId={}, code={}, msg={}",
                        sourceId, e.getCode(), e.getMessage());
            }
        } catch (Exception e) {
            log.warn("Mirror schedule trigger failed unexpectedly, sourceId={}", sourceId, e);
        }
    }

    @PreDestroy
    public synchronized void cancelSchedules() {
        for (ScheduledFuture<?> future : scheduled) {
            future.cancel(false);
        }
        scheduled.clear();
    }
}
