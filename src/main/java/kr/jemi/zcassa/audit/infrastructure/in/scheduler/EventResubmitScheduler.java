package kr.jemi.zcassa.audit.infrastructure.in.scheduler;

import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.modulith.events.IncompleteEventPublications;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * 감사 리스너가 끝내지 못한 이벤트 발행을 다시 전달한다.
 */
@Component
public class EventResubmitScheduler {

    private static final Logger log = LoggerFactory.getLogger(EventResubmitScheduler.class);

    private final IncompleteEventPublications incompleteEventPublications;
    private final Duration resubmitAfter;

    public EventResubmitScheduler(IncompleteEventPublications incompleteEventPublications,
                                  @Value("${zcassa.event-resubmit.older-than}") Duration resubmitAfter) {
        this.incompleteEventPublications = incompleteEventPublications;
        this.resubmitAfter = resubmitAfter;
    }

    @Scheduled(cron = "${zcassa.event-resubmit.cron}")
    @SchedulerLock(name = "resubmitIncompleteEvents",
            lockAtMostFor = "${zcassa.event-resubmit.lock-at-most-for}",
            lockAtLeastFor = "${zcassa.event-resubmit.lock-at-least-for}")
    public void resubmitIncompleteEvents() {
        try {
            incompleteEventPublications.resubmitIncompletePublicationsOlderThan(resubmitAfter);
        } catch (Exception e) {
            log.error("미완료 감사 이벤트 재발행 실패", e);
        }
    }
}
