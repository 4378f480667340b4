package kr.jemi.zcassa.seal.infrastructure.in.scheduler;

import kr.jemi.zcassa.seal.application.port.in.ReportOrphanSealsUseCase;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class OrphanSealReportScheduler {

    private static final Logger log = LoggerFactory.getLogger(OrphanSealReportScheduler.class);

    private final ReportOrphanSealsUseCase reportOrphanSealsUseCase;

    public OrphanSealReportScheduler(ReportOrphanSealsUseCase reportOrphanSealsUseCase) {
        this.reportOrphanSealsUseCase = reportOrphanSealsUseCase;
    }

    @Scheduled(cron = "${zcassa.seal.orphan-report.cron}")
    @SchedulerLock(name = "reportOrphanSeals",
            lockAtMostFor = "${zcassa.seal.orphan-report.lock-at-most-for}",
            lockAtLeastFor = "${zcassa.seal.orphan-report.lock-at-least-for}")
    public void report() {
        try {
            int count = reportOrphanSealsUseCase.reportOrphans().size();
            if (count > 0) {
                log.warn("미연결 봉인 {}건 발견", count);
            }
        } catch (Exception e) {
            log.error("미연결 봉인 점검 스케줄러 실패", e);
        }
    }
}
