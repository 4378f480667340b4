package kr.jemi.zcassa.seal.application.service;

import io.hypersistence.tsid.TSID;
import kr.jemi.zcassa.seal.api.CardStatus;
import kr.jemi.zcassa.seal.api.FiscalSealFacade;
import kr.jemi.zcassa.seal.api.SealException;
import kr.jemi.zcassa.seal.api.SealFailure;
import kr.jemi.zcassa.seal.api.SealReceipt;
import kr.jemi.zcassa.seal.application.port.in.ReportDeviceStatusUseCase;
import kr.jemi.zcassa.seal.application.port.in.ReportOrphanSealsUseCase;
import kr.jemi.zcassa.seal.application.port.out.DeviceLockPort;
import kr.jemi.zcassa.seal.application.port.out.DeviceStatusPort;
import kr.jemi.zcassa.seal.application.port.out.FiscalSealPort;
import kr.jemi.zcassa.seal.application.port.out.SealDevicePort;
import kr.jemi.zcassa.seal.domain.DeviceSeal;
import kr.jemi.zcassa.seal.domain.DeviceStatus;
import kr.jemi.zcassa.seal.domain.FiscalSeal;
import kr.jemi.zcassa.seal.domain.SealPurpose;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDateTime;
import java.util.List;

@Service
public class SealService implements FiscalSealFacade, ReportDeviceStatusUseCase, ReportOrphanSealsUseCase {

    private static final Logger log = LoggerFactory.getLogger(SealService.class);
    private static final int ORPHAN_REPORT_LIMIT = 500;

    private final DeviceStatusPort deviceStatusPort;
    private final DeviceLockPort deviceLockPort;
    private final SealDevicePort sealDevicePort;
    private final FiscalSealPort fiscalSealPort;
    private final TSID.Factory tsidFactory;
    private final TransactionTemplate recordTx;
    private final long statusTtlSeconds;
    private final long lockWaitMillis;
    private final long lockLeaseMillis;
    private final long orphanThresholdMinutes;

    public SealService(DeviceStatusPort deviceStatusPort,
                       DeviceLockPort deviceLockPort,
                       SealDevicePort sealDevicePort,
                       FiscalSealPort fiscalSealPort,
                       TSID.Factory tsidFactory,
                       PlatformTransactionManager transactionManager,
                       @Value("${zcassa.seal.status-ttl-seconds}") long statusTtlSeconds,
                       @Value("${zcassa.seal.lock-wait-millis}") long lockWaitMillis,
                       @Value("${zcassa.seal.lock-lease-millis}") long lockLeaseMillis,
                       @Value("${zcassa.seal.orphan-report.threshold-minutes}") long orphanThresholdMinutes) {
        this.deviceStatusPort = deviceStatusPort;
        this.deviceLockPort = deviceLockPort;
        this.sealDevicePort = sealDevicePort;
        this.fiscalSealPort = fiscalSealPort;
        this.tsidFactory = tsidFactory;
        this.recordTx = new TransactionTemplate(transactionManager);
        this.recordTx.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.statusTtlSeconds = statusTtlSeconds;
        this.lockWaitMillis = lockWaitMillis;
        this.lockLeaseMillis = lockLeaseMillis;
        this.orphanThresholdMinutes = orphanThresholdMinutes;
    }

    @Override
    public void report(DeviceStatus status) {
        deviceStatusPort.save(status, statusTtlSeconds);
    }

    @Override
    public DeviceStatus current() {
        return deviceStatusPort.find().orElseGet(DeviceStatus::disconnected);
    }

    @Override
    public boolean isDeviceConnected() {
        return current().connected();
    }

    @Override
    public CardStatus cardStatus() {
        DeviceStatus status = current();
        if (!status.connected()) {
            return CardStatus.notReady("브리지 미연결");
        }
        if (!status.cardInserted()) {
            return CardStatus.notReady(status.cardError() != null ? status.cardError() : "카드 미삽입");
        }
        if (!status.cardReady()) {
            return CardStatus.notReady(status.cardError() != null ? status.cardError() : "카드 미준비");
        }
        return CardStatus.ok();
    }

    @Override
    public SealReceipt requestEmissionSeal(long priceMinorUnits, long requestedBy) {
        if (priceMinorUnits < 0) {
            throw new IllegalArgumentException("봉인 금액은 음수일 수 없습니다: " + priceMinorUnits);
        }
        return requestSeal(priceMinorUnits, SealPurpose.EMISSION, requestedBy);
    }

    @Override
    public SealReceipt requestCancellationSeal(long requestedBy) {
        return requestSeal(0, SealPurpose.CANCELLATION, requestedBy);
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public void bindToTicket(long sealId, long ticketId) {
        FiscalSeal seal = fiscalSealPort.findByIdForUpdate(sealId)
                .orElseThrow(() -> new IllegalStateException("봉인 없음: " + sealId));
        seal.bindTo(ticketId);
        fiscalSealPort.update(seal);
    }

    @Override
    public List<FiscalSeal> reportOrphans() {
        LocalDateTime cutoff = LocalDateTime.now().minusMinutes(orphanThresholdMinutes);
        List<FiscalSeal> orphans = fiscalSealPort.findUnboundCreatedBefore(cutoff, ORPHAN_REPORT_LIMIT);
        for (FiscalSeal seal : orphans) {
            log.warn("티켓에 연결되지 않은 봉인: sealCode={}, counter={}, serialNumber={}, purpose={}, price={}, requestedBy={}",
                    seal.getSealCode(), seal.getCounter(), seal.getSerialNumber(), seal.getPurpose(),
                    seal.getPriceMinorUnits(), seal.getRequestedBy());
        }
        return orphans;
    }

    private SealReceipt requestSeal(long priceMinorUnits, SealPurpose purpose, long requestedBy) {
        DeviceStatus status = current();
        if (!status.connected()) {
            throw new SealException(SealFailure.BRIDGE_NOT_CONNECTED, "봉인 장치 브리지가 연결되어 있지 않습니다");
        }
        if (!status.readyForSeal()) {
            throw new SealException(SealFailure.CARD_NOT_READY, cardStatus().error());
        }

        String owner = deviceLockPort.acquire(lockWaitMillis, lockLeaseMillis)
                .orElseThrow(() -> new SealException(SealFailure.DEVICE_BUSY, "봉인 장치가 다른 요청을 처리 중입니다"));
        DeviceSeal deviceSeal;
        try {
            deviceSeal = sealDevicePort.seal(priceMinorUnits);
        } finally {
            releaseQuietly(owner);
        }

        FiscalSeal seal;
        try {
            seal = recordTx.execute(tx -> fiscalSealPort.insert(FiscalSeal.record(
                    tsidFactory.generate().toLong(), deviceSeal, priceMinorUnits, purpose, requestedBy)));
        } catch (RuntimeException e) {
            log.error("발급된 봉인을 원장에 기록하지 못했습니다: sealCode={}, counter={}, serialNumber={}",
                    deviceSeal.sealCode(), deviceSeal.counter(), deviceSeal.serialNumber(), e);
            throw e;
        }
        log.info("봉인 발급: sealCode={}, counter={}, purpose={}, price={}",
                seal.getSealCode(), seal.getCounter(), purpose, priceMinorUnits);
        return new SealReceipt(seal.getId(), seal.getCounter(), seal.getSealCode(), seal.getSerialNumber(),
                seal.getMac(), seal.getSealedAt());
    }

    // 해제 실패는 임대 만료로 풀린다. 이미 발급된 봉인의 기록을 막지 않는다
    private void releaseQuietly(String owner) {
        try {
            deviceLockPort.release(owner);
        } catch (RuntimeException e) {
            log.warn("봉인 장치 락 해제 실패, 임대 만료까지 대기합니다: owner={}, leaseMillis={}",
                    owner, lockLeaseMillis, e);
        }
    }
}
