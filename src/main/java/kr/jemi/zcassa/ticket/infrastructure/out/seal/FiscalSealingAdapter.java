package kr.jemi.zcassa.ticket.infrastructure.out.seal;

import kr.jemi.zcassa.common.exception.ErrorCode;
import kr.jemi.zcassa.seal.api.CardStatus;
import kr.jemi.zcassa.seal.api.FiscalSealFacade;
import kr.jemi.zcassa.seal.api.SealException;
import kr.jemi.zcassa.seal.api.SealReceipt;
import kr.jemi.zcassa.ticket.application.port.out.FiscalSealingPort;
import kr.jemi.zcassa.ticket.domain.DeviceReadiness;
import kr.jemi.zcassa.ticket.domain.SealStamp;
import kr.jemi.zcassa.ticket.domain.SealingFailedException;
import org.springframework.stereotype.Component;

@Component
public class FiscalSealingAdapter implements FiscalSealingPort {

    private final FiscalSealFacade fiscalSealFacade;

    public FiscalSealingAdapter(FiscalSealFacade fiscalSealFacade) {
        this.fiscalSealFacade = fiscalSealFacade;
    }

    @Override
    public DeviceReadiness checkReadiness() {
        if (!fiscalSealFacade.isDeviceConnected()) {
            return DeviceReadiness.notReady(ErrorCode.BRIDGE_NOT_CONNECTED, null);
        }
        CardStatus cardStatus = fiscalSealFacade.cardStatus();
        if (!cardStatus.ready()) {
            return DeviceReadiness.notReady(ErrorCode.CARD_NOT_READY, cardStatus.error());
        }
        return DeviceReadiness.ready();
    }

    @Override
    public SealStamp sealEmission(long priceMinorUnits, long requestedBy) {
        try {
            return toStamp(fiscalSealFacade.requestEmissionSeal(priceMinorUnits, requestedBy));
        } catch (SealException e) {
            throw new SealingFailedException(e.getFailure().errorCode(), e.getMessage(), e);
        }
    }

    @Override
    public SealStamp sealCancellation(long requestedBy) {
        try {
            return toStamp(fiscalSealFacade.requestCancellationSeal(requestedBy));
        } catch (SealException e) {
            throw new SealingFailedException(e.getFailure().errorCode(), e.getMessage(), e);
        }
    }

    @Override
    public void bindToTicket(long sealId, long ticketId) {
        fiscalSealFacade.bindToTicket(sealId, ticketId);
    }

    private static SealStamp toStamp(SealReceipt receipt) {
        return new SealStamp(receipt.sealId(), receipt.sealCode(), receipt.counter());
    }
}
