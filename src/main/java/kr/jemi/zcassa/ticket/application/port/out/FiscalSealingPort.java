package kr.jemi.zcassa.ticket.application.port.out;

import kr.jemi.zcassa.ticket.domain.DeviceReadiness;
import kr.jemi.zcassa.ticket.domain.SealStamp;

public interface FiscalSealingPort {

    DeviceReadiness checkReadiness();

    /**
     * @throws kr.jemi.zcassa.ticket.domain.SealingFailedException 봉인 발급 실패
     */
    SealStamp sealEmission(long priceMinorUnits, long requestedBy);

    /**
     * @throws kr.jemi.zcassa.ticket.domain.SealingFailedException 봉인 발급 실패
     */
    SealStamp sealCancellation(long requestedBy);

    void bindToTicket(long sealId, long ticketId);
}
