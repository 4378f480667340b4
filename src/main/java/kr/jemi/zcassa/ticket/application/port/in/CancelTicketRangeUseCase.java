package kr.jemi.zcassa.ticket.application.port.in;

import kr.jemi.zcassa.ticket.domain.RangeCancellationResult;

public interface CancelTicketRangeUseCase {

    /**
     * 진행번호 구간의 ACTIVE 티켓을 하나씩 취소한다. 개별 실패는 결과의 errors 에 담긴다.
     *
     * @throws kr.jemi.zcassa.common.exception.BusinessException 권한, 사유 코드, 이벤트 검증 실패
     */
    RangeCancellationResult cancelRange(CancelTicketRangeCommand command);
}
