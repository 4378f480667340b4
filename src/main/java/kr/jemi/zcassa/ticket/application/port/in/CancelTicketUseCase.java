package kr.jemi.zcassa.ticket.application.port.in;

import kr.jemi.zcassa.ticket.domain.CancellationResult;

public interface CancelTicketUseCase {

    CancellationResult cancel(CancelTicketCommand command);
}
