package kr.jemi.zcassa.ticket.application.port.in;

import kr.jemi.zcassa.ticket.domain.BatchIssuanceResult;

public interface IssueTicketUseCase {

    BatchIssuanceResult issue(IssueTicketCommand command);
}
