package kr.jemi.zcassa.ticket.infrastructure.in.web.dto;

import kr.jemi.zcassa.ticket.domain.BatchIssuanceResult;

import java.util.List;

public record PartialIssuanceResponse(int emittedCount, int requestedCount, List<TicketResponse> tickets,
                                      String errorCode, String message) {

    public static PartialIssuanceResponse from(BatchIssuanceResult result) {
        return new PartialIssuanceResponse(result.emittedCount(), result.requestedCount(),
                result.tickets().stream().map(TicketResponse::from).toList(),
                result.errorCode().name(), result.message());
    }
}
