package kr.jemi.zcassa.ticket.infrastructure.in.web.dto;

import kr.jemi.zcassa.ticket.domain.RangeCancellationResult;

import java.util.List;

public record RangeCancellationResponse(int cancelledCount, int totalInRange, List<ErrorItem> errors) {

    public static RangeCancellationResponse from(RangeCancellationResult result) {
        return new RangeCancellationResponse(result.cancelledCount(), result.totalInRange(),
                result.errors().stream()
                        .map(e -> new ErrorItem(e.ticketId(), e.ticketCode(), e.errorCode().name(), e.message()))
                        .toList());
    }

    public record ErrorItem(long ticketId, String ticketCode, String errorCode, String message) {
    }
}
