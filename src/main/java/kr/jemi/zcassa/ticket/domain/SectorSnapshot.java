package kr.jemi.zcassa.ticket.domain;

public record SectorSnapshot(long sectorId, long eventId, int availableSeats,
                             long priceFull, Long priceReduced, long priceComplimentary) {

    public boolean hasAvailableSeat() {
        return availableSeats > 0;
    }

    /**
     * 권종별 섹터 가격. 할인가가 없으면 정가를 적용한다.
     */
    public long priceFor(TicketType ticketType) {
        return switch (ticketType) {
            case FULL -> priceFull;
            case REDUCED -> priceReduced != null ? priceReduced : priceFull;
            case COMPLIMENTARY -> priceComplimentary;
        };
    }
}
