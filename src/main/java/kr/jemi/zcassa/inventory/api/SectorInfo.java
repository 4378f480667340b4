package kr.jemi.zcassa.inventory.api;

public record SectorInfo(long sectorId, long eventId, String sectorCode, String name,
                         int capacity, int availableSeats,
                         long priceFull, Long priceReduced, long priceComplimentary) {
}
