package kr.jemi.zcassa.allocation.application.port.out;

public interface EventLookupPort {

    boolean eventExists(long eventId);

    boolean sectorBelongsTo(long sectorId, long eventId);
}
