package kr.jemi.zcassa.ticket.domain;

public record AllocationSnapshot(long allocationId, Long sectorId, int quotaRemaining) {

    public boolean authorizesSector(long sectorId) {
        return this.sectorId == null || this.sectorId == sectorId;
    }
}
