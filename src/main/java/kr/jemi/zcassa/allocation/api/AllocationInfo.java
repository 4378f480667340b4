package kr.jemi.zcassa.allocation.api;

public record AllocationInfo(long allocationId, long cashierId, long eventId, Long sectorId,
                             int quotaQuantity, int quotaUsed, boolean active) {

    public int quotaRemaining() {
        return quotaQuantity - quotaUsed;
    }
}
