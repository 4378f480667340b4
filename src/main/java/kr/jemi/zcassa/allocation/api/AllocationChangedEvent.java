package kr.jemi.zcassa.allocation.api;

public record AllocationChangedEvent(long actorId, String action, long allocationId, String description) {

    public static final String CREATED = "cashier_allocation_created";
    public static final String UPDATED = "cashier_allocation_updated";
    public static final String DELETED = "cashier_allocation_deleted";
}
