package kr.jemi.zcassa.inventory.api;

public record EventInfo(long eventId, long companyId, String eventCode,
                        int ticketsSold, int ticketsCancelled, long totalRevenue) {
}
