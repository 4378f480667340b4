package kr.jemi.zcassa.ticket.domain;

public enum TicketStatus {
    ACTIVE,
    CANCELLED,
    USED
}
