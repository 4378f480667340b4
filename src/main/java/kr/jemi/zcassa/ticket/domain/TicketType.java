package kr.jemi.zcassa.ticket.domain;

public enum TicketType {
    FULL,
    REDUCED,
    COMPLIMENTARY
}
