package kr.jemi.zcassa.ticket.domain;

public enum PaymentMethod {
    CASH,
    CARD,
    OTHER
}
