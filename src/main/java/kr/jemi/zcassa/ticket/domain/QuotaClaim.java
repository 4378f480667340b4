package kr.jemi.zcassa.ticket.domain;

public enum QuotaClaim {
    GRANTED,
    EXHAUSTED,
    NOT_FOUND
}
