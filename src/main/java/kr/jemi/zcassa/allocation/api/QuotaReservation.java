package kr.jemi.zcassa.allocation.api;

public enum QuotaReservation {
    GRANTED,
    EXHAUSTED,
    NOT_FOUND
}
