package kr.jemi.zcassa.ticket.domain;

import java.util.Optional;

/**
 * 세무 당국이 정한 취소 사유 코드.
 */
public enum CancellationReason {
    EVENT_CANCELLED("01", "이벤트 취소"),
    EVENT_POSTPONED("02", "이벤트 연기"),
    EVENT_CHANGED("03", "이벤트 변경"),
    CUSTOMER_REFUND("04", "고객 요청 - 환불"),
    CUSTOMER_DATE_CHANGE("05", "고객 요청 - 날짜 변경"),
    ISSUANCE_ERROR("06", "발권 오류"),
    DUPLICATE("07", "중복 발권"),
    FRAUD("08", "부정 확인"),
    PAYMENT_MISSING("09", "미결제"),
    NAME_CHANGE("10", "명의 변경 - 기존 티켓"),
    RESALE("11", "재판매 - 기존 티켓"),
    FORCE_MAJEURE("12", "불가항력 취소"),
    OTHER("99", "기타 사유");

    private final String code;
    private final String description;

    CancellationReason(String code, String description) {
        this.code = code;
        this.description = description;
    }

    public static Optional<CancellationReason> fromCode(String code) {
        for (CancellationReason reason : values()) {
            if (reason.code.equals(code)) {
                return Optional.of(reason);
            }
        }
        return Optional.empty();
    }

    public String code() {
        return code;
    }

    public String description() {
        return description;
    }
}
