package kr.jemi.zcassa.ticket.domain;

public record Participant(String firstName, String lastName) {

    /**
     * 이름과 성이 모두 비어 있으면 참가자 정보가 없는 것으로 본다.
     */
    public static Participant ofNullable(String firstName, String lastName) {
        if (isBlank(firstName) && isBlank(lastName)) {
            return null;
        }
        return new Participant(firstName, lastName);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
