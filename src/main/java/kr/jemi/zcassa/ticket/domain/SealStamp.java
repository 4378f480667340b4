package kr.jemi.zcassa.ticket.domain;

/**
 * 티켓에 찍히는 봉인 정보.
 */
public record SealStamp(long sealId, String sealCode, long counter) {
}
