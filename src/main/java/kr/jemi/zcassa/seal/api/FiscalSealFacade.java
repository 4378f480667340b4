package kr.jemi.zcassa.seal.api;

/**
 * 봉인 장치 계약. 장치 호출은 DB 트랜잭션 밖에서 해야 한다.
 */
public interface FiscalSealFacade {

    boolean isDeviceConnected();

    CardStatus cardStatus();

    /**
     * 발권 금액으로 봉인을 요청한다. 장치 호출은 서버 인스턴스 전체에서 직렬화된다.
     * 발급된 봉인은 티켓 연결 여부와 무관하게 봉인 원장에 기록된다.
     *
     * @throws SealException 장치 미연결, 카드 미준비, 장치 오류
     */
    SealReceipt requestEmissionSeal(long priceMinorUnits, long requestedBy);

    /**
     * 취소용 0원 봉인을 요청한다.
     *
     * @throws SealException 장치 미연결, 카드 미준비, 장치 오류
     */
    SealReceipt requestCancellationSeal(long requestedBy);

    /**
     * 봉인을 티켓에 연결한다. 호출자의 트랜잭션 안에서만 호출할 수 있다.
     */
    void bindToTicket(long sealId, long ticketId);
}
