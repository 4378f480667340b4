package kr.jemi.zcassa.seal.application.port.in;

import kr.jemi.zcassa.seal.domain.FiscalSeal;

import java.util.List;

public interface ReportOrphanSealsUseCase {

    /**
     * 일정 시간 이상 티켓에 연결되지 않은 봉인을 찾아 기록한다.
     */
    List<FiscalSeal> reportOrphans();
}
