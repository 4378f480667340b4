package kr.jemi.zcassa.seal.application.port.out;

import kr.jemi.zcassa.seal.domain.FiscalSeal;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

public interface FiscalSealPort {

    FiscalSeal insert(FiscalSeal seal);

    void update(FiscalSeal seal);

    Optional<FiscalSeal> findByIdForUpdate(long sealId);

    List<FiscalSeal> findUnboundCreatedBefore(LocalDateTime cutoff, int limit);
}
