package kr.jemi.zcassa.seal.infrastructure.out.persistence;

import kr.jemi.zcassa.seal.application.port.out.FiscalSealPort;
import kr.jemi.zcassa.seal.domain.FiscalSeal;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Component
public class FiscalSealJpaAdapter implements FiscalSealPort {

    private final FiscalSealJpaRepository repository;

    public FiscalSealJpaAdapter(FiscalSealJpaRepository repository) {
        this.repository = repository;
    }

    @Override
    public FiscalSeal insert(FiscalSeal seal) {
        return repository.save(FiscalSealJpaEntity.fromDomain(seal)).toDomain();
    }

    @Override
    public void update(FiscalSeal seal) {
        FiscalSealJpaEntity entity = repository.findById(seal.getId())
                .orElseThrow(() -> new IllegalStateException("봉인을 찾을 수 없습니다: id=" + seal.getId()));
        entity.update(seal);
    }

    @Override
    public Optional<FiscalSeal> findByIdForUpdate(long sealId) {
        return repository.findByIdForUpdate(sealId).map(FiscalSealJpaEntity::toDomain);
    }

    @Override
    public List<FiscalSeal> findUnboundCreatedBefore(LocalDateTime cutoff, int limit) {
        return repository.findUnboundCreatedBefore(cutoff, PageRequest.of(0, limit)).stream()
                .map(FiscalSealJpaEntity::toDomain)
                .toList();
    }
}
