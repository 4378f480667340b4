package kr.jemi.zcassa.seal.infrastructure.out.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import kr.jemi.zcassa.seal.domain.FiscalSeal;
import kr.jemi.zcassa.seal.domain.SealPurpose;

import java.time.LocalDateTime;

@Entity
@Table(name = "fiscal_seals",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_seal_code", columnNames = "sealCode"),
                @UniqueConstraint(name = "uk_seal_ticket_purpose", columnNames = {"ticketId", "purpose"})
        },
        indexes = @Index(name = "idx_seal_created", columnList = "createdAt"))
public class FiscalSealJpaEntity {

    @Id
    private Long id;

    @Column(nullable = false)
    private long counter;

    @Column(nullable = false, length = 16)
    private String sealCode;

    @Column(length = 32)
    private String serialNumber;

    private String mac;

    @Column(nullable = false)
    private LocalDateTime sealedAt;

    @Column(nullable = false)
    private long priceMinorUnits;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private SealPurpose purpose;

    private Long ticketId;

    @Column(nullable = false)
    private long requestedBy;

    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;

    protected FiscalSealJpaEntity() {}

    public static FiscalSealJpaEntity fromDomain(FiscalSeal seal) {
        FiscalSealJpaEntity entity = new FiscalSealJpaEntity();
        entity.id = seal.getId();
        entity.counter = seal.getCounter();
        entity.sealCode = seal.getSealCode();
        entity.serialNumber = seal.getSerialNumber();
        entity.mac = seal.getMac();
        entity.sealedAt = seal.getSealedAt();
        entity.priceMinorUnits = seal.getPriceMinorUnits();
        entity.purpose = seal.getPurpose();
        entity.requestedBy = seal.getRequestedBy();
        entity.createdAt = seal.getCreatedAt();
        entity.update(seal);
        return entity;
    }

    public FiscalSeal toDomain() {
        return new FiscalSeal(id, counter, sealCode, serialNumber, mac, sealedAt, priceMinorUnits,
                purpose, ticketId, requestedBy, createdAt);
    }

    public void update(FiscalSeal seal) {
        this.ticketId = seal.getTicketId();
    }
}
