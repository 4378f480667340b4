package kr.jemi.zcassa.inventory.domain;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import kr.jemi.zcassa.common.validation.SelfValidating;

import java.time.LocalDateTime;

public class EventSector implements SelfValidating {

    private final long id;
    private final long eventId;
    @NotBlank
    private final String sectorCode;
    @NotBlank
    private final String name;
    @Min(0)
    private final int capacity;
    @Min(0)
    private int availableSeats;
    @Min(0)
    private final long priceFull;
    @Min(0)
    private final Long priceReduced;
    @Min(0)
    private final long priceComplimentary;
    private LocalDateTime updatedAt;

    public EventSector(long id, long eventId, String sectorCode, String name, int capacity,
                       int availableSeats, long priceFull, Long priceReduced,
                       long priceComplimentary, LocalDateTime updatedAt) {
        this.id = id;
        this.eventId = eventId;
        this.sectorCode = sectorCode;
        this.name = name;
        this.capacity = capacity;
        this.availableSeats = availableSeats;
        this.priceFull = priceFull;
        this.priceReduced = priceReduced;
        this.priceComplimentary = priceComplimentary;
        this.updatedAt = updatedAt;
        validateSelf();
        if (availableSeats > capacity) {
            throw new IllegalArgumentException(
                    "잔여 좌석이 수용 인원을 초과할 수 없습니다: " + availableSeats + " > " + capacity);
        }
    }

    public static EventSector open(long id, long eventId, String sectorCode, String name, int capacity,
                                   long priceFull, Long priceReduced, long priceComplimentary) {
        return new EventSector(id, eventId, sectorCode, name, capacity, capacity,
                priceFull, priceReduced, priceComplimentary, LocalDateTime.now());
    }

    public boolean takeSeat() {
        if (availableSeats <= 0) {
            return false;
        }
        availableSeats--;
        updatedAt = LocalDateTime.now();
        return true;
    }

    /**
     * 좌석 반환. 이미 수용 인원만큼 비어 있으면 반영하지 않고 false를 반환한다.
     */
    public boolean releaseSeat() {
        if (availableSeats >= capacity) {
            return false;
        }
        availableSeats++;
        updatedAt = LocalDateTime.now();
        return true;
    }

    public long getId() {
        return id;
    }

    public long getEventId() {
        return eventId;
    }

    public String getSectorCode() {
        return sectorCode;
    }

    public String getName() {
        return name;
    }

    public int getCapacity() {
        return capacity;
    }

    public int getAvailableSeats() {
        return availableSeats;
    }

    public long getPriceFull() {
        return priceFull;
    }

    public Long getPriceReduced() {
        return priceReduced;
    }

    public long getPriceComplimentary() {
        return priceComplimentary;
    }

    public LocalDateTime getUpdatedAt() {
        return updatedAt;
    }
}
