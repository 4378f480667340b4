package kr.jemi.zcassa.seal.api;

import java.time.LocalDateTime;

public record SealReceipt(long sealId, long counter, String sealCode, String serialNumber,
                          String mac, LocalDateTime sealedAt) {
}
