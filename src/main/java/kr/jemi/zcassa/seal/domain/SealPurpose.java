package kr.jemi.zcassa.seal.domain;

public enum SealPurpose {
    EMISSION,
    CANCELLATION
}
