package kr.jemi.zcassa.seal.api;

public record CardStatus(boolean ready, String error) {

    public static CardStatus ok() {
        return new CardStatus(true, null);
    }

    public static CardStatus notReady(String error) {
        return new CardStatus(false, error);
    }
}
