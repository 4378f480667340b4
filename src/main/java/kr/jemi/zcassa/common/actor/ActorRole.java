package kr.jemi.zcassa.common.actor;

public enum ActorRole {
    CASHIER,
    MANAGER,
    ADMIN,
    SUPER_ADMIN;

    public boolean isManagerTier() {
        return this != CASHIER;
    }

    public static ActorRole from(String value) {
        for (ActorRole role : values()) {
            if (role.name().equalsIgnoreCase(value)) {
                return role;
            }
        }
        throw new IllegalArgumentException("알 수 없는 역할: " + value);
    }
}
