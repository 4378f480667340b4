package kr.jemi.zcassa.common.actor;

/**
 * 요청 헤더(X-Actor-Id, X-Actor-Role, X-Company-Id)로 전달되는 호출자 정보.
 */
public record Actor(long actorId, ActorRole role, long companyId) {

    public Actor {
        if (role == null) {
            throw new IllegalArgumentException("역할은 필수입니다");
        }
    }

    public static Actor of(long actorId, String role, long companyId) {
        return new Actor(actorId, ActorRole.from(role), companyId);
    }

    public boolean isManagerTier() {
        return role.isManagerTier();
    }

    /**
     * 봉인 생략은 SUPER_ADMIN 이 명시적으로 요청한 경우에만 허용된다.
     */
    public boolean bypassesFiscalSeal(boolean skipFiscalSeal) {
        return skipFiscalSeal && role == ActorRole.SUPER_ADMIN;
    }
}
