package kr.jemi.zcassa.common.validation;

/**
 * 생성 시점에 자기 필드의 Bean Validation 제약을 검사하는 도메인 객체와 커맨드.
 * 생성자 마지막 줄에서 {@link #validateSelf()} 를 호출한다.
 */
public interface SelfValidating {

    /**
     * @throws IllegalArgumentException 제약 위반이 하나라도 있을 때
     */
    default void validateSelf() {
        ValidationUtils.validate(this);
    }
}
