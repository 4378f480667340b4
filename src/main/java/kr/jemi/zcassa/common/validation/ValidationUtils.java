package kr.jemi.zcassa.common.validation;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import kr.jemi.zcassa.common.exception.BusinessException;
import kr.jemi.zcassa.common.exception.ErrorCode;

import java.util.Comparator;
import java.util.Set;
import java.util.function.Supplier;
import java.util.stream.Collectors;

public final class ValidationUtils {

    private static final Validator validator = Validation.buildDefaultValidatorFactory().getValidator();

    private ValidationUtils() {}

    /**
     * Bean Validation 제약을 검사하고 위반이 있으면 필드별 거부 값을 담아 IllegalArgumentException 을 던진다.
     */
    public static void validate(Object target) {
        Set<ConstraintViolation<Object>> violations = validator.validate(target);
        if (violations.isEmpty()) {
            return;
        }
        String detail = violations.stream()
                .sorted(Comparator.comparing(v -> v.getPropertyPath().toString()))
                .map(v -> v.getPropertyPath() + "=" + v.getInvalidValue() + " (" + v.getMessage() + ")")
                .collect(Collectors.joining(", "));
        throw new IllegalArgumentException(target.getClass().getSimpleName() + " 검증 실패: " + detail);
    }

    /**
     * 요청 값으로 커맨드를 만든다. 생성 중 검증 실패는 INVALID_REQUEST 로 바꾼다.
     * 웹 어댑터에서만 쓴다. 그 밖의 IllegalArgumentException 은 내부 오류로 남겨 둔다.
     */
    public static <T> T fromRequest(Supplier<T> factory) {
        try {
            return factory.get();
        } catch (IllegalArgumentException e) {
            throw new BusinessException(ErrorCode.INVALID_REQUEST, e.getMessage());
        }
    }
}
