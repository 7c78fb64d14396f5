package kr.jemi.zcloset.common.validation;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.stream.Collectors;

public final class ValidationUtils {

    private static final Validator validator = Validation.buildDefaultValidatorFactory().getValidator();

    private ValidationUtils() {}

    public static void validate(Object target) {
        Set<ConstraintViolation<Object>> violations = validator.validate(target);
        if (!violations.isEmpty()) {
            String message = violations.stream()
                    .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                    .collect(Collectors.joining(", "));
            throw new IllegalArgumentException(
                    target.getClass().getSimpleName() + " 검증 실패: " + message);
        }
    }

    public static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    /**
     * 상품 ID 목록에서 공백 항목을 제거하고 순서를 유지한 채 중복을 제거한다.
     */
    public static Set<String> distinctIds(Collection<String> ids) {
        if (ids == null) {
            return Set.of();
        }
        return ids.stream()
                .filter(id -> !isBlank(id))
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
