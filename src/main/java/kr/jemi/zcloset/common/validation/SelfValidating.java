package kr.jemi.zcloset.common.validation;

public interface SelfValidating {

    default void validateSelf() {
        ValidationUtils.validate(this);
    }
}
