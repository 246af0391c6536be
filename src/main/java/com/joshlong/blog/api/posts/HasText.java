package com.joshlong.blog.api.posts;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * the value, if present, must contain at least one non-whitespace character as judged by
 * {@link org.springframework.util.StringUtils#hasText(CharSequence)}, the same rule
 * {@link DefaultPostService} asserts. {@code null} is valid: pair it with
 * {@code @NotNull} for required fields.
 */
@Documented
@Constraint(validatedBy = HasTextValidator.class)
@Target({ ElementType.FIELD, ElementType.METHOD, ElementType.PARAMETER, ElementType.RECORD_COMPONENT })
@Retention(RetentionPolicy.RUNTIME)
public @interface HasText {

	String message() default "must not be blank";

	Class<?>[] groups() default {};

	Class<? extends Payload>[] payload() default {};

}
