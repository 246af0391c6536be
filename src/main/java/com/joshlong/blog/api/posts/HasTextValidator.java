package com.joshlong.blog.api.posts;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;
import org.springframework.util.StringUtils;

public class HasTextValidator implements ConstraintValidator<HasText, CharSequence> {

	@Override
	public boolean isValid(CharSequence value, ConstraintValidatorContext context) {
		return value == null || StringUtils.hasText(value);
	}

}
