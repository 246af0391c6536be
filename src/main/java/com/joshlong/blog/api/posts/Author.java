package com.joshlong.blog.api.posts;

import jakarta.validation.constraints.NotNull;

/**
 * the author of a {@link Post}. we keep the names apart in the database but clients only
 * ever see the {@link #fullName() full name}.
 */
public record Author(@NotNull @HasText String firstName, @NotNull @HasText String lastName) {

	public String fullName() {
		return this.firstName + " " + this.lastName;
	}

}
