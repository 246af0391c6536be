package com.joshlong.blog.api.posts;

import jakarta.validation.Valid;
import org.jspecify.annotations.Nullable;

/**
 * only the fields that are present get updated. a field that is present may not be
 * blank.
 */
record PostUpdateRequest(@Nullable Long id, @Nullable @Valid Author author, @Nullable @HasText String title,
		@Nullable @HasText String content) {

}
