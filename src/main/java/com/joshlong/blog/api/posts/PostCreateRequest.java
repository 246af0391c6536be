package com.joshlong.blog.api.posts;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

record PostCreateRequest(@NotNull @Valid Author author, @NotNull @HasText String title,
		@NotNull @HasText String content) {

	PostDraft draft() {
		return new PostDraft(this.author, this.title, this.content);
	}

}
