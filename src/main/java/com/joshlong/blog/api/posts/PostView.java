package com.joshlong.blog.api.posts;

import com.joshlong.blog.api.utils.DateUtils;

/**
 * what a {@link Post} looks like on the wire: the author is flattened to a single string
 * and the creation date is an ISO-8601 string.
 */
public record PostView(Long id, String author, String title, String content, String created) {

	public static PostView of(Post post) {
		return new PostView(post.id(), post.author().fullName(), post.title(), post.content(),
				DateUtils.isoString(post.created()));
	}

}
