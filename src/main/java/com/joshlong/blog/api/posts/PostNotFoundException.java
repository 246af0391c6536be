package com.joshlong.blog.api.posts;

public class PostNotFoundException extends RuntimeException {

	private final Long postId;

	PostNotFoundException(Long postId) {
		super("there is no post with id #" + postId);
		this.postId = postId;
	}

	public Long getPostId() {
		return this.postId;
	}

}
