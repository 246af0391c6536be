package com.joshlong.blog.api.posts;

public class PostIdMismatchException extends RuntimeException {

	PostIdMismatchException(Long pathId, Long bodyId) {
		super("the request path id [" + pathId + "] and the request body id [" + bodyId + "] must match");
	}

}
