package com.joshlong.blog.api.posts;

public record PostDeletedEvent(Post post) {
}
