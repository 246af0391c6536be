package com.joshlong.blog.api.posts;

public record PostCreatedEvent(Post post) {
}
