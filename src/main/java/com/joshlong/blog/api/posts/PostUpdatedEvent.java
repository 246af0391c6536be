package com.joshlong.blog.api.posts;

public record PostUpdatedEvent(Post post) {
}
