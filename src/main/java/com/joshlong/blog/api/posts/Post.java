package com.joshlong.blog.api.posts;

import java.time.Instant;

public record Post(Long id, Author author, String title, String content, Instant created) {
}
