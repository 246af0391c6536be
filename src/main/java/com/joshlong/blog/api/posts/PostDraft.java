package com.joshlong.blog.api.posts;

/**
 * the fields a client supplies for a {@link Post} that doesn't exist yet.
 */
public record PostDraft(Author author, String title, String content) {
}
