package com.joshlong.blog.api.posts;

import org.springframework.jdbc.core.simple.JdbcClient;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;

/**
 * seeds and clears the {@code blog_post} table between tests.
 */
abstract class PostTestData {

	private static final List<String> FIRST_NAMES = List.of("Jane", "Josh", "Madhura", "Mark", "Olga", "Ria",
			"Stéphane", "Venkat");

	private static final List<String> LAST_NAMES = List.of("Doe", "Long", "Bhave", "Paluch", "Nicoll", "Stoyanchev",
			"Subramaniam", "Hoeller");

	static PostDraft draft() {
		var random = ThreadLocalRandom.current();
		var author = new Author(FIRST_NAMES.get(random.nextInt(FIRST_NAMES.size())),
				LAST_NAMES.get(random.nextInt(LAST_NAMES.size())));
		var suffix = UUID.randomUUID().toString();
		return new PostDraft(author, "a post about " + suffix,
				"""
						this is some sample content for %s.
						it spans more than one line.
						""".formatted(suffix));
	}

	static Collection<Post> seed(PostService postService, int count) {
		var drafts = new ArrayList<PostDraft>();
		for (var i = 0; i < count; i++)
			drafts.add(draft());
		return postService.createPosts(drafts);
	}

	static void clear(JdbcClient db) {
		db.sql("delete from blog_post").update();
	}

}
