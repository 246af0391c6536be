package com.joshlong.blog.api.posts;

import org.jspecify.annotations.Nullable;

import java.util.Collection;
import java.util.Optional;

public interface PostService {

	Collection<Post> getPosts();

	/**
	 * @throws PostNotFoundException if there's no such post
	 */
	Post getPostById(Long id);

	/**
	 * returns some post, any post. handy for when you just need a valid id.
	 */
	Optional<Post> getAnyPost();

	long count();

	Post createPost(Author author, String title, String content);

	Collection<Post> createPosts(Collection<PostDraft> drafts);

	/**
	 * updates only the fields that aren't {@code null}. the id and the creation date never
	 * change.
	 * @throws PostNotFoundException if there's no such post
	 */
	Post updatePost(Long id, @Nullable Author author, @Nullable String title, @Nullable String content);

	/**
	 * @throws PostNotFoundException if there's no such post
	 */
	void deletePost(Long id);

}
