package com.joshlong.blog.api.posts;

import com.joshlong.blog.api.utils.DateUtils;
import com.joshlong.blog.api.utils.JdbcUtils;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.Assert;
import org.springframework.util.StringUtils;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Optional;

@Transactional
class DefaultPostService implements PostService {

	static final String POSTS_CACHE = "posts";

	private final Logger log = LoggerFactory.getLogger(getClass());

	private final RowMapper<Post> postRowMapper = new PostRowMapper();

	private final JdbcClient db;

	private final ApplicationEventPublisher publisher;

	DefaultPostService(JdbcClient db, ApplicationEventPublisher publisher) {
		this.db = db;
		this.publisher = publisher;
		Assert.notNull(this.db, "the db is null");
	}

	@Override
	public Collection<Post> getPosts() {
		return this.db //
			.sql("select * from blog_post order by id") //
			.query(this.postRowMapper) //
			.list();
	}

	@Override
	@Cacheable(cacheNames = POSTS_CACHE, key = "#id")
	public Post getPostById(Long id) {
		return this.findPostById(id).orElseThrow(() -> new PostNotFoundException(id));
	}

	@Override
	public Optional<Post> getAnyPost() {
		return this.db //
			.sql("select * from blog_post order by id limit 1") //
			.query(this.postRowMapper) //
			.optional();
	}

	@Override
	public long count() {
		return this.db.sql("select count(*) from blog_post").query(Long.class).single();
	}

	@Override
	public Post createPost(Author author, String title, String content) {
		Assert.notNull(author, "the author is null");
		Assert.hasText(author.firstName(), "the author's first name is empty");
		Assert.hasText(author.lastName(), "the author's last name is empty");
		Assert.hasText(title, "the title is empty");
		Assert.hasText(content, "the content is empty");
		var gkh = new GeneratedKeyHolder();
		this.db.sql("""
				insert into blog_post(author_first_name, author_last_name, title, content, created)
				values (?,?,?,?,?)
				""") //
			.params(author.firstName(), author.lastName(), title, content, new Timestamp(System.currentTimeMillis()))
			.update(gkh, "id");
		var id = JdbcUtils.getIdFromKeyHolder(gkh).longValue();
		var post = this.findPostById(id).orElseThrow(() -> new PostNotFoundException(id));
		this.publisher.publishEvent(new PostCreatedEvent(post));
		this.log.debug("created post #{} by {}", post.id(), author.fullName());
		return post;
	}

	@Override
	public Collection<Post> createPosts(Collection<PostDraft> drafts) {
		var posts = new ArrayList<Post>(drafts.size());
		for (var draft : drafts)
			posts.add(this.createPost(draft.author(), draft.title(), draft.content()));
		return posts;
	}

	@Override
	@CacheEvict(cacheNames = POSTS_CACHE, key = "#id")
	public Post updatePost(Long id, @Nullable Author author, @Nullable String title, @Nullable String content) {
		var existing = this.findPostById(id).orElseThrow(() -> new PostNotFoundException(id));
		if (author != null) {
			Assert.hasText(author.firstName(), "the author's first name is empty");
			Assert.hasText(author.lastName(), "the author's last name is empty");
		}
		Assert.isTrue(title == null || StringUtils.hasText(title), "the title is empty");
		Assert.isTrue(content == null || StringUtils.hasText(content), "the content is empty");
		var newAuthor = author == null ? existing.author() : author;
		var newTitle = title == null ? existing.title() : title;
		var newContent = content == null ? existing.content() : content;
		this.db.sql("""
				update blog_post
				set author_first_name = ?, author_last_name = ?, title = ?, content = ?
				where id = ?
				""") //
			.params(newAuthor.firstName(), newAuthor.lastName(), newTitle, newContent, id) //
			.update();
		var updated = this.findPostById(id).orElseThrow(() -> new PostNotFoundException(id));
		this.publisher.publishEvent(new PostUpdatedEvent(updated));
		return updated;
	}

	@Override
	@CacheEvict(cacheNames = POSTS_CACHE, key = "#id")
	public void deletePost(Long id) {
		var post = this.findPostById(id).orElseThrow(() -> new PostNotFoundException(id));
		this.db.sql("delete from blog_post where id = ?").params(id).update();
		this.publisher.publishEvent(new PostDeletedEvent(post));
	}

	private Optional<Post> findPostById(Long id) {
		return this.db //
			.sql("select * from blog_post where id = ?") //
			.params(id) //
			.query(this.postRowMapper) //
			.optional();
	}

	private static class PostRowMapper implements RowMapper<Post> {

		@Override
		public Post mapRow(ResultSet rs, int rowNum) throws SQLException {
			var author = new Author(rs.getString("author_first_name"), rs.getString("author_last_name"));
			return new Post(rs.getLong("id"), author, rs.getString("title"), rs.getString("content"),
					DateUtils.forTimestamp(rs.getTimestamp("created")));
		}

	}

}
