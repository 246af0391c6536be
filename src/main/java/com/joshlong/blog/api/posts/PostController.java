package com.joshlong.blog.api.posts;

import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseBody;

import java.net.URI;
import java.util.Collection;

@Controller
@ResponseBody
@RequestMapping(PostController.POSTS_URL)
class PostController {

	static final String POSTS_URL = "/posts";

	private final Logger log = LoggerFactory.getLogger(getClass());

	private final PostService service;

	PostController(PostService service) {
		this.service = service;
	}

	@GetMapping
	Collection<PostView> posts() {
		return this.service.getPosts().stream().map(PostView::of).toList();
	}

	@GetMapping("/{id}")
	PostView postById(@PathVariable Long id) {
		return PostView.of(this.service.getPostById(id));
	}

	@PostMapping
	ResponseEntity<PostView> createPost(@Valid @RequestBody PostCreateRequest request) {
		var draft = request.draft();
		var post = this.service.createPost(draft.author(), draft.title(), draft.content());
		this.log.info("created post #{} titled [{}]", post.id(), post.title());
		return ResponseEntity.created(URI.create(POSTS_URL + "/" + post.id())).body(PostView.of(post));
	}

	@PutMapping("/{id}")
	ResponseEntity<Void> updatePost(@PathVariable Long id, @Valid @RequestBody PostUpdateRequest request) {
		if (!id.equals(request.id())) {
			throw new PostIdMismatchException(id, request.id());
		}
		this.service.updatePost(id, request.author(), request.title(), request.content());
		this.log.info("updated post #{}", id);
		return ResponseEntity.noContent().build();
	}

	@DeleteMapping("/{id}")
	ResponseEntity<Void> deletePost(@PathVariable Long id) {
		this.service.deletePost(id);
		this.log.info("deleted post #{}", id);
		return ResponseEntity.noContent().build();
	}

}
