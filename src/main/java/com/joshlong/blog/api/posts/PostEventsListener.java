package com.joshlong.blog.api.posts;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.modulith.events.ApplicationModuleListener;
import org.springframework.stereotype.Component;

@Component
class PostEventsListener {

	private final Logger log = LoggerFactory.getLogger(getClass());

	@ApplicationModuleListener
	void postCreated(PostCreatedEvent event) {
		this.log.info("post #{} was created by {}", event.post().id(), event.post().author().fullName());
	}

	@ApplicationModuleListener
	void postUpdated(PostUpdatedEvent event) {
		this.log.info("post #{} was updated", event.post().id());
	}

	@ApplicationModuleListener
	void postDeleted(PostDeletedEvent event) {
		this.log.info("post #{} was deleted", event.post().id());
	}

}
