package com.joshlong.blog.api.posts;

import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.simple.JdbcClient;

@Configuration
class DefaultPostServiceConfiguration {

	@Bean
	DefaultPostService defaultPostService(JdbcClient db, ApplicationEventPublisher publisher) {
		return new DefaultPostService(db, publisher);
	}

}
