package com.joshlong.blog.api;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

@ConfigurationProperties(prefix = "blog")
public record ApiProperties(@DefaultValue Posts posts) {

	public record Posts(@DefaultValue Cache cache) {

		public record Cache(@DefaultValue("1000") int maxEntries, @DefaultValue("10m") Duration ttl) {
		}

	}
}
