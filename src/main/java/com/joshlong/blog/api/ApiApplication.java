package com.joshlong.blog.api;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;

@EnableCaching
@EnableConfigurationProperties(ApiProperties.class)
@SpringBootApplication
public class ApiApplication {

	public static void main(String[] args) {
		SpringApplication.run(ApiApplication.class, args);
	}

	@Bean
	CaffeineCacheManager caffeineCacheManager(ApiProperties properties) {
		var cache = properties.posts().cache();
		var ccm = new CaffeineCacheManager();//
		var caffeine = Caffeine.newBuilder()//
			.maximumSize(cache.maxEntries())//
			.expireAfterWrite(cache.ttl())
			.recordStats();//
		ccm.setCaffeine(caffeine);
		return ccm;
	}

}
