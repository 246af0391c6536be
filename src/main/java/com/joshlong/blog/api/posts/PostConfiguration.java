package com.joshlong.blog.api.posts;

import org.springframework.aot.hint.annotation.RegisterReflectionForBinding;
import org.springframework.context.annotation.Configuration;

@Configuration
@RegisterReflectionForBinding({ Post.class, Author.class, PostView.class, PostCreateRequest.class,
		PostUpdateRequest.class })
class PostConfiguration {

}
