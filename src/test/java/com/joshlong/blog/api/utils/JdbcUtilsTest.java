package com.joshlong.blog.api.utils;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

class JdbcUtilsTest {

	@Test
	void idIsFoundRegardlessOfCase() {
		Assertions.assertEquals(42L, JdbcUtils.getIdFromKeyHolder(keys(Map.of("ID", 42L))).longValue());
		Assertions.assertEquals(7L, JdbcUtils.getIdFromKeyHolder(keys(Map.of("id", 7, "title", "a title"))).longValue());
	}

	@Test
	void missingId() {
		var kh = keys(Map.of("title", "a title"));
		Assertions.assertThrows(IllegalStateException.class, () -> JdbcUtils.getIdFromKeyHolder(kh));
	}

	private static KeyHolder keys(Map<String, ?> row) {
		var keyList = new ArrayList<Map<String, Object>>();
		keyList.add(new HashMap<>(row));
		return new GeneratedKeyHolder(keyList);
	}

}
