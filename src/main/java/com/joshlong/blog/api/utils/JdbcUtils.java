package com.joshlong.blog.api.utils;

import org.springframework.jdbc.support.KeyHolder;
import org.springframework.util.Assert;

import java.util.Objects;

public abstract class JdbcUtils {

	/*
	 * PostgreSQL hands back every column of the inserted row while H2 hands back only
	 * the identity, and the case of the column name varies between the two, so we look
	 * for 'id' by hand.
	 */
	public static Number getIdFromKeyHolder(KeyHolder kh) {
		var keys = Objects.requireNonNull(kh.getKeys(), "there are no generated keys");
		for (var entry : keys.entrySet()) {
			if ("id".equalsIgnoreCase(entry.getKey())) {
				Assert.isInstanceOf(Number.class, entry.getValue(), "the generated id is not a number");
				return (Number) entry.getValue();
			}
		}
		throw new IllegalStateException("there is no generated 'id' column in " + keys.keySet());
	}

}
