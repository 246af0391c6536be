package com.joshlong.blog.api.utils;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.sql.Timestamp;
import java.time.Instant;

class DateUtilsTest {

	@Test
	void isoStringAlwaysHasMillis() {
		Assertions.assertEquals("2024-03-01T10:15:30.000Z",
				DateUtils.isoString(Instant.parse("2024-03-01T10:15:30Z")));
		Assertions.assertEquals("2024-03-01T10:15:30.123Z",
				DateUtils.isoString(Instant.parse("2024-03-01T10:15:30.123Z")));
		Assertions.assertNull(DateUtils.isoString(null));
	}

	@Test
	void forTimestamp() {
		var now = System.currentTimeMillis();
		Assertions.assertEquals(Instant.ofEpochMilli(now), DateUtils.forTimestamp(new Timestamp(now)));
		Assertions.assertNull(DateUtils.forTimestamp(null));
	}

}
