package com.joshlong.blog.api.utils;

import java.sql.Timestamp;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

public abstract class DateUtils {

	/**
	 * ISO-8601 in UTC, always with millisecond precision (e.g.
	 * {@code 2024-03-01T10:15:30.123Z}).
	 */
	private static final DateTimeFormatter ISO_MILLIS = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'")
		.withZone(ZoneOffset.UTC);

	public static String isoString(Instant instant) {
		if (instant == null) {
			return null;
		}
		return ISO_MILLIS.format(instant);
	}

	public static Instant forTimestamp(Timestamp timestamp) {
		if (timestamp == null) {
			return null;
		}
		return timestamp.toInstant();
	}

}
