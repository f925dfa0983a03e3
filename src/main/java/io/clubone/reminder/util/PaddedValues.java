package io.clubone.reminder.util;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import org.apache.commons.lang3.StringUtils;

/**
 * Codec for multi-valued columns. Values are stored padded with the
 * {@link #VALUE_SEPARATOR} on both ends ({@code \u00012\u00015\u0001}); older rows
 * may hold a plain comma separated list.
 */
public final class PaddedValues {

	public static final String VALUE_SEPARATOR = "\u0001";

	private PaddedValues() {
	}

	public static List<String> explode(String column) {
		if (StringUtils.isEmpty(column)) {
			return Collections.emptyList();
		}
		String delimiter = column.contains(VALUE_SEPARATOR) ? VALUE_SEPARATOR : ",";
		String trimmed = StringUtils.strip(column, delimiter);
		if (trimmed.isEmpty()) {
			return Collections.emptyList();
		}
		List<String> values = new ArrayList<>();
		for (String value : StringUtils.splitByWholeSeparatorPreserveAllTokens(trimmed, delimiter)) {
			values.add(",".equals(delimiter) ? value.trim() : value);
		}
		return Collections.unmodifiableList(values);
	}

	public static String implode(List<String> values) {
		if (values == null || values.isEmpty()) {
			return "";
		}
		return values.stream().collect(Collectors.joining(VALUE_SEPARATOR, VALUE_SEPARATOR, VALUE_SEPARATOR));
	}

	public static String implode(String... values) {
		return implode(Arrays.asList(values));
	}
}
