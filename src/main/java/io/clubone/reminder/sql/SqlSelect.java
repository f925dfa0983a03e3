package io.clubone.reminder.sql;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Immutable description of a SELECT statement: base table, selected columns,
 * aliased joins, conjunctive where-conditions and named parameters.
 * <p>
 * Conditions reference parameters as {@code :name}, the syntax understood by
 * {@link org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate}.
 * Collection values expand into IN lists at execution time, so parameter values
 * never become part of the SQL text.
 * <p>
 * Instances are created through {@link #from(String)} or {@link #fragment()};
 * a fragment has no base table and only exists to be merged into another query.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class SqlSelect {

	private static final Pattern PARAM_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

	private final String from;
	private final List<String> selects;
	private final Map<String, String> joins;
	private final List<String> wheres;
	private final Map<String, Object> params;

	private SqlSelect(Builder builder) {
		this.from = builder.from;
		this.selects = Collections.unmodifiableList(new ArrayList<>(builder.selects));
		this.joins = Collections.unmodifiableMap(new LinkedHashMap<>(builder.joins));
		this.wheres = Collections.unmodifiableList(new ArrayList<>(builder.wheres));
		this.params = Collections.unmodifiableMap(new LinkedHashMap<>(builder.params));
	}

	public static Builder from(String table) {
		if (table == null || table.isBlank()) {
			throw new IllegalArgumentException("Base table is required");
		}
		Builder builder = new Builder();
		builder.from = table.trim();
		return builder;
	}

	public static Builder fragment() {
		return new Builder();
	}

	public boolean isFragment() {
		return from == null;
	}

	/**
	 * Starts a builder seeded with this query's content.
	 */
	public Builder toBuilder() {
		Builder builder = new Builder();
		builder.from = from;
		builder.merge(this);
		return builder;
	}

	public String toSql() {
		if (isFragment()) {
			throw new IllegalStateException("A fragment has no base table and cannot be rendered");
		}
		StringBuilder sql = new StringBuilder("SELECT ");
		sql.append(selects.isEmpty() ? "*" : String.join(", ", selects));
		sql.append("\nFROM ").append(from);
		joins.values().forEach(join -> sql.append('\n').append(join));
		if (!wheres.isEmpty()) {
			sql.append("\nWHERE (").append(String.join(")\n  AND (", wheres)).append(')');
		}
		return sql.toString();
	}

	public static final class Builder {

		private String from;
		private final List<String> selects = new ArrayList<>();
		private final Map<String, String> joins = new LinkedHashMap<>();
		private final List<String> wheres = new ArrayList<>();
		private final Map<String, Object> params = new LinkedHashMap<>();

		private Builder() {
		}

		public Builder select(String... expressions) {
			for (String expression : expressions) {
				if (expression != null && !expression.isBlank()) {
					selects.add(expression.trim());
				}
			}
			return this;
		}

		/**
		 * Adds a join clause under an alias. A later join with the same alias
		 * replaces the earlier one, keeping its position.
		 */
		public Builder join(String alias, String clause) {
			Objects.requireNonNull(alias, "alias");
			Objects.requireNonNull(clause, "clause");
			joins.put(alias, clause.trim());
			return this;
		}

		public Builder joins(Map<String, String> aliasedClauses) {
			aliasedClauses.forEach(this::join);
			return this;
		}

		public Builder where(String... conditions) {
			for (String condition : conditions) {
				if (condition != null && !condition.isBlank()) {
					wheres.add(condition.trim());
				}
			}
			return this;
		}

		public Builder param(String name, Object value) {
			if (name == null || !PARAM_NAME.matcher(name).matches()) {
				throw new IllegalArgumentException("Illegal parameter name: " + name);
			}
			params.put(name, value);
			return this;
		}

		public Builder params(Map<String, ?> values) {
			if (values != null) {
				values.forEach(this::param);
			}
			return this;
		}

		/**
		 * Appends the selects, joins, conditions and parameters of another query or
		 * fragment. Its base table is ignored.
		 */
		public Builder merge(SqlSelect other) {
			selects.addAll(other.selects);
			joins.putAll(other.joins);
			wheres.addAll(other.wheres);
			params.putAll(other.params);
			return this;
		}

		public SqlSelect build() {
			return new SqlSelect(this);
		}
	}
}
