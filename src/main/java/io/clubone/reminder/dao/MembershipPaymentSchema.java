package io.clubone.reminder.dao;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Schema of the membership_payment_link table: columns, foreign keys and
 * indices. Kept in sync with the DDL by hand.
 */
public final class MembershipPaymentSchema {

	public static final String TABLE_NAME = "membership_payment_link";

	public static final String ENTITY = "MembershipPayment";

	/** Changes to this table are written to the change log. */
	public static final boolean LOG_CHANGES = true;

	public static final List<Column> COLUMNS = List.of(
			new Column("id", "BIGINT", "Membership Payment ID", null, true, null),
			new Column("membership_id", "BIGINT", "Membership ID", "FK to Membership table", true,
					new Reference("membership_id", "membership", "id")),
			new Column("contribution_id", "BIGINT", "Contribution ID", "FK to contribution table.", false,
					new Reference("contribution_id", "contribution", "id")));

	public static final List<Index> INDICES = List.of(
			new Index("UI_contribution_membership", List.of("contribution_id", "membership_id"), true));

	private static final Map<String, Column> COLUMNS_BY_NAME = COLUMNS.stream()
			.collect(Collectors.toUnmodifiableMap(Column::name, Function.identity()));

	private MembershipPaymentSchema() {
	}

	public static String getEntityTitle(boolean plural) {
		return plural ? "Membership Payments" : "Membership Payment";
	}

	public static Optional<Column> getColumn(String name) {
		return Optional.ofNullable(COLUMNS_BY_NAME.get(name));
	}

	public static List<Reference> getReferences() {
		return COLUMNS.stream().map(Column::reference).filter(r -> r != null).toList();
	}

	/**
	 * Index signature in the form {@code table::unique::col1::col2}, used to compare
	 * the declared indices against the live database.
	 */
	public static String signature(Index index) {
		return TABLE_NAME + "::" + (index.unique() ? 1 : 0) + "::" + String.join("::", index.columns());
	}

	public record Column(String name, String sqlType, String title, String description, boolean required,
			Reference reference) {
	}

	public record Reference(String column, String targetTable, String targetColumn) {
	}

	public record Index(String name, List<String> columns, boolean unique) {
	}
}
