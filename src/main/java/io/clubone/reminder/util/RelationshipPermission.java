package io.clubone.reminder.util;

/**
 * Values of relationship.is_permission_a_b / is_permission_b_a.
 */
public enum RelationshipPermission {
	NONE(0),
	EDIT(1),
	VIEW(2);

	private final int code;

	RelationshipPermission(int code) {
		this.code = code;
	}

	public int getCode() {
		return code;
	}
}
