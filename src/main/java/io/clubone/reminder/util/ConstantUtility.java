package io.clubone.reminder.util;

public class ConstantUtility {

	public static final String MEMBERSHIP_TABLE = "membership";

	public static final String RELATIONSHIP_TABLE = "relationship";

	public static final String EXPIRED_STATUS = "Expired";

	public static final String MEMBERSHIP_PAYMENT_DUPLICATE = "MEMBERSHIP_PAYMENT_DUPLICATE";

	public static final String MEMBERSHIP_ID_REQUIRED = "membershipId is required";

	public static final String SCHEDULE_RESOURCE = "ActionSchedule";

	public static final String MAPPING_RESOURCE = "ActionMapping";

	public static final String MEMBERSHIP_PAYMENT_RESOURCE = "MembershipPayment";
}
