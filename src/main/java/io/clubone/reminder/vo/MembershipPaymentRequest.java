package io.clubone.reminder.vo;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class MembershipPaymentRequest {

	@NotNull
	@Positive
	private Long membershipId;

	@Positive
	private Long contributionId;
}
