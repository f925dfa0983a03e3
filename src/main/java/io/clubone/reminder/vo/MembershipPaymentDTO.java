package io.clubone.reminder.vo;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class MembershipPaymentDTO {
    private Long id;
    private Long membershipId;
    private Long contributionId;
}
