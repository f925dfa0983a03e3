package io.clubone.reminder.service;

import java.util.List;

import io.clubone.reminder.vo.MembershipPaymentDTO;
import io.clubone.reminder.vo.MembershipPaymentRequest;

public interface MembershipPaymentService {
	MembershipPaymentDTO linkPayment(MembershipPaymentRequest request);
	List<MembershipPaymentDTO> getPaymentsForMembership(Long membershipId);
	void unlink(Long membershipPaymentId);
}
