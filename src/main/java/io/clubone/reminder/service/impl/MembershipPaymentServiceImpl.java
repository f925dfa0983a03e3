package io.clubone.reminder.service.impl;

import java.util.List;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import io.clubone.reminder.dao.MembershipPaymentDAO;
import io.clubone.reminder.exception.NotValidException;
import io.clubone.reminder.exception.ResourceNotFoundException;
import io.clubone.reminder.service.MembershipPaymentService;
import io.clubone.reminder.util.ConstantUtility;
import io.clubone.reminder.vo.MembershipPaymentDTO;
import io.clubone.reminder.vo.MembershipPaymentRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Service
@RequiredArgsConstructor
@Slf4j
public class MembershipPaymentServiceImpl implements MembershipPaymentService {

	private final MembershipPaymentDAO membershipPaymentDAO;

	@Override
	@Transactional
	public MembershipPaymentDTO linkPayment(MembershipPaymentRequest request) {
		if (request == null || request.getMembershipId() == null) {
			throw new NotValidException(ConstantUtility.MEMBERSHIP_ID_REQUIRED);
		}
		MembershipPaymentDTO link = membershipPaymentDAO.insert(request.getMembershipId(), request.getContributionId());
		log.info("Linked contribution {} to membership {} as membership payment {}", link.getContributionId(),
				link.getMembershipId(), link.getId());
		return link;
	}

	@Override
	public List<MembershipPaymentDTO> getPaymentsForMembership(Long membershipId) {
		return membershipPaymentDAO.findByMembershipId(membershipId);
	}

	@Override
	@Transactional
	public void unlink(Long membershipPaymentId) {
		if (membershipPaymentDAO.deleteById(membershipPaymentId) == 0) {
			throw new ResourceNotFoundException(ConstantUtility.MEMBERSHIP_PAYMENT_RESOURCE, "id", membershipPaymentId);
		}
		log.info("Removed membership payment {}", membershipPaymentId);
	}
}
