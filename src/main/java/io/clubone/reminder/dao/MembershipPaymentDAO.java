package io.clubone.reminder.dao;

import java.util.List;
import java.util.Optional;

import io.clubone.reminder.vo.MembershipPaymentDTO;

public interface MembershipPaymentDAO {

	/** Inserts the link and returns it with the generated id. */
	MembershipPaymentDTO insert(Long membershipId, Long contributionId);

	Optional<MembershipPaymentDTO> findById(Long id);

	List<MembershipPaymentDTO> findByMembershipId(Long membershipId);

	List<MembershipPaymentDTO> findByContributionId(Long contributionId);

	int deleteById(Long id);

	int deleteByMembershipId(Long membershipId);

	int deleteByContributionId(Long contributionId);
}
