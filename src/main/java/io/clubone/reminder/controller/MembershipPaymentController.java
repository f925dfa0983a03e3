package io.clubone.reminder.controller;

import java.util.List;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import io.clubone.reminder.service.MembershipPaymentService;
import io.clubone.reminder.vo.MembershipPaymentDTO;
import io.clubone.reminder.vo.MembershipPaymentRequest;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/membership-payments")
@RequiredArgsConstructor
@Tag(name = "Membership Payments", description = "Links between memberships and contributions")
public class MembershipPaymentController {

	private final MembershipPaymentService membershipPaymentService;

	@PostMapping
	@Operation(summary = "Link a contribution to a membership")
	public ResponseEntity<MembershipPaymentDTO> linkPayment(@Valid @RequestBody MembershipPaymentRequest request) {
		return ResponseEntity.status(HttpStatus.CREATED).body(membershipPaymentService.linkPayment(request));
	}

	@GetMapping
	@Operation(summary = "Payments linked to a membership")
	public List<MembershipPaymentDTO> getPayments(@RequestParam("membershipId") Long membershipId) {
		return membershipPaymentService.getPaymentsForMembership(membershipId);
	}

	@DeleteMapping("/{membershipPaymentId}")
	@Operation(summary = "Remove a membership payment link")
	public ResponseEntity<Void> unlink(@PathVariable("membershipPaymentId") Long membershipPaymentId) {
		membershipPaymentService.unlink(membershipPaymentId);
		return ResponseEntity.noContent().build();
	}
}
