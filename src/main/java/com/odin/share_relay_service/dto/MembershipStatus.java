package com.odin.share_relay_service.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Membership of a principal in the gating group, as reported by the membership service.
 * {@code status} is one of MEMBER, ADMINISTRATOR, CREATOR, RESTRICTED, LEFT, BANNED, KICKED.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class MembershipStatus {

	private String principalId;
	private String groupId;
	private String status;
}
