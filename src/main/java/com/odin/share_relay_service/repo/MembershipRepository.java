package com.odin.share_relay_service.repo;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Component;

import com.odin.share_relay_service.config.GateProperties;
import com.odin.share_relay_service.constants.ApplicationConstants;
import com.odin.share_relay_service.dto.MembershipQuery;
import com.odin.share_relay_service.dto.MembershipStatus;
import com.odin.share_relay_service.dto.ResponseDTO;
import com.odin.share_relay_service.exception.GateException;
import com.odin.share_relay_service.utility.Utility;

import lombok.extern.slf4j.Slf4j;

/**
 * Membership lookups against the membership service over REST.
 */
@Slf4j
@Component
public class MembershipRepository {

	@Autowired
	private GateProperties gateProperties;

	@Autowired
	private Utility utility;

	/**
	 * @return the membership, or null when the service answered without one
	 * @throws GateException when the call fails
	 */
	public MembershipStatus findStatus(String principalId, String groupId) {
		ResponseDTO response;
		try {
			response = utility.makeRestCall(
					gateProperties.getBaseUrl() + ApplicationConstants.MEMBERSHIP_STATUS,
					new MembershipQuery(principalId, groupId), HttpMethod.POST);
		} catch (RuntimeException e) {
			throw new GateException("Membership lookup failed for principal " + principalId, e);
		}

		if (response == null || !response.hasData()) {
			log.warn("[GATE] Membership service returned no data for principal={} group={}", principalId, groupId);
			return null;
		}
		return utility.getAnInstance(response.getData(), MembershipStatus.class);
	}

}
