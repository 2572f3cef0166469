package com.odin.share_relay_service.service;

/**
 * Decides whether a principal may upload and retrieve. Must not throw: a failed check
 * answers false.
 */
public interface MembershipGate {

    boolean isAuthorized(String principalId);
}
