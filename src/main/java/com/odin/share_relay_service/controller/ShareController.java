package com.odin.share_relay_service.controller;

import com.odin.share_relay_service.constants.ApplicationConstants;
import com.odin.share_relay_service.dto.DeleteOutcome;
import com.odin.share_relay_service.dto.ShareSummaryPage;
import com.odin.share_relay_service.exception.ForbiddenException;
import com.odin.share_relay_service.exception.NotFoundException;
import com.odin.share_relay_service.exception.PersistenceException;
import com.odin.share_relay_service.service.IShareManagementService;
import com.odin.share_relay_service.utility.CorrelationIdUtil;
import com.odin.share_relay_service.utility.JwtUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.Optional;

/**
 * REST Controller for owners managing their shares.
 * 
 * Endpoints:
 * GET    /v1/shares?page=N        own shares, newest first
 * GET    /v1/shares/{token}/link  public link of an own share
 * DELETE /v1/shares/{token}       delete an own share
 * 
 * The principal is taken from the {@code Authorization: Bearer <JWT>} header.
 */
@Slf4j
@RestController
@RequestMapping(ApplicationConstants.API_VERSION + ApplicationConstants.SHARES)
public class ShareController {

    private final IShareManagementService shareManagementService;
    private final JwtUtil jwtUtil;

    public ShareController(@Qualifier("shareManagementServiceImpl") IShareManagementService shareManagementService,
                           JwtUtil jwtUtil) {
        this.shareManagementService = shareManagementService;
        this.jwtUtil = jwtUtil;
    }

    @GetMapping
    public ResponseEntity<?> listShares(
            @RequestHeader(value = ApplicationConstants.AUTHORIZATION_HEADER, required = false) String authorization,
            @RequestParam(value = "page", defaultValue = "1") int page) {

        Optional<String> principal = jwtUtil.resolveBearer(authorization);
        if (principal.isEmpty()) {
            return unauthorized();
        }
        CorrelationIdUtil.begin(principal.get());
        try {
            ShareSummaryPage summaries = shareManagementService.listShares(principal.get(), page);
            log.info("[SHARE-CONTROLLER] Listed page {} for owner={}", summaries.getPage(), principal.get());
            return ResponseEntity.ok(summaries);

        } catch (ForbiddenException e) {
            return ResponseEntity.status(HttpStatus.FORBIDDEN).body(Map.of("error", e.getMessage()));

        } catch (PersistenceException e) {
            log.error("[SHARE-CONTROLLER] Listing failed for owner={}", principal.get(), e);
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(Map.of("error", "Shares are temporarily unavailable"));
        } finally {
            CorrelationIdUtil.clear();
        }
    }

    @GetMapping("/{token}" + ApplicationConstants.LINK)
    public ResponseEntity<?> getLink(
            @RequestHeader(value = ApplicationConstants.AUTHORIZATION_HEADER, required = false) String authorization,
            @PathVariable("token") String token) {

        Optional<String> principal = jwtUtil.resolveBearer(authorization);
        if (principal.isEmpty()) {
            return unauthorized();
        }
        CorrelationIdUtil.begin(principal.get());
        try {
            return ResponseEntity.ok(Map.of("link", shareManagementService.getLink(token, principal.get())));

        } catch (NotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));

        } catch (ForbiddenException e) {
            return ResponseEntity.status(HttpStatus.FORBIDDEN).body(Map.of("error", e.getMessage()));

        } catch (PersistenceException e) {
            log.error("[SHARE-CONTROLLER] Link lookup failed token={}", token, e);
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(Map.of("error", "Shares are temporarily unavailable"));
        } finally {
            CorrelationIdUtil.clear();
        }
    }

    @DeleteMapping("/{token}")
    public ResponseEntity<?> deleteShare(
            @RequestHeader(value = ApplicationConstants.AUTHORIZATION_HEADER, required = false) String authorization,
            @PathVariable("token") String token) {

        Optional<String> principal = jwtUtil.resolveBearer(authorization);
        if (principal.isEmpty()) {
            return unauthorized();
        }
        CorrelationIdUtil.begin(principal.get());
        try {
            DeleteOutcome outcome = shareManagementService.deleteShare(token, principal.get());
            log.info("[SHARE-CONTROLLER] ✅ Deleted token={} warnings={}", token, outcome.getWarnings().size());
            return ResponseEntity.ok(outcome);

        } catch (NotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));

        } catch (ForbiddenException e) {
            log.warn("[SHARE-CONTROLLER] Delete of token={} refused for principal={}", token, principal.get());
            return ResponseEntity.status(HttpStatus.FORBIDDEN).body(Map.of("error", e.getMessage()));

        } catch (PersistenceException e) {
            log.error("[SHARE-CONTROLLER] ❌ Delete failed token={}", token, e);
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(Map.of("error", "Share could not be deleted, try again"));
        } finally {
            CorrelationIdUtil.clear();
        }
    }

    private ResponseEntity<?> unauthorized() {
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(Map.of("error", "Missing or invalid bearer token"));
    }
}
