package com.odin.share_relay_service.controller;

import com.odin.share_relay_service.dto.DeleteOutcome;
import com.odin.share_relay_service.dto.ShareSummaryPage;
import com.odin.share_relay_service.exception.ForbiddenException;
import com.odin.share_relay_service.exception.NotFoundException;
import com.odin.share_relay_service.exception.PersistenceException;
import com.odin.share_relay_service.service.IShareManagementService;
import com.odin.share_relay_service.utility.JwtUtil;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class ShareControllerTest {

    private static final String AUTH = "Bearer good-token";

    private IShareManagementService shareManagementService;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        shareManagementService = mock(IShareManagementService.class);
        JwtUtil jwtUtil = mock(JwtUtil.class);
        when(jwtUtil.resolveBearer(AUTH)).thenReturn(Optional.of("alice"));
        mockMvc = MockMvcBuilders.standaloneSetup(new ShareController(shareManagementService, jwtUtil)).build();
    }

    @Test
    void listingNeedsBearerToken() throws Exception {
        mockMvc.perform(get("/v1/shares")).andExpect(status().isUnauthorized());
        mockMvc.perform(get("/v1/shares").header("Authorization", "Bearer forged")).andExpect(status().isUnauthorized());

        verify(shareManagementService, never()).listShares(anyString(), anyInt());
    }

    @Test
    void listsOwnShares() throws Exception {
        when(shareManagementService.listShares("alice", 2)).thenReturn(ShareSummaryPage.builder()
                .page(2).totalPages(3).totalShares(25).shares(List.of()).build());

        mockMvc.perform(get("/v1/shares").param("page", "2").header("Authorization", AUTH))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.page").value(2))
                .andExpect(jsonPath("$.totalShares").value(25));
    }

    @Test
    void listingByNonMemberIsForbidden() throws Exception {
        when(shareManagementService.listShares("alice", 1)).thenThrow(new ForbiddenException("not a member"));

        mockMvc.perform(get("/v1/shares").header("Authorization", AUTH)).andExpect(status().isForbidden());
    }

    @Test
    void linkOfUnknownShareIsNotFound() throws Exception {
        when(shareManagementService.getLink("nope", "alice")).thenThrow(new NotFoundException("Share nope not found"));

        mockMvc.perform(get("/v1/shares/nope/link").header("Authorization", AUTH))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Share nope not found"));
    }

    @Test
    void returnsLinkOfOwnShare() throws Exception {
        when(shareManagementService.getLink("t1", "alice")).thenReturn("https://share.example.com/s/t1");

        mockMvc.perform(get("/v1/shares/t1/link").header("Authorization", AUTH))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.link").value("https://share.example.com/s/t1"));
    }

    @Test
    void deleteReportsRetractionWarnings() throws Exception {
        when(shareManagementService.deleteShare("t1", "alice"))
                .thenReturn(new DeleteOutcome("t1", 1, List.of("Could not retract item k2")));

        mockMvc.perform(delete("/v1/shares/t1").header("Authorization", AUTH))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.retractedItems").value(1))
                .andExpect(jsonPath("$.warnings[0]").value("Could not retract item k2"));
    }

    @Test
    void deletingOthersShareIsForbidden() throws Exception {
        when(shareManagementService.deleteShare("t1", "alice")).thenThrow(new ForbiddenException("not yours"));

        mockMvc.perform(delete("/v1/shares/t1").header("Authorization", AUTH)).andExpect(status().isForbidden());
    }

    @Test
    void storageOutageIsServiceUnavailable() throws Exception {
        when(shareManagementService.deleteShare("t1", "alice")).thenThrow(new PersistenceException("db down"));

        mockMvc.perform(delete("/v1/shares/t1").header("Authorization", AUTH)).andExpect(status().isServiceUnavailable());
    }
}
