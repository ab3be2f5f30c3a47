package com.anemone.api;

import com.anemone.account.WalletInfo;
import com.anemone.account.WalletService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.OffsetDateTime;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(WalletController.class)
class WalletControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private WalletService walletService;

    @Test
    void testRegister() throws Exception {
        when(walletService.registerWallet("0xabc123"))
                .thenReturn(new WalletInfo("0xabc123", OffsetDateTime.parse("2026-01-01T00:00:00Z")));

        mockMvc.perform(post("/api/wallet")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"address\": \"0xabc123\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.address").value("0xabc123"));
    }

    @Test
    void testRegister_InvalidAddress() throws Exception {
        mockMvc.perform(post("/api/wallet")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"address\": \"not-an-address\"}"))
                .andExpect(status().isBadRequest());

        verify(walletService, never()).registerWallet(anyString());
    }

    @Test
    void testGet() throws Exception {
        when(walletService.getWalletInfo())
                .thenReturn(Optional.of(new WalletInfo("0xabc", OffsetDateTime.parse("2026-01-01T00:00:00Z"))));

        mockMvc.perform(get("/api/wallet"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.address").value("0xabc"));
    }

    @Test
    void testGet_NoWallet() throws Exception {
        when(walletService.getWalletInfo()).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/wallet"))
                .andExpect(status().isNotFound());
    }
}
