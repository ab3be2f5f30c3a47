package com.anemone.api;

import com.anemone.account.WalletInfo;
import com.anemone.account.WalletService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

@RestController
@RequestMapping("/api/wallet")
public class WalletController {

    private final WalletService walletService;

    public WalletController(WalletService walletService) {
        this.walletService = walletService;
    }

    @GetMapping
    public WalletInfo get() {
        return walletService.getWalletInfo()
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "No wallet registered."));
    }

    @PostMapping
    public WalletInfo register(@Valid @RequestBody WalletRequest request) {
        try {
            return walletService.registerWallet(request.address());
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage());
        }
    }
}
