package com.anemone.api;

import com.anemone.account.ProfileInfo;
import com.anemone.account.ProfileService;
import com.anemone.account.RoleOverview;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

@RestController
@RequestMapping("/api/profile")
public class ProfileController {

    private final ProfileService profileService;

    public ProfileController(ProfileService profileService) {
        this.profileService = profileService;
    }

    @PostMapping("/init")
    public ProfileInfo init(@Valid @RequestBody ProfileInitRequest request) {
        return profileService.initProfile(request.roleId(), request.packageId());
    }

    @GetMapping
    public ProfileInfo get() {
        return profileService.getProfile()
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Profile not initialised."));
    }

    @GetMapping("/role")
    public RoleOverview role() {
        if (profileService.getProfile().isEmpty()) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Profile not initialised.");
        }
        return profileService.getRoleOverview()
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Role object not found on chain."));
    }
}
