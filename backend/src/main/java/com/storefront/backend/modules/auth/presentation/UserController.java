package com.storefront.backend.modules.auth.presentation;

import com.storefront.backend.modules.auth.application.UserAccountService;
import com.storefront.backend.modules.auth.presentation.dto.CreateUserRequest;
import com.storefront.backend.modules.auth.presentation.dto.UserProfileResponse;

import io.swagger.v3.oas.annotations.Operation;
import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/users")
public class UserController {

    private final UserAccountService userAccountService;

    public UserController(UserAccountService userAccountService) {
        this.userAccountService = userAccountService;
    }

    @Operation(summary = "Register a buyer or seller account")
    @PostMapping
    public ResponseEntity<UserProfileResponse> createUser(@Valid @RequestBody CreateUserRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(userAccountService.createUser(request));
    }

    @Operation(summary = "Read the caller's own account")
    @GetMapping("/me")
    public ResponseEntity<UserProfileResponse> currentUser() {
        return ResponseEntity.ok(userAccountService.loadCurrentUser());
    }
}
