package com.namehub.controller;

import com.namehub.controller.dto.RegistryResponses;
import com.namehub.mapper.RegistryResponseMapper;
import com.namehub.service.SubscriptionService;
import com.namehub.web.CallerPrincipal;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for subscriptions.
 */
@RestController
@RequestMapping("/api/subscriptions")
@RequiredArgsConstructor
public class SubscriptionController {

    private final SubscriptionService subscriptionService;
    private final RegistryResponseMapper registryResponseMapper;

    @GetMapping("/stats")
    public ResponseEntity<RegistryResponses.SubscriptionStats> getStats() {
        return ResponseEntity.ok(registryResponseMapper.toSubscriptionStats(subscriptionService.stats()));
    }

    @PostMapping("/pause")
    public ResponseEntity<RegistryResponses.CountResult> pauseAll(
            @RequestHeader(name = CallerPrincipal.HEADER, required = false) String principal
    ) {
        return ResponseEntity.ok(new RegistryResponses.CountResult(
                subscriptionService.pauseAll(CallerPrincipal.resolve(principal))
        ));
    }

    @GetMapping("/users/{user}")
    public ResponseEntity<RegistryResponses.SubscriptionDetail> getSubscription(@PathVariable String user) {
        return subscriptionService.getSubscription(user)
                .map(registryResponseMapper::toSubscriptionDetail)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/users/{user}/active")
    public ResponseEntity<RegistryResponses.BooleanResult> hasActiveSubscription(@PathVariable String user) {
        return ResponseEntity.ok(new RegistryResponses.BooleanResult(subscriptionService.hasActiveSubscription(user)));
    }
}
