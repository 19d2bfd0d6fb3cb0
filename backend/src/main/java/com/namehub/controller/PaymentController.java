package com.namehub.controller;

import com.namehub.config.NamehubProperties;
import com.namehub.controller.dto.RegistryRequests;
import com.namehub.controller.dto.RegistryResponses;
import com.namehub.mapper.RegistryResponseMapper;
import com.namehub.service.PaymentVerificationService;
import com.namehub.web.CallerPrincipal;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/payments")
@RequiredArgsConstructor
public class PaymentController {

    private final PaymentVerificationService paymentVerificationService;
    private final RegistryResponseMapper registryResponseMapper;
    private final NamehubProperties namehubProperties;

    @GetMapping("/recipient")
    public ResponseEntity<RegistryResponses.PaymentRecipient> getRecipient() {
        return ResponseEntity.ok(new RegistryResponses.PaymentRecipient(
                namehubProperties.getPayment().getRecipientAddress()
        ));
    }

    /**
     * Verified payments made by the caller, newest first.
     */
    @GetMapping("/history")
    public ResponseEntity<List<RegistryResponses.VerifiedPaymentDetail>> getPaymentHistory(
            @RequestHeader(name = CallerPrincipal.HEADER, required = false) String principal
    ) {
        return ResponseEntity.ok(registryResponseMapper.toVerifiedPaymentDetails(
                paymentVerificationService.paymentHistory(CallerPrincipal.resolve(principal))
        ));
    }

    @GetMapping("/references/{blockReference}")
    public ResponseEntity<RegistryResponses.VerifiedPaymentDetail> getPaymentByReference(
            @PathVariable String blockReference
    ) {
        return paymentVerificationService.findByReference(blockReference)
                .map(registryResponseMapper::toVerifiedPaymentDetail)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/references/{blockReference}/used")
    public ResponseEntity<RegistryResponses.BooleanResult> isReferenceUsed(@PathVariable String blockReference) {
        return ResponseEntity.ok(new RegistryResponses.BooleanResult(
                paymentVerificationService.isReferenceUsed(blockReference)
        ));
    }

    @PostMapping("/verify")
    public ResponseEntity<RegistryResponses.BooleanResult> verifyPayment(
            @RequestHeader(name = CallerPrincipal.HEADER, required = false) String principal,
            @Valid @RequestBody RegistryRequests.VerifyPaymentRequest request
    ) {
        return ResponseEntity.ok(new RegistryResponses.BooleanResult(paymentVerificationService.verifyAsAdmin(
                CallerPrincipal.resolve(principal),
                request.blockReference(),
                request.amount(),
                request.recipient()
        )));
    }
}
