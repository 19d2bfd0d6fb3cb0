package com.namehub.controller.dto;

import com.namehub.model.AddressType;
import com.namehub.model.SeasonStatus;
import com.namehub.model.UserRole;

import java.time.OffsetDateTime;
import java.util.List;

public final class RegistryResponses {

    private RegistryResponses() {
    }

    public record SeasonDetail(
            Long id,
            String name,
            OffsetDateTime startTime,
            OffsetDateTime endTime,
            Integer maxNames,
            Integer minNameLength,
            Integer maxNameLength,
            Long price,
            SeasonStatus status,
            OffsetDateTime createdAt,
            OffsetDateTime updatedAt
    ) {
    }

    public record ActiveSeasonInfo(
            SeasonDetail season,
            long availableNames,
            long price
    ) {
    }

    public record NameRecordDetail(
            String name,
            String address,
            AddressType addressType,
            String owner,
            Long seasonId,
            OffsetDateTime createdAt,
            OffsetDateTime updatedAt
    ) {
    }

    public record RegistrationReceipt(
            Long paymentId,
            String name,
            String owner,
            Long seasonId,
            Long amountPaid,
            OffsetDateTime subscriptionEndTime
    ) {
    }

    public record VerifiedPaymentDetail(
            Long id,
            String payer,
            Long amount,
            String blockReference,
            String ledgerSender,
            String registeredName,
            OffsetDateTime verifiedAt
    ) {
    }

    public record SubscriptionDetail(
            String user,
            String registeredName,
            OffsetDateTime startTime,
            OffsetDateTime endTime,
            Long paymentId,
            boolean active
    ) {
    }

    public record SubscriptionStats(
            long totalSubscriptions,
            long activeSubscriptions,
            long totalRevenue
    ) {
    }

    public record RoleResponse(
            String principal,
            UserRole role
    ) {
    }

    public record AdminList(
            long count,
            List<String> admins
    ) {
    }

    public record BooleanResult(
            boolean value
    ) {
    }

    public record CountResult(
            long count
    ) {
    }

    public record PaymentRecipient(
            String recipientAddress
    ) {
    }

    public record MetadataDetail(
            String name,
            String title,
            String description,
            String image,
            OffsetDateTime createdAt,
            OffsetDateTime updatedAt
    ) {
    }

    public record MarkdownDetail(
            String name,
            String content,
            OffsetDateTime updatedAt
    ) {
    }

    public record SystemStateReport(
            boolean valid,
            List<String> issues
    ) {
    }
}
