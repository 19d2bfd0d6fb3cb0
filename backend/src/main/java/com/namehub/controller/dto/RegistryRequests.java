package com.namehub.controller.dto;

import com.namehub.model.AddressType;
import com.namehub.model.NameRecord;
import com.namehub.model.UserRole;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.time.OffsetDateTime;

public final class RegistryRequests {

    private RegistryRequests() {
    }

    public record CreateSeasonRequest(
            @NotBlank(message = "name is required")
            @Size(max = 128, message = "name must be at most 128 characters")
            String name,

            @NotNull(message = "startTime is required")
            OffsetDateTime startTime,

            @NotNull(message = "endTime is required")
            OffsetDateTime endTime,

            @NotNull(message = "maxNames is required")
            @Min(value = 1, message = "maxNames must be at least 1")
            Integer maxNames,

            @NotNull(message = "minNameLength is required")
            @Min(value = 1, message = "minNameLength must be at least 1")
            Integer minNameLength,

            @NotNull(message = "maxNameLength is required")
            @Min(value = 1, message = "maxNameLength must be at least 1")
            @Max(value = NameRecord.MAX_NAME_LENGTH, message = "maxNameLength must be at most 64")
            Integer maxNameLength,

            @NotNull(message = "price is required")
            @Positive(message = "price must be positive")
            Long price
    ) {
        @AssertTrue(message = "startTime must be before endTime")
        public boolean isWindowOrdered() {
            if (startTime == null || endTime == null) {
                return true;
            }
            return startTime.isBefore(endTime);
        }
    }

    public record RegisterNameRequest(
            @NotBlank(message = "name is required")
            @Size(max = NameRecord.MAX_NAME_LENGTH, message = "name must be at most 64 characters")
            String name,

            @NotBlank(message = "address is required")
            @Size(max = 128, message = "address must be at most 128 characters")
            String address,

            @NotNull(message = "addressType is required")
            AddressType addressType,

            @NotNull(message = "seasonId is required")
            Long seasonId,

            @NotBlank(message = "blockReference is required")
            @Size(max = 128, message = "blockReference must be at most 128 characters")
            String blockReference
    ) {
    }

    public record AdminAddNameRequest(
            @NotBlank(message = "name is required")
            @Size(max = NameRecord.MAX_NAME_LENGTH, message = "name must be at most 64 characters")
            String name,

            @NotBlank(message = "address is required")
            @Size(max = 128, message = "address must be at most 128 characters")
            String address,

            @NotNull(message = "addressType is required")
            AddressType addressType,

            @NotBlank(message = "owner is required")
            String owner
    ) {
    }

    public record AssignRoleRequest(
            @NotNull(message = "role is required")
            UserRole role
    ) {
    }

    public record VerifyPaymentRequest(
            @NotBlank(message = "blockReference is required")
            String blockReference,

            @NotNull(message = "amount is required")
            @Positive(message = "amount must be positive")
            Long amount,

            @NotBlank(message = "recipient is required")
            String recipient
    ) {
    }

    public record SaveMetadataRequest(
            @NotBlank(message = "title is required")
            @Size(max = 256, message = "title must be at most 256 characters")
            String title,

            @Size(max = 4000, message = "description must be at most 4000 characters")
            String description,

            @Size(max = 1024, message = "image must be at most 1024 characters")
            String image
    ) {
    }

    public record SaveMarkdownRequest(
            @NotNull(message = "content is required")
            @Size(max = 20000, message = "content must be at most 20000 characters")
            String content
    ) {
    }
}
