package com.namehub.mapper;

import com.namehub.controller.dto.RegistryResponses;
import com.namehub.model.NameMarkdown;
import com.namehub.model.NameMetadata;
import com.namehub.model.NameRecord;
import com.namehub.model.Season;
import com.namehub.model.Subscription;
import com.namehub.model.VerifiedPayment;
import com.namehub.service.RegistrationService;
import com.namehub.service.SeasonService;
import com.namehub.service.SubscriptionService;
import com.namehub.service.SystemStateService;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;

@Component
public class RegistryResponseMapper {

    public RegistryResponses.SeasonDetail toSeasonDetail(Season season) {
        return new RegistryResponses.SeasonDetail(
                season.getId(),
                season.getName(),
                season.getStartTime(),
                season.getEndTime(),
                season.getMaxNames(),
                season.getMinNameLength(),
                season.getMaxNameLength(),
                season.getPrice(),
                season.getStatus(),
                season.getCreatedAt(),
                season.getUpdatedAt()
        );
    }

    public List<RegistryResponses.SeasonDetail> toSeasonDetails(Collection<Season> seasons) {
        return seasons.stream()
                .map(this::toSeasonDetail)
                .toList();
    }

    public RegistryResponses.ActiveSeasonInfo toActiveSeasonInfo(SeasonService.ActiveSeasonInfo info) {
        return new RegistryResponses.ActiveSeasonInfo(
                toSeasonDetail(info.season()),
                info.availableNames(),
                info.price()
        );
    }

    public RegistryResponses.NameRecordDetail toNameRecordDetail(NameRecord record) {
        return new RegistryResponses.NameRecordDetail(
                record.getName(),
                record.getAddress(),
                record.getAddressType(),
                record.getOwner(),
                record.getSeasonId(),
                record.getCreatedAt(),
                record.getUpdatedAt()
        );
    }

    public List<RegistryResponses.NameRecordDetail> toNameRecordDetails(Collection<NameRecord> records) {
        return records.stream()
                .map(this::toNameRecordDetail)
                .toList();
    }

    public RegistryResponses.RegistrationReceipt toRegistrationReceipt(RegistrationService.RegistrationReceipt receipt) {
        return new RegistryResponses.RegistrationReceipt(
                receipt.paymentId(),
                receipt.name(),
                receipt.owner(),
                receipt.seasonId(),
                receipt.amountPaid(),
                receipt.subscriptionEndTime()
        );
    }

    public RegistryResponses.VerifiedPaymentDetail toVerifiedPaymentDetail(VerifiedPayment payment) {
        return new RegistryResponses.VerifiedPaymentDetail(
                payment.getId(),
                payment.getPayer(),
                payment.getAmount(),
                payment.getBlockReference(),
                payment.getLedgerSender(),
                payment.getRegisteredName(),
                payment.getVerifiedAt()
        );
    }

    public List<RegistryResponses.VerifiedPaymentDetail> toVerifiedPaymentDetails(Collection<VerifiedPayment> payments) {
        return payments.stream()
                .map(this::toVerifiedPaymentDetail)
                .toList();
    }

    public RegistryResponses.SubscriptionDetail toSubscriptionDetail(Subscription subscription) {
        return new RegistryResponses.SubscriptionDetail(
                subscription.getSubscriber(),
                subscription.getRegisteredName(),
                subscription.getStartTime(),
                subscription.getEndTime(),
                subscription.getPaymentId(),
                subscription.isActive()
        );
    }

    public RegistryResponses.SubscriptionStats toSubscriptionStats(SubscriptionService.SubscriptionStats stats) {
        return new RegistryResponses.SubscriptionStats(
                stats.totalSubscriptions(),
                stats.activeSubscriptions(),
                stats.totalRevenue()
        );
    }

    public RegistryResponses.MetadataDetail toMetadataDetail(NameMetadata metadata) {
        return new RegistryResponses.MetadataDetail(
                metadata.getName(),
                metadata.getTitle(),
                metadata.getDescription(),
                metadata.getImage(),
                metadata.getCreatedAt(),
                metadata.getUpdatedAt()
        );
    }

    public RegistryResponses.MarkdownDetail toMarkdownDetail(NameMarkdown markdown) {
        return new RegistryResponses.MarkdownDetail(
                markdown.getName(),
                markdown.getContent(),
                markdown.getUpdatedAt()
        );
    }

    public RegistryResponses.SystemStateReport toSystemStateReport(SystemStateService.SystemStateReport report) {
        return new RegistryResponses.SystemStateReport(report.valid(), report.issues());
    }
}
