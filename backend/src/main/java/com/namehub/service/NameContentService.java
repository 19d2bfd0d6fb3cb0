package com.namehub.service;

import com.namehub.model.NameMarkdown;
import com.namehub.model.NameMetadata;
import com.namehub.model.NameRecord;
import com.namehub.repository.NameMarkdownRepository;
import com.namehub.repository.NameMetadataRepository;
import com.namehub.web.RegistryErrorCode;
import com.namehub.web.RegistryException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;

/**
 * Profile metadata and markdown attached to a name. Only the owner or an admin may write.
 */
@Service
@RequiredArgsConstructor
public class NameContentService {

    private static final Logger log = LoggerFactory.getLogger(NameContentService.class);

    private final NameMetadataRepository nameMetadataRepository;
    private final NameMarkdownRepository nameMarkdownRepository;
    private final NameLedgerService nameLedgerService;
    private final AccessControlService accessControlService;
    private final RegistryMutationExecutor registryMutationExecutor;
    private final Clock clock;

    public NameMetadata saveMetadata(String caller, String name, String title, String description, String image) {
        if (title == null || title.isBlank()) {
            throw RegistryException.invalidRange("Metadata title is required");
        }
        return registryMutationExecutor.execute(() -> {
            NameRecord record = requireWritable(caller, name);
            OffsetDateTime now = OffsetDateTime.now(clock);
            NameMetadata metadata = nameMetadataRepository.findById(record.getName()).orElseGet(() -> {
                NameMetadata created = new NameMetadata();
                created.setName(record.getName());
                created.setCreatedAt(now);
                return created;
            });
            metadata.setTitle(title.trim());
            metadata.setDescription(description);
            metadata.setImage(image);
            metadata.setUpdatedAt(now);
            NameMetadata saved = nameMetadataRepository.save(metadata);
            nameLedgerService.touch(record);
            log.debug("Metadata of '{}' updated by {}", record.getName(), caller);
            return saved;
        });
    }

    public NameMetadata getMetadata(String name) {
        NameRecord record = nameLedgerService.getNameRecord(name);
        return nameMetadataRepository.findById(record.getName())
                .orElseThrow(() -> new RegistryException(
                        RegistryErrorCode.NAME_NOT_FOUND,
                        "Metadata not found for name: " + record.getName()
                ));
    }

    public NameMarkdown saveMarkdown(String caller, String name, String content) {
        if (content == null) {
            throw RegistryException.invalidRange("Markdown content is required");
        }
        return registryMutationExecutor.execute(() -> {
            NameRecord record = requireWritable(caller, name);
            NameMarkdown markdown = nameMarkdownRepository.findById(record.getName()).orElseGet(() -> {
                NameMarkdown created = new NameMarkdown();
                created.setName(record.getName());
                return created;
            });
            markdown.setContent(content);
            markdown.setUpdatedAt(OffsetDateTime.now(clock));
            NameMarkdown saved = nameMarkdownRepository.save(markdown);
            nameLedgerService.touch(record);
            log.debug("Markdown of '{}' updated by {}", record.getName(), caller);
            return saved;
        });
    }

    public NameMarkdown getMarkdown(String name) {
        NameRecord record = nameLedgerService.getNameRecord(name);
        return nameMarkdownRepository.findById(record.getName())
                .orElseThrow(() -> new RegistryException(
                        RegistryErrorCode.NAME_NOT_FOUND,
                        "Markdown not found for name: " + record.getName()
                ));
    }

    private NameRecord requireWritable(String caller, String name) {
        NameRecord record = nameLedgerService.getNameRecord(name);
        if (!record.getOwner().equals(caller) && !accessControlService.isAdmin(caller)) {
            throw RegistryException.unauthorized("Only the owner or an admin may edit " + record.getName());
        }
        return record;
    }
}
