package com.namehub.service;

import com.namehub.model.AddressType;
import com.namehub.model.NameMetadata;
import com.namehub.model.NameRecord;
import com.namehub.repository.NameMarkdownRepository;
import com.namehub.repository.NameMetadataRepository;
import com.namehub.web.RegistryErrorCode;
import com.namehub.web.RegistryException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class NameContentServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC);
    private static final OffsetDateTime NOW = OffsetDateTime.now(CLOCK);

    @Mock
    private NameMetadataRepository nameMetadataRepository;

    @Mock
    private NameMarkdownRepository nameMarkdownRepository;

    @Mock
    private NameLedgerService nameLedgerService;

    @Mock
    private AccessControlService accessControlService;

    private NameContentService nameContentService;

    @BeforeEach
    void setUp() {
        RegistryMutationExecutor executor = new RegistryMutationExecutor(
                new TransactionTemplate(mock(PlatformTransactionManager.class))
        );
        nameContentService = new NameContentService(
                nameMetadataRepository,
                nameMarkdownRepository,
                nameLedgerService,
                accessControlService,
                executor,
                CLOCK
        );
    }

    @Test
    void saveMetadata_ownerWritesAndTouchesRecord() {
        NameRecord record = record();
        when(nameLedgerService.getNameRecord("alice")).thenReturn(record);
        when(nameMetadataRepository.findById("alice")).thenReturn(Optional.empty());
        when(nameMetadataRepository.save(any(NameMetadata.class))).thenAnswer(invocation -> invocation.getArgument(0));

        NameMetadata saved = nameContentService.saveMetadata("alice-principal", "alice", " Alice ", "about", null);

        assertEquals("alice", saved.getName());
        assertEquals("Alice", saved.getTitle());
        assertEquals(NOW, saved.getCreatedAt());
        verify(nameLedgerService).touch(record);
    }

    @Test
    void saveMetadata_strangerIsUnauthorized() {
        when(nameLedgerService.getNameRecord("alice")).thenReturn(record());
        when(accessControlService.isAdmin("mallory")).thenReturn(false);

        RegistryException ex = assertThrows(RegistryException.class,
                () -> nameContentService.saveMetadata("mallory", "alice", "Hijacked", null, null));

        assertEquals(RegistryErrorCode.UNAUTHORIZED, ex.getCode());
        verify(nameMetadataRepository, never()).save(any());
    }

    @Test
    void saveMarkdown_adminMayWriteForOwner() {
        NameRecord record = record();
        when(nameLedgerService.getNameRecord("alice")).thenReturn(record);
        when(accessControlService.isAdmin("root")).thenReturn(true);
        when(nameMarkdownRepository.findById("alice")).thenReturn(Optional.empty());
        when(nameMarkdownRepository.save(any())).thenAnswer(invocation -> invocation.getArgument(0));

        assertEquals("# Alice", nameContentService.saveMarkdown("root", "alice", "# Alice").getContent());
        verify(nameLedgerService).touch(record);
    }

    @Test
    void getMetadata_missingContentIsNotFound() {
        when(nameLedgerService.getNameRecord("alice")).thenReturn(record());
        when(nameMetadataRepository.findById("alice")).thenReturn(Optional.empty());

        RegistryException ex = assertThrows(RegistryException.class, () -> nameContentService.getMetadata("alice"));

        assertEquals(RegistryErrorCode.NAME_NOT_FOUND, ex.getCode());
        assertEquals("Metadata not found for name: alice", ex.getMessage());
    }

    private static NameRecord record() {
        NameRecord record = new NameRecord();
        record.setName("alice");
        record.setOwner("alice-principal");
        record.setAddress("target-1");
        record.setAddressType(AddressType.IDENTITY);
        record.setSeasonId(1L);
        record.setCreatedAt(NOW.minusDays(1));
        record.setUpdatedAt(NOW.minusDays(1));
        return record;
    }
}
