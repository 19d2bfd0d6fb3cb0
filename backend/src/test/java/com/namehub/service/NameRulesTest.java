package com.namehub.service;

import com.namehub.config.NamehubProperties;
import com.namehub.model.NameRecord;
import com.namehub.model.Season;
import com.namehub.web.RegistryErrorCode;
import com.namehub.web.RegistryException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;

class NameRulesTest {

    private final NameRules nameRules = new NameRules(new NamehubProperties());

    @Test
    void normalize_trimsAndLowercases() {
        assertEquals("alice", nameRules.normalize("  Alice "));
    }

    @Test
    void normalize_rejectsBlankNames() {
        RegistryException ex = assertThrows(RegistryException.class, () -> nameRules.normalize("   "));
        assertEquals(RegistryErrorCode.INVALID_NAME, ex.getCode());
    }

    @Test
    void requireValidFor_enforcesSeasonLengthBounds() {
        Season season = season(3, 5);

        assertDoesNotThrow(() -> nameRules.requireValidFor("abc", season));
        assertDoesNotThrow(() -> nameRules.requireValidFor("abcde", season));

        RegistryException tooShort = assertThrows(RegistryException.class,
                () -> nameRules.requireValidFor("ab", season));
        RegistryException tooLong = assertThrows(RegistryException.class,
                () -> nameRules.requireValidFor("abcdef", season));

        assertEquals(RegistryErrorCode.INVALID_NAME_LENGTH, tooShort.getCode());
        assertEquals(RegistryErrorCode.INVALID_NAME_LENGTH, tooLong.getCode());
    }

    @Test
    void requireValidSyntax_rejectsUnsupportedCharacters() {
        assertDoesNotThrow(() -> nameRules.requireValidSyntax("my-name-42"));

        for (String bad : new String[]{"-lead", "trail-", "has space", "under_score", "dot.name"}) {
            RegistryException ex = assertThrows(RegistryException.class, () -> nameRules.requireValidSyntax(bad));
            assertEquals(RegistryErrorCode.INVALID_NAME, ex.getCode(), bad);
        }
    }

    @Test
    void requireValidSyntax_capsLengthAtNameColumnWidth() {
        assertDoesNotThrow(() -> nameRules.requireValidSyntax("a".repeat(NameRecord.MAX_NAME_LENGTH)));

        RegistryException ex = assertThrows(RegistryException.class,
                () -> nameRules.requireValidSyntax("a".repeat(70)));

        assertEquals(RegistryErrorCode.INVALID_NAME_LENGTH, ex.getCode());
    }

    private static Season season(int min, int max) {
        Season season = new Season();
        season.setMinNameLength(min);
        season.setMaxNameLength(max);
        return season;
    }
}
