package com.namehub.service;

import com.namehub.config.NamehubProperties;
import com.namehub.model.NameRecord;
import com.namehub.model.Season;
import com.namehub.web.RegistryException;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonical form and syntax of registrable names.
 */
@Component
public class NameRules {

    private final Pattern allowedPattern;

    public NameRules(NamehubProperties namehubProperties) {
        this.allowedPattern = Pattern.compile(namehubProperties.getName().getAllowedPattern());
    }

    public String normalize(String name) {
        if (name == null || name.isBlank()) {
            throw RegistryException.invalidName("Name is required");
        }
        return name.trim().toLowerCase(Locale.ROOT);
    }

    public void requireValidFor(String normalizedName, Season season) {
        int length = normalizedName.codePointCount(0, normalizedName.length());
        if (length < season.getMinNameLength() || length > season.getMaxNameLength()) {
            throw RegistryException.invalidNameLength(season.getMinNameLength(), season.getMaxNameLength());
        }
        requireValidSyntax(normalizedName);
    }

    public void requireValidSyntax(String normalizedName) {
        if (normalizedName.codePointCount(0, normalizedName.length()) > NameRecord.MAX_NAME_LENGTH) {
            throw RegistryException.invalidNameLength(1, NameRecord.MAX_NAME_LENGTH);
        }
        if (!allowedPattern.matcher(normalizedName).matches()) {
            throw RegistryException.invalidName(
                    "Name may only contain lowercase letters, digits and inner hyphens: " + normalizedName
            );
        }
    }
}
