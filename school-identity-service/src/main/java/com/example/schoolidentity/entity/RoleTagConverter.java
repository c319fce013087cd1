package com.example.schoolidentity.entity;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Persists {@link Role} by its tag so rows read the same as the credential claim.
 */
@Converter
public class RoleTagConverter implements AttributeConverter<Role, String> {

    @Override
    public String convertToDatabaseColumn(Role role) {
        return role != null ? role.tag() : null;
    }

    @Override
    public Role convertToEntityAttribute(String tag) {
        if (tag == null) {
            return null;
        }
        return Role.fromTag(tag)
                .orElseThrow(() -> new IllegalStateException("Unknown role tag in store: " + tag));
    }
}
