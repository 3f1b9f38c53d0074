package com.pandemies.backend.modules.auth.application;

/**
 * Where a login came from. Stored with the session for diagnostics only; never used to validate it.
 */
public record ClientMetadata(String sourceAddress, String clientDescriptor) {

    static final int SOURCE_ADDRESS_MAX_LENGTH = 45;
    static final int CLIENT_DESCRIPTOR_MAX_LENGTH = 512;

    private static final ClientMetadata EMPTY = new ClientMetadata(null, null);

    public static ClientMetadata of(String rawSourceAddress, String rawClientDescriptor) {
        return new ClientMetadata(
                normalize(rawSourceAddress, SOURCE_ADDRESS_MAX_LENGTH),
                normalize(rawClientDescriptor, CLIENT_DESCRIPTOR_MAX_LENGTH)
        );
    }

    public static ClientMetadata empty() {
        return EMPTY;
    }

    private static String normalize(String raw, int maxLength) {
        if (raw == null) {
            return null;
        }
        String trimmed = raw.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        if (trimmed.length() > maxLength) {
            return trimmed.substring(0, maxLength);
        }
        return trimmed;
    }
}
