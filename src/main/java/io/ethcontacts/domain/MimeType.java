package io.ethcontacts.domain;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.Optional;

/**
 * Kinds of data row read from the contact store. The content-item type is the value persisted
 * in the row's mimetype column, matching the platform contacts provider.
 */
@Getter
@RequiredArgsConstructor
public enum MimeType {
    STRUCTURED_NAME("vnd.android.cursor.item/name"),
    PHONE("vnd.android.cursor.item/phone_v2"),
    EMAIL("vnd.android.cursor.item/email_v2"),
    PHOTO("vnd.android.cursor.item/photo");

    private final String contentItemType;

    /** Unknown content-item types are not an error: rows of other kinds are simply not ours. */
    public static Optional<MimeType> fromContentItemType(String contentItemType) {
        if (contentItemType == null) return Optional.empty();
        return Arrays.stream(values())
                .filter(m -> m.contentItemType.equals(contentItemType))
                .findFirst();
    }
}
