package io.ethcontacts.domain;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Single-valued fields that can be queried per contact on the point-lookup path.
 */
@Getter
@RequiredArgsConstructor
public enum ContactField {
    PHONE(MimeType.PHONE),
    EMAIL(MimeType.EMAIL);

    private final MimeType mimeType;
}
