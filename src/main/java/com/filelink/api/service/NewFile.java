package com.filelink.api.service;

import lombok.Builder;
import lombok.Value;

/**
 * Everything the registry needs to create a record for bytes already on the volume.
 */
@Value
@Builder
public class NewFile {

    long ownerId;

    String originalFilename;

    String contentType;

    long size;

    String storageName;

    String contentHash;

    String sourceUrl;

    ExpiryPolicy expiryPolicy;
}
