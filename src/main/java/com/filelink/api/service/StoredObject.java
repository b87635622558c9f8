package com.filelink.api.service;

import lombok.Value;

/**
 * Bytes that made it to the storage volume.
 */
@Value
public class StoredObject {

    String storageName;

    long size;

    // SHA-256, hex
    String contentHash;
}
