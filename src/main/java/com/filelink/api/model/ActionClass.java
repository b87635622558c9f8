package com.filelink.api.model;

/**
 * Independent rate-limit buckets. Exceeding one never affects another.
 */
public enum ActionClass {
    MESSAGE,
    UPLOAD,
    FILE_DOWNLOAD,
    BROADCAST
}
