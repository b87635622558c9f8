package com.filelink.api.service;

import lombok.Value;

import java.util.Map;

/**
 * Outcome of one broadcast. {@code failures} maps recipient id to the reason.
 */
@Value
public class BroadcastReport {

    int recipients;

    int delivered;

    Map<Long, String> failures;
}
