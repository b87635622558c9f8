package com.filelink.api.client;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;

/**
 * Streams a remote resource into a handler. The body is only valid inside the handler.
 */
public interface RemoteFileFetcher {

    <T> T fetch(URI uri, ContentHandler<T> handler);

    @FunctionalInterface
    interface ContentHandler<T> {
        T handle(InputStream body, long contentLength, String contentType) throws IOException;
    }
}
