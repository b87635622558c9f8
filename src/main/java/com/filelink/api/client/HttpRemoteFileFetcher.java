package com.filelink.api.client;

import com.filelink.api.exception.DenialReason;
import com.filelink.api.exception.FileLinkException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.net.URI;

@Slf4j
@Component
public class HttpRemoteFileFetcher implements RemoteFileFetcher {

    private final RestTemplate restTemplate;

    public HttpRemoteFileFetcher(RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    @Override
    public <T> T fetch(URI uri, ContentHandler<T> handler) {
        try {
            return restTemplate.execute(uri, HttpMethod.GET, null, response -> {
                MediaType type = response.getHeaders().getContentType();
                return handler.handle(
                        response.getBody(),
                        response.getHeaders().getContentLength(),
                        type != null ? type.toString() : null);
            });
        } catch (RestClientException e) {
            log.warn("Fetching {} failed: {}", uri.getHost(), e.getMessage());
            throw new FileLinkException(DenialReason.TRANSFER_ABORTED, "Could not fetch remote file", e);
        }
    }
}
