package com.filelink.api.service;

import com.filelink.api.config.FileLinkProperties;
import com.filelink.api.exception.DenialReason;
import com.filelink.api.exception.FileLinkException;
import org.springframework.stereotype.Component;

import java.net.InetAddress;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.UnknownHostException;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Decides which URLs the service is willing to fetch.
 */
@Component
public class UrlPolicy {

    private static final Pattern IP_LITERAL = Pattern.compile("^[0-9.]+$|^\\[?[0-9a-fA-F]*:[0-9a-fA-F:.]*]?$");

    private final FileLinkProperties properties;

    public UrlPolicy(FileLinkProperties properties) {
        this.properties = properties;
    }

    public URI check(String url) {
        if (url == null || url.isBlank()) {
            throw invalid("URL is required");
        }
        String lower = url.trim().toLowerCase(Locale.ROOT);
        for (String pattern : properties.getFetch().getIllegalPatterns()) {
            if (lower.contains(pattern)) {
                throw invalid("URL matches a blocked pattern");
            }
        }

        URI uri;
        try {
            uri = new URI(url.trim());
        } catch (URISyntaxException e) {
            throw new FileLinkException(DenialReason.INVALID_URL, "Malformed URL", e);
        }
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            throw invalid("Only http and https URLs are accepted");
        }
        String host = uri.getHost();
        if (host == null || host.isBlank()) {
            throw invalid("URL has no host");
        }
        String normalizedHost = host.toLowerCase(Locale.ROOT);
        if (properties.getFetch().getBlockedHosts().contains(normalizedHost) || isInternalAddress(normalizedHost)) {
            throw invalid("Host is not allowed");
        }
        return uri;
    }

    // Only IP literals are checked here; names are not resolved
    private static boolean isInternalAddress(String host) {
        if (!IP_LITERAL.matcher(host).matches()) {
            return false;
        }
        try {
            InetAddress address = InetAddress.getByName(host.replace("[", "").replace("]", ""));
            return address.isLoopbackAddress() || address.isAnyLocalAddress()
                    || address.isLinkLocalAddress() || address.isSiteLocalAddress();
        } catch (UnknownHostException e) {
            return true;
        }
    }

    private static FileLinkException invalid(String message) {
        return new FileLinkException(DenialReason.INVALID_URL, message);
    }
}
