package com.odin.share_relay_service.utility;

import com.odin.share_relay_service.config.ShareRelayProperties;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds public share links and recognizes them in pasted text.
 */
@Component
public class ShareLinkFormatter {

    private final String linkBase;
    private final Pattern linkPattern;

    public ShareLinkFormatter(ShareRelayProperties properties) {
        this.linkBase = properties.getLinkBase();
        this.linkPattern = Pattern.compile(Pattern.quote(linkBase) + "([A-Za-z0-9_-]+)");
    }

    public String format(String shareToken) {
        return linkBase + shareToken;
    }

    public Optional<String> extractToken(String text) {
        if (text == null) {
            return Optional.empty();
        }
        Matcher matcher = linkPattern.matcher(text.trim());
        return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
    }
}
