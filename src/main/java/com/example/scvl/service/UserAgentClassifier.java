package com.example.scvl.service;

import cn.hutool.http.useragent.UserAgent;
import cn.hutool.http.useragent.UserAgentUtil;
import com.example.scvl.dto.ClientInfo;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Splits visitors into crawlers and humans and extracts device details for page view records.
 * Only self-identified crawlers and link-preview fetchers count as bots; scripted clients and
 * requests without a user agent are recorded like any other visit.
 */
@Component
public class UserAgentClassifier {

    private static final List<String> CRAWLER_MARKERS = List.of(
            "bot", "crawl", "spider", "spyder", "slurp", "facebookexternalhit", "embedly",
            "quora link preview", "vkshare", "w3c_validator", "whatsapp");

    // Crawlers advertise an info page, e.g. "(compatible; Foo/1.0; +http://foo.example/info)".
    private static final String SITE_MARKER = "+http";

    private static final String UNKNOWN = "Unknown";

    public ClientInfo classify(String userAgent) {
        if (userAgent == null || userAgent.isBlank()) {
            return new ClientInfo(false, false, UNKNOWN, UNKNOWN, UNKNOWN);
        }
        boolean bot = isCrawler(userAgent);
        UserAgent parsed = UserAgentUtil.parse(userAgent);
        if (parsed == null) {
            return new ClientInfo(bot, false, UNKNOWN, UNKNOWN, UNKNOWN);
        }
        return new ClientInfo(
                bot,
                parsed.isMobile(),
                parsed.getPlatform() == null ? UNKNOWN : parsed.getPlatform().getName(),
                parsed.getOs() == null ? UNKNOWN : parsed.getOs().getName(),
                parsed.getBrowser() == null ? UNKNOWN : parsed.getBrowser().getName());
    }

    static boolean isCrawler(String userAgent) {
        String lower = userAgent.toLowerCase(Locale.ROOT);
        return lower.contains(SITE_MARKER) || CRAWLER_MARKERS.stream().anyMatch(lower::contains);
    }
}
