package com.example.scvl.service;

import com.example.scvl.cache.PageCache;
import com.example.scvl.dto.ClientInfo;
import com.example.scvl.dto.ClientRequest;
import com.example.scvl.dto.RedirectDecision;
import com.example.scvl.exception.NotFoundException;
import com.example.scvl.model.Ogp;
import com.example.scvl.model.Page;
import com.example.scvl.model.PageView;
import com.example.scvl.store.PageStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Cache-aside lookup behind {@code GET /{slug}}.
 *
 * <p>The URL is read from the cache and, on a miss, from the store, which then repopulates the
 * cache. Only the OGP id lives in the cache; the OGP record itself is fetched from the store when
 * the cached id is nonzero. Page views of non-crawler visitors are handed to
 * {@link AnalyticsService} and never affect the response.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RedirectService {

    private final PageCache pageCache;
    private final PageStore pageStore;
    private final AnalyticsService analyticsService;
    private final UserAgentClassifier userAgentClassifier;

    public RedirectDecision resolve(String slug, ClientRequest client) {
        String url;
        Ogp ogp = null;
        long ogpId;

        Optional<String> cached = pageCache.getUrl(slug);
        if (cached.isPresent()) {
            url = cached.get();
            ogpId = pageCache.getOgpId(slug);
        } else {
            Page page = pageStore.findPageBySlug(slug)
                    .orElseThrow(() -> new NotFoundException("The URL you are looking for is not found."));
            url = page.getUrl();
            pageCache.setUrl(slug, url);
            ogp = pageStore.findOgpByPageId(page.getId()).orElse(null);
            if (ogp != null) {
                pageCache.setOgpId(slug, ogp.getId());
            }
            ogpId = 0L;
        }

        if (ogp == null && ogpId != 0L) {
            ogp = pageStore.findOgpById(ogpId).orElse(null);
            if (ogp == null) {
                log.debug("Cached OGP id {} for slug {} no longer exists", ogpId, slug);
            }
        }

        recordVisit(slug, client);
        return RedirectDecision.of(url, ogp);
    }

    private void recordVisit(String slug, ClientRequest client) {
        try {
            ClientInfo info = userAgentClassifier.classify(client.getUserAgent());
            if (info.isBot()) {
                return;
            }
            PageView view = new PageView();
            view.setSlug(slug);
            view.setRealIp(client.getRealIp());
            view.setReferer(client.getReferer());
            view.setMobile(info.isMobile());
            view.setPlatform(info.getPlatform());
            view.setOs(info.getOs());
            view.setBrowserName(info.getBrowserName());
            analyticsService.recordPageView(view);
        } catch (RuntimeException e) {
            log.warn("Failed to submit page view for slug {}: {}", slug, e.getMessage());
        }
    }
}
