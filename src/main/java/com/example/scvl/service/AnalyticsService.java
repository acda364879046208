package com.example.scvl.service;

import com.example.scvl.config.AsyncConfig;
import com.example.scvl.model.PageView;
import com.example.scvl.store.PageStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Writes page views off the request thread. Failures are logged and dropped, never retried.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnalyticsService {

    private final PageStore pageStore;

    @Async(AsyncConfig.PAGE_VIEW_EXECUTOR)
    public void recordPageView(PageView view) {
        try {
            pageStore.createPageView(view);
        } catch (RuntimeException e) {
            log.warn("Dropping page view for slug {}: {}", view.getSlug(), e.getMessage());
        }
    }
}
