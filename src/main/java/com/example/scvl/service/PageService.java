package com.example.scvl.service;

import com.example.scvl.cache.PageCache;
import com.example.scvl.dto.PageRequest;
import com.example.scvl.exception.ForbiddenException;
import com.example.scvl.exception.NotFoundException;
import com.example.scvl.exception.SlugConflictException;
import com.example.scvl.exception.StoreException;
import com.example.scvl.exception.ValidationException;
import com.example.scvl.model.Ogp;
import com.example.scvl.model.Page;
import com.example.scvl.store.PageStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Creates and updates pages. Each mutation is written to the store first and mirrored into the
 * cache only after the store write succeeded, so the cache never holds a change the store lacks.
 */
@Slf4j
@Service
public class PageService {

    private final PageStore pageStore;
    private final PageCache pageCache;
    private final SlugGenerator slugGenerator;
    private final int maxSlugAttempts;

    public PageService(PageStore pageStore,
                       PageCache pageCache,
                       SlugGenerator slugGenerator,
                       @Value("${app.slug.max-attempts:5}") int maxSlugAttempts) {
        this.pageStore = pageStore;
        this.pageCache = pageCache;
        this.slugGenerator = slugGenerator;
        this.maxSlugAttempts = maxSlugAttempts;
    }

    public Page create(Long ownerId, PageRequest request) {
        String url = validateUrl(request.getUrl());

        Page page = null;
        for (int attempt = 1; page == null; attempt++) {
            Page candidate = new Page();
            candidate.setSlug(slugGenerator.generate());
            candidate.setUserId(ownerId);
            candidate.setUrl(url);
            try {
                page = pageStore.createPage(candidate);
            } catch (SlugConflictException e) {
                if (attempt >= maxSlugAttempts) {
                    throw new StoreException("Failed to generate unique slug", e);
                }
                log.debug("Slug {} taken, retrying", candidate.getSlug());
            }
        }

        Ogp ogp = null;
        if (request.isOgp()) {
            ogp = new Ogp();
            ogp.setPageId(page.getId());
            applyOgpFields(ogp, request);
            try {
                ogp = pageStore.createOgp(ogp);
            } catch (RuntimeException e) {
                discardPage(page, e);
                throw e;
            }
        }

        pageCache.setUrl(page.getSlug(), page.getUrl());
        if (ogp != null) {
            pageCache.setOgpId(page.getSlug(), ogp.getId());
        }

        log.info("Created page {} for user {}", page.getSlug(), ownerId);
        return page;
    }

    public Page update(Long pageId, PageRequest request, Long ownerId) {
        Page page = pageStore.findPageById(pageId)
                .orElseThrow(() -> new NotFoundException("The page you are looking for is not found."));
        checkOwner(page, ownerId);
        String url = validateUrl(request.getUrl());

        Page updated = pageStore.updatePage(page.getId(), url);
        pageCache.setUrl(updated.getSlug(), updated.getUrl());

        Optional<Ogp> existing = pageStore.findOgpByPageId(page.getId());
        if (request.isOgp()) {
            if (existing.isEmpty()) {
                Ogp ogp = new Ogp();
                ogp.setPageId(page.getId());
                applyOgpFields(ogp, request);
                ogp = pageStore.createOgp(ogp);
                pageCache.setOgpId(page.getSlug(), ogp.getId());
            } else {
                Ogp ogp = pageStore.updateOgp(existing.get().getId(),
                        request.getTitle(), request.getImage(), request.getDescription());
                // Rewritten with the URL key so both expire together.
                pageCache.setOgpId(page.getSlug(), ogp.getId());
            }
        } else if (existing.isPresent()) {
            pageStore.deleteOgp(existing.get().getId());
            pageCache.deleteOgpId(page.getSlug());
        }

        log.info("Updated page {} by user {}", page.getSlug(), ownerId);
        return updated;
    }

    public Page getOwnedPage(String slug, Long ownerId) {
        Page page = pageStore.findPageBySlug(slug)
                .orElseThrow(() -> new NotFoundException("The page you are looking for is not found."));
        checkOwner(page, ownerId);
        return page;
    }

    public Optional<Ogp> findOgp(Page page) {
        return pageStore.findOgpByPageId(page.getId());
    }

    public List<Page> listPages(Long ownerId) {
        return pageStore.findPagesByOwner(ownerId);
    }

    public Map<String, Long> countViews(List<Page> pages) {
        return pageStore.countViewsBySlug(pages.stream().map(Page::getSlug).toList());
    }

    private void discardPage(Page page, RuntimeException cause) {
        log.warn("Failed to create OGP for page {}, removing the page", page.getSlug());
        try {
            pageStore.deletePage(page.getId());
        } catch (RuntimeException e) {
            cause.addSuppressed(e);
            log.error("Failed to remove page {} after OGP failure", page.getSlug(), e);
        }
    }

    private static void checkOwner(Page page, Long ownerId) {
        if (!page.getUserId().equals(ownerId)) {
            throw new ForbiddenException("You don't have permission to edit it.");
        }
    }

    private static void applyOgpFields(Ogp ogp, PageRequest request) {
        ogp.setTitle(request.getTitle());
        ogp.setImage(request.getImage());
        ogp.setDescription(request.getDescription());
    }

    static String validateUrl(String url) {
        if (url == null || url.isBlank()) {
            throw new ValidationException("url cannot be empty");
        }
        String trimmed = url.trim();
        try {
            URI uri = new URI(trimmed);
            String scheme = uri.getScheme();
            if (scheme == null || uri.getHost() == null) {
                throw new ValidationException("Invalid URL format");
            }
            if (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https")) {
                throw new ValidationException("Only HTTP/HTTPS URLs are allowed");
            }
            return trimmed;
        } catch (URISyntaxException e) {
            throw new ValidationException("Invalid URL format");
        }
    }
}
