package com.example.scvl.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.example.scvl.dto.ClientRequest;
import com.example.scvl.dto.PageRequest;
import com.example.scvl.dto.RedirectDecision;
import com.example.scvl.exception.ForbiddenException;
import com.example.scvl.exception.NotFoundException;
import com.example.scvl.model.Page;
import com.example.scvl.model.PageView;
import com.example.scvl.support.InMemoryPageCache;
import com.example.scvl.support.InMemoryPageStore;
import com.example.scvl.support.UserAgents;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;

/**
 * Create/update through {@link PageService} followed by lookups through {@link RedirectService},
 * both wired to the same in-memory store and cache.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("Cache-aside create/update/redirect flow")
class CacheAsideFlowTest {

    private static final Long OWNER = 1L;
    private static final ClientRequest BROWSER =
            new ClientRequest("203.0.113.7", "https://twitter.com/", UserAgents.CHROME_DESKTOP);
    private static final ClientRequest CRAWLER =
            new ClientRequest("66.249.66.1", null, UserAgents.GOOGLEBOT);

    @Mock private AnalyticsService analyticsService;

    private InMemoryPageStore store;
    private InMemoryPageCache cache;
    private PageService pageService;
    private RedirectService redirectService;

    @BeforeEach
    void setUp() {
        store = new InMemoryPageStore();
        cache = new InMemoryPageCache();
        pageService = new PageService(store, cache, fixedSlugs("abc123", "def456", "ghi789"), 5);
        redirectService = new RedirectService(cache, store, analyticsService, new UserAgentClassifier());
    }

    @Test
    @DisplayName("create caches the URL and a browser visit gets a 307 plus a page view")
    void createThenRedirect() {
        // Given
        Page page = pageService.create(OWNER, PageRequest.of("https://example.com"));

        // When
        RedirectDecision decision = redirectService.resolve(page.getSlug(), BROWSER);

        // Then
        assertThat(page.getSlug()).isEqualTo("abc123");
        assertThat(cache.getUrl("abc123")).contains("https://example.com");
        assertThat(decision.getKind()).isEqualTo(RedirectDecision.Kind.REDIRECT);
        assertThat(decision.getUrl()).isEqualTo("https://example.com");

        ArgumentCaptor<PageView> captor = ArgumentCaptor.forClass(PageView.class);
        verify(analyticsService).recordPageView(captor.capture());
        PageView view = captor.getValue();
        assertThat(view.getSlug()).isEqualTo("abc123");
        assertThat(view.getRealIp()).isEqualTo("203.0.113.7");
        assertThat(view.getReferer()).isEqualTo("https://twitter.com/");
        assertThat(view.isMobile()).isFalse();
    }

    @Test
    @DisplayName("crawler visits are redirected without recording a page view")
    void crawlerIsNotRecorded() {
        Page page = pageService.create(OWNER, PageRequest.of("https://example.com"));

        RedirectDecision decision = redirectService.resolve(page.getSlug(), CRAWLER);

        assertThat(decision.getUrl()).isEqualTo("https://example.com");
        verify(analyticsService, never()).recordPageView(any());
    }

    @Test
    @DisplayName("lookup after clearing the cache falls back to the store and repopulates")
    void storeFallbackAfterCacheLoss() {
        Page page = pageService.create(OWNER, PageRequest.of("https://example.com/a?b=c"));
        cache.clear();

        RedirectDecision decision = redirectService.resolve(page.getSlug(), BROWSER);

        assertThat(decision.getUrl()).isEqualTo("https://example.com/a?b=c");
        assertThat(cache.getUrl(page.getSlug())).contains("https://example.com/a?b=c");
    }

    @Test
    @DisplayName("update by the owner is visible to the next redirect")
    void updateOverwritesCachedUrl() {
        Page page = pageService.create(OWNER, PageRequest.of("https://example.com"));
        redirectService.resolve(page.getSlug(), CRAWLER);

        pageService.update(page.getId(), PageRequest.of("https://new.example.com"), OWNER);

        assertThat(redirectService.resolve("abc123", CRAWLER).getUrl()).isEqualTo("https://new.example.com");
        cache.clear();
        assertThat(redirectService.resolve("abc123", CRAWLER).getUrl()).isEqualTo("https://new.example.com");
    }

    @Test
    @DisplayName("update by another user is forbidden and changes nothing")
    void nonOwnerUpdateIsForbidden() {
        Page page = pageService.create(OWNER, PageRequest.of("https://example.com"));
        int writesBefore = cache.writeCount();

        assertThatThrownBy(() -> pageService.update(page.getId(), PageRequest.of("https://evil.example.com"), 2L))
                .isInstanceOf(ForbiddenException.class);

        assertThat(store.findPageById(page.getId())).get().extracting(Page::getUrl).isEqualTo("https://example.com");
        assertThat(cache.writeCount()).isEqualTo(writesBefore);
        assertThat(redirectService.resolve("abc123", CRAWLER).getUrl()).isEqualTo("https://example.com");
    }

    @Test
    @DisplayName("unknown slug is NotFound and leaves the cache untouched")
    void unknownSlugIsNotFound() {
        assertThatThrownBy(() -> redirectService.resolve("nope42", BROWSER))
                .isInstanceOf(NotFoundException.class);

        assertThat(cache.writeCount()).isZero();
        verify(analyticsService, never()).recordPageView(any());
    }

    @Test
    @DisplayName("page created with OGP renders a preview, from cache and from store")
    void createWithOgpRendersPreview() {
        Page page = pageService.create(OWNER,
                PageRequest.withOgp("https://example.com", "Title", "https://example.com/img.png", "Desc"));

        RedirectDecision cached = redirectService.resolve(page.getSlug(), CRAWLER);
        cache.clear();
        RedirectDecision fromStore = redirectService.resolve(page.getSlug(), CRAWLER);

        assertThat(cached.getKind()).isEqualTo(RedirectDecision.Kind.PREVIEW);
        assertThat(cached.getOgp().getTitle()).isEqualTo("Title");
        assertThat(fromStore.getKind()).isEqualTo(RedirectDecision.Kind.PREVIEW);
        assertThat(fromStore.getOgp().getImage()).isEqualTo("https://example.com/img.png");
        assertThat(cache.getOgpId(page.getSlug())).isEqualTo(fromStore.getOgp().getId());
    }

    @Test
    @DisplayName("withholding OGP on update deletes the record and the cache mapping")
    void removingOgpFallsBackToPlainRedirect() {
        Page page = pageService.create(OWNER,
                PageRequest.withOgp("https://example.com", "Title", null, null));
        assertThat(cache.hasOgpId(page.getSlug())).isTrue();

        pageService.update(page.getId(), PageRequest.of("https://example.com"), OWNER);

        assertThat(store.ogpCount()).isZero();
        assertThat(cache.hasOgpId(page.getSlug())).isFalse();
        RedirectDecision decision = redirectService.resolve(page.getSlug(), CRAWLER);
        assertThat(decision.getKind()).isEqualTo(RedirectDecision.Kind.REDIRECT);
    }

    @Test
    @DisplayName("adding OGP on update caches its id; editing it keeps the id")
    void ogpUpsertOnUpdate() {
        Page page = pageService.create(OWNER, PageRequest.of("https://example.com"));

        pageService.update(page.getId(), PageRequest.withOgp("https://example.com", "First", null, null), OWNER);
        long ogpId = cache.getOgpId(page.getSlug());
        pageService.update(page.getId(), PageRequest.withOgp("https://example.com", "Second", null, null), OWNER);

        assertThat(ogpId).isNotZero();
        assertThat(cache.getOgpId(page.getSlug())).isEqualTo(ogpId);
        assertThat(store.ogpCount()).isEqualTo(1);
        assertThat(redirectService.resolve(page.getSlug(), CRAWLER).getOgp().getTitle()).isEqualTo("Second");
    }

    @Test
    @DisplayName("a cached OGP id whose record is gone is treated as no OGP")
    void staleOgpIdIsIgnored() {
        Page page = pageService.create(OWNER, PageRequest.of("https://example.com"));
        cache.setOgpId(page.getSlug(), 999L);

        RedirectDecision decision = redirectService.resolve(page.getSlug(), CRAWLER);

        assertThat(decision.getKind()).isEqualTo(RedirectDecision.Kind.REDIRECT);
        assertThat(decision.getUrl()).isEqualTo("https://example.com");
    }

    private static SlugGenerator fixedSlugs(String... slugs) {
        Deque<String> queue = new ArrayDeque<>(Arrays.asList(slugs));
        return new SlugGenerator(6) {
            @Override
            public String generate() {
                return queue.removeFirst();
            }
        };
    }
}
