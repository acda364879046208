package com.example.scvl.store;

import com.example.scvl.exception.SlugConflictException;
import com.example.scvl.model.Ogp;
import com.example.scvl.model.Page;
import com.example.scvl.model.PageView;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Authoritative record of pages, their OGP metadata and view history. Every write is transactional
 * on a single row. Implementations report failures as {@link com.example.scvl.exception.StoreException}.
 */
public interface PageStore {

    Optional<Page> findPageBySlug(String slug);

    Optional<Page> findPageById(Long id);

    List<Page> findPagesByOwner(Long userId);

    /**
     * Persists a new page.
     *
     * @throws SlugConflictException if another page already uses the slug
     */
    Page createPage(Page page);

    Page updatePage(Long pageId, String url);

    void deletePage(Long pageId);

    Optional<Ogp> findOgpById(Long id);

    Optional<Ogp> findOgpByPageId(Long pageId);

    Ogp createOgp(Ogp ogp);

    Ogp updateOgp(Long ogpId, String title, String image, String description);

    void deleteOgp(Long ogpId);

    void createPageView(PageView view);

    Map<String, Long> countViewsBySlug(Collection<String> slugs);
}
