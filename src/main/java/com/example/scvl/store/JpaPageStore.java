package com.example.scvl.store;

import com.example.scvl.exception.NotFoundException;
import com.example.scvl.exception.SlugConflictException;
import com.example.scvl.exception.StoreException;
import com.example.scvl.model.Ogp;
import com.example.scvl.model.Page;
import com.example.scvl.model.PageView;
import com.example.scvl.repository.OgpRepository;
import com.example.scvl.repository.PageRepository;
import com.example.scvl.repository.PageViewRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.stream.Collectors;

@Repository
@RequiredArgsConstructor
public class JpaPageStore implements PageStore {

    private final PageRepository pageRepository;
    private final OgpRepository ogpRepository;
    private final PageViewRepository pageViewRepository;

    @Override
    @Transactional(readOnly = true)
    public Optional<Page> findPageBySlug(String slug) {
        return execute("find page by slug", () -> pageRepository.findBySlug(slug));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Page> findPageById(Long id) {
        return execute("find page by id", () -> pageRepository.findById(id));
    }

    @Override
    @Transactional(readOnly = true)
    public List<Page> findPagesByOwner(Long userId) {
        return execute("list pages", () -> pageRepository.findByUserIdOrderByCreatedAtDesc(userId));
    }

    @Override
    @Transactional
    public Page createPage(Page page) {
        try {
            return pageRepository.saveAndFlush(page);
        } catch (DataIntegrityViolationException e) {
            throw new SlugConflictException(page.getSlug(), e);
        } catch (DataAccessException e) {
            throw new StoreException("Failed to create page", e);
        }
    }

    @Override
    @Transactional
    public Page updatePage(Long pageId, String url) {
        return execute("update page", () -> {
            Page page = pageRepository.findById(pageId)
                    .orElseThrow(() -> new NotFoundException("The page you are looking for is not found."));
            page.setUrl(url);
            return pageRepository.saveAndFlush(page);
        });
    }

    @Override
    @Transactional
    public void deletePage(Long pageId) {
        execute("delete page", () -> {
            pageRepository.deleteById(pageId);
            return null;
        });
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Ogp> findOgpById(Long id) {
        return execute("find ogp", () -> ogpRepository.findById(id));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Ogp> findOgpByPageId(Long pageId) {
        return execute("find ogp by page", () -> ogpRepository.findByPageId(pageId));
    }

    @Override
    @Transactional
    public Ogp createOgp(Ogp ogp) {
        return execute("create ogp", () -> ogpRepository.saveAndFlush(ogp));
    }

    @Override
    @Transactional
    public Ogp updateOgp(Long ogpId, String title, String image, String description) {
        return execute("update ogp", () -> {
            Ogp ogp = ogpRepository.findById(ogpId)
                    .orElseThrow(() -> new NotFoundException("OGP not found: " + ogpId));
            ogp.setTitle(title);
            ogp.setImage(image);
            ogp.setDescription(description);
            return ogpRepository.saveAndFlush(ogp);
        });
    }

    @Override
    @Transactional
    public void deleteOgp(Long ogpId) {
        execute("delete ogp", () -> {
            ogpRepository.deleteById(ogpId);
            return null;
        });
    }

    @Override
    @Transactional
    public void createPageView(PageView view) {
        execute("create page view", () -> pageViewRepository.save(view));
    }

    @Override
    @Transactional(readOnly = true)
    public Map<String, Long> countViewsBySlug(Collection<String> slugs) {
        if (slugs.isEmpty()) {
            return Map.of();
        }
        return execute("count page views", () -> pageViewRepository.countViewsBySlugs(slugs).stream()
                .collect(Collectors.toMap(row -> (String) row[0], row -> (Long) row[1])));
    }

    private static <T> T execute(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            throw new StoreException("Failed to " + operation, e);
        }
    }
}
