package com.example.scvl.controller;

import com.example.scvl.config.AuthInterceptor;
import com.example.scvl.dto.PageRequest;
import com.example.scvl.dto.PageResponse;
import com.example.scvl.model.AppUser;
import com.example.scvl.model.Ogp;
import com.example.scvl.model.Page;
import com.example.scvl.service.AuthService;
import com.example.scvl.service.PageService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequiredArgsConstructor
public class PageController {

    private final PageService pageService;
    private final AuthService authService;

    @Value("${app.base-url}")
    private String baseUrl;

    @GetMapping("/api/v1/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("ok");
    }

    @PostMapping("/api/v1/shorten")
    public ResponseEntity<PageResponse> shorten(
            @RequestAttribute(value = AuthInterceptor.USER_ID_ATTRIBUTE, required = false) Long userId,
            @Valid @RequestBody PageRequest request) {
        AppUser user = authService.requireUser(userId);
        Page page = pageService.create(user.getId(), request);
        return ResponseEntity.ok(toResponse(page, pageService.findOgp(page).orElse(null)));
    }

    @PutMapping("/api/v1/pages/{id}")
    public ResponseEntity<PageResponse> update(
            @RequestAttribute(value = AuthInterceptor.USER_ID_ATTRIBUTE, required = false) Long userId,
            @PathVariable Long id,
            @Valid @RequestBody PageRequest request) {
        AppUser user = authService.requireUser(userId);
        Page page = pageService.update(id, request, user.getId());
        return ResponseEntity.ok(toResponse(page, pageService.findOgp(page).orElse(null)));
    }

    @GetMapping("/api/v1/pages")
    public ResponseEntity<List<PageResponse>> listPages(
            @RequestAttribute(value = AuthInterceptor.USER_ID_ATTRIBUTE, required = false) Long userId) {
        AppUser user = authService.requireUser(userId);
        List<Page> pages = pageService.listPages(user.getId());
        Map<String, Long> views = pageService.countViews(pages);
        return ResponseEntity.ok(pages.stream()
                .map(page -> {
                    PageResponse response = toResponse(page, null);
                    response.setViews(views.getOrDefault(page.getSlug(), 0L));
                    return response;
                })
                .toList());
    }

    @GetMapping("/api/v1/pages/by-slug/{slug}")
    public ResponseEntity<PageResponse> getPage(
            @RequestAttribute(value = AuthInterceptor.USER_ID_ATTRIBUTE, required = false) Long userId,
            @PathVariable String slug) {
        AppUser user = authService.requireUser(userId);
        Page page = pageService.getOwnedPage(slug, user.getId());
        return ResponseEntity.ok(toResponse(page, pageService.findOgp(page).orElse(null)));
    }

    private PageResponse toResponse(Page page, Ogp ogp) {
        PageResponse response = new PageResponse();
        response.setId(page.getId());
        response.setSlug(page.getSlug());
        response.setUrl(page.getUrl());
        response.setShortUrl(baseUrl + "/" + page.getSlug());
        if (page.getCreatedAt() != null) {
            response.setCreatedAt(page.getCreatedAt().getEpochSecond());
        }
        if (ogp != null) {
            PageResponse.OgpResponse ogpResponse = new PageResponse.OgpResponse();
            ogpResponse.setTitle(ogp.getTitle());
            ogpResponse.setImage(ogp.getImage());
            ogpResponse.setDescription(ogp.getDescription());
            response.setOgp(ogpResponse);
        }
        return response;
    }
}
