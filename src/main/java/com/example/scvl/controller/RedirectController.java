package com.example.scvl.controller;

import com.example.scvl.dto.ClientRequest;
import com.example.scvl.dto.RedirectDecision;
import com.example.scvl.service.ClientIpResolver;
import com.example.scvl.service.RedirectService;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.servlet.ModelAndView;
import org.springframework.web.servlet.view.RedirectView;

import java.util.Map;

@Controller
@RequiredArgsConstructor
public class RedirectController {

    static final String PREVIEW_VIEW = "preview";

    private final RedirectService redirectService;
    private final ClientIpResolver clientIpResolver;

    @GetMapping("/{slug}")
    public ModelAndView redirect(@PathVariable String slug, HttpServletRequest request) {
        ClientRequest client = new ClientRequest(
                clientIpResolver.resolve(request),
                request.getHeader(HttpHeaders.REFERER),
                request.getHeader(HttpHeaders.USER_AGENT));

        RedirectDecision decision = redirectService.resolve(slug, client);
        switch (decision.getKind()) {
            case PREVIEW:
                return new ModelAndView(PREVIEW_VIEW, Map.of("url", decision.getUrl(), "ogp", decision.getOgp()));
            case REDIRECT:
            default:
                RedirectView view = new RedirectView(decision.getUrl());
                view.setStatusCode(HttpStatus.TEMPORARY_REDIRECT);
                view.setExposeModelAttributes(false);
                view.setExpandUriTemplateVariables(false);
                return new ModelAndView(view);
        }
    }
}
