package com.example.scvl.dto;

import com.example.scvl.model.Ogp;
import lombok.Getter;

/**
 * What the redirect endpoint should answer with: a plain 307 to the destination, or a preview page
 * carrying the destination and its OGP metadata.
 */
@Getter
public class RedirectDecision {

    public enum Kind {
        REDIRECT,
        PREVIEW
    }

    private final Kind kind;
    private final String url;
    private final Ogp ogp;

    private RedirectDecision(Kind kind, String url, Ogp ogp) {
        this.kind = kind;
        this.url = url;
        this.ogp = ogp;
    }

    public static RedirectDecision of(String url, Ogp ogp) {
        return ogp == null ? new RedirectDecision(Kind.REDIRECT, url, null) : new RedirectDecision(Kind.PREVIEW, url, ogp);
    }
}
