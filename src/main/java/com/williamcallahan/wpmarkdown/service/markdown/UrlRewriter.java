package com.williamcallahan.wpmarkdown.service.markdown;

/**
 * Maps every link target and image source the renderer emits.
 *
 * <p>Implementations may consult caller-owned lookup tables; the renderer calls them once per
 * emitted URL and makes no assumption about repeated calls.</p>
 */
@FunctionalInterface
public interface UrlRewriter {

    /**
     * Rewrites a URL.
     *
     * @param url URL as found in the markup
     * @return URL to emit
     */
    String rewrite(String url);

    /**
     * Returns a rewriter that leaves URLs unchanged.
     *
     * @return identity rewriter
     */
    static UrlRewriter identity() {
        return url -> url;
    }
}
