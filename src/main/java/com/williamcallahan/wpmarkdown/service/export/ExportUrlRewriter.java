package com.williamcallahan.wpmarkdown.service.export;

import com.williamcallahan.wpmarkdown.domain.export.Blog;
import com.williamcallahan.wpmarkdown.domain.export.BlogAttachment;
import com.williamcallahan.wpmarkdown.domain.export.BlogDocument;
import com.williamcallahan.wpmarkdown.service.markdown.UrlRewriter;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Points links at exported documents and local media copies instead of the WordPress site.
 *
 * <p>Documents are keyed by their exact permalink, so query-only permalinks such as
 * {@code ?p=12} stay distinct. A link resolves to a document when it equals a permalink apart from
 * its fragment, or when its scheme, host, port and path do. Attachments are compared by scheme,
 * host, port and path only. Document links become {@code *id} (keeping any fragment); attachment
 * links become {@code mediaDir/filename}, where the file name is
 * chosen the first time the attachment is referenced and stays unique ignoring case.</p>
 *
 * <p>Not thread-safe: one instance serves one export run.</p>
 */
public class ExportUrlRewriter implements UrlRewriter {
    private static final Logger log = LoggerFactory.getLogger(ExportUrlRewriter.class);

    private static final String DOCUMENT_LINK_PREFIX = "*";

    private final Map<String, BlogDocument> documentsByUrl = new HashMap<>();
    private final Map<String, BlogAttachment> attachmentsByUrl = new HashMap<>();
    private final Map<BlogAttachment, String> filenames = new LinkedHashMap<>();
    private final Set<String> usedFilenames = new HashSet<>();
    private final Set<String> unresolvedSelfLinks = new LinkedHashSet<>();
    private final String mediaDir;
    private final String selfLinkPrefix;
    private final Random random;

    /**
     * Creates a rewriter for the documents and attachments of {@code blog}.
     *
     * @param blog assembled blog
     * @param mediaDir directory emitted in front of attachment file names
     * @param selfLinkPrefix prefix of the blog's own URLs, empty to skip reporting unresolved ones
     * @param random source of prefixes for clashing file names
     */
    public ExportUrlRewriter(Blog blog, String mediaDir, String selfLinkPrefix, Random random) {
        Objects.requireNonNull(blog, "blog");
        this.mediaDir = Objects.requireNonNull(mediaDir, "mediaDir");
        this.selfLinkPrefix = Objects.requireNonNull(selfLinkPrefix, "selfLinkPrefix");
        this.random = Objects.requireNonNull(random, "random");

        for (BlogDocument document : blog.documents()) {
            if (!document.link().isBlank()) {
                documentsByUrl.put(document.link(), document);
            }
        }
        for (BlogAttachment attachment : blog.attachments()) {
            attachmentsByUrl.put(canonicalKey(attachment.url()), attachment);
        }
    }

    @Override
    public String rewrite(String target) {
        Optional<URI> parsed = parse(target);
        if (parsed.isPresent()) {
            URI uri = parsed.get();
            String canonical = canonical(uri);

            BlogDocument document = documentsByUrl.get(withoutFragment(target));
            if (document == null) {
                document = documentsByUrl.get(canonical);
            }
            if (document == null && !canonical.endsWith("/")) {
                document = documentsByUrl.get(canonical + "/");
            }
            if (document != null) {
                String fragment = uri.getRawFragment();
                return DOCUMENT_LINK_PREFIX + document.id() + (fragment == null || fragment.isEmpty() ? "" : "#" + fragment);
            }

            BlogAttachment attachment = attachmentsByUrl.get(canonical);
            if (attachment != null) {
                return mediaDir + "/" + filenameFor(attachment);
            }
        }

        if (!selfLinkPrefix.isEmpty() && target.startsWith(selfLinkPrefix) && unresolvedSelfLinks.add(target)) {
            log.warn("Unresolved self-link {}", target);
        }
        return target;
    }

    /**
     * Returns the file name of every attachment referenced so far, in order of first use.
     *
     * @return attachment URL to local file name
     */
    public Map<String, String> referencedAttachments() {
        Map<String, String> result = new LinkedHashMap<>();
        filenames.forEach((attachment, filename) -> result.put(attachment.url(), filename));
        return Collections.unmodifiableMap(result);
    }

    public Set<String> unresolvedSelfLinks() {
        return Collections.unmodifiableSet(unresolvedSelfLinks);
    }

    private String filenameFor(BlogAttachment attachment) {
        String assigned = filenames.get(attachment);
        if (assigned != null) {
            return assigned;
        }

        String basename = basename(attachment.url());
        String candidate = basename;
        while (!usedFilenames.add(candidate.toLowerCase(Locale.ROOT))) {
            candidate = String.format(Locale.ROOT, "%08x_%s", random.nextInt(), basename);
        }
        filenames.put(attachment, candidate);
        return candidate;
    }

    static String basename(String url) {
        String path = parse(url).map(URI::getPath).orElse(url);
        if (path == null) {
            path = "";
        }
        int end = path.length();
        while (end > 0 && path.charAt(end - 1) == '/') {
            end--;
        }
        if (end == 0) {
            return path.isEmpty() ? "." : "/";
        }
        return path.substring(path.lastIndexOf('/', end - 1) + 1, end);
    }

    private static String withoutFragment(String url) {
        int hash = url.indexOf('#');
        return hash < 0 ? url : url.substring(0, hash);
    }

    private static String canonicalKey(String url) {
        return parse(url).map(ExportUrlRewriter::canonical).orElse(url);
    }

    /**
     * Reduces a URL to scheme, host, port and path.
     */
    static String canonical(URI uri) {
        StringBuilder canonical = new StringBuilder();
        if (uri.getScheme() != null) {
            canonical.append(uri.getScheme()).append(':');
        }
        if (uri.getHost() != null) {
            canonical.append("//").append(uri.getHost());
            if (uri.getPort() != -1) {
                canonical.append(':').append(uri.getPort());
            }
        }
        if (uri.getRawPath() != null) {
            canonical.append(uri.getRawPath());
        }
        return canonical.toString();
    }

    private static Optional<URI> parse(String url) {
        try {
            return Optional.of(new URI(url));
        } catch (URISyntaxException exception) {
            log.debug("Leaving unparseable URL unchanged: {}", url);
            return Optional.empty();
        }
    }
}
