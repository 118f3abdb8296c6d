package com.contentvalidator.validation.client;

import com.contentvalidator.validation.config.ScanProperties;
import com.contentvalidator.validation.dto.PageCandidate;
import com.contentvalidator.validation.entity.PageSource;
import com.contentvalidator.validation.util.Fingerprints;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Discovers pages from {@code sitemap.xml}, then from navigation links,
 * then from any same-host link on the base page.
 */
@Component
@Slf4j
public class JsoupPageDiscoveryClient implements PageDiscoveryClient {

    private static final int MAX_SUB_SITEMAPS = 5;

    private final ScanProperties scanProperties;
    private final UrlGuard urlGuard;
    private final String userAgent;

    public JsoupPageDiscoveryClient(ScanProperties scanProperties, UrlGuard urlGuard,
                                    @Value("${scan.http.user-agent:ContentValidator/1.0}") String userAgent) {
        this.scanProperties = scanProperties;
        this.urlGuard = urlGuard;
        this.userAgent = userAgent;
    }

    /**
     * @throws com.contentvalidator.validation.exception.PageFailureException when the base URL is blocked
     */
    @Override
    public List<PageCandidate> discoverPages(String baseUrl, int maxPages) {
        urlGuard.check(baseUrl);
        List<PageCandidate> pages = new ArrayList<>();
        Set<String> seen = new HashSet<>();

        if (scanProperties.getDiscovery().isUseSitemap()) {
            for (String url : readSitemap(baseUrl, maxPages)) {
                add(pages, seen, new PageCandidate(url, null, PageSource.SITEMAP), maxPages);
            }
        }

        if (pages.size() < maxPages) {
            Document home;
            try {
                home = fetch(baseUrl);
            } catch (IOException e) {
                if (pages.isEmpty()) {
                    throw new IllegalStateException("Cannot fetch " + baseUrl + ": " + e.getMessage(), e);
                }
                log.warn("Base page {} not reachable, using sitemap only: {}", baseUrl, e.getMessage());
                return pages;
            }
            add(pages, seen, new PageCandidate(baseUrl, home.title(), PageSource.CRAWL), maxPages);
            for (Element link : home.select("nav a[href], header a[href], [role=navigation] a[href]")) {
                addLink(pages, seen, baseUrl, link, PageSource.NAV, maxPages);
            }
            for (Element link : home.select("a[href]")) {
                addLink(pages, seen, baseUrl, link, PageSource.CRAWL, maxPages);
            }
        }

        log.info("Discovered {} pages for {}", pages.size(), baseUrl);
        return pages;
    }

    private List<String> readSitemap(String baseUrl, int maxPages) {
        List<String> urls = new ArrayList<>();
        String sitemapUrl = stripTrailingSlash(baseUrl) + "/sitemap.xml";
        try {
            Document sitemap = fetchXml(sitemapUrl);
            List<String> subSitemaps = sitemap.select("sitemap > loc").eachText();
            if (subSitemaps.isEmpty()) {
                collectLocs(sitemap, baseUrl, urls, maxPages);
            } else {
                for (String sub : subSitemaps.subList(0, Math.min(MAX_SUB_SITEMAPS, subSitemaps.size()))) {
                    if (!urlGuard.isAllowed(sub)) {
                        continue;
                    }
                    try {
                        collectLocs(fetchXml(sub), baseUrl, urls, maxPages);
                    } catch (IOException e) {
                        log.debug("Sub-sitemap {} failed: {}", sub, e.getMessage());
                    }
                    if (urls.size() >= maxPages) {
                        break;
                    }
                }
            }
        } catch (IOException e) {
            log.debug("No sitemap at {}: {}", sitemapUrl, e.getMessage());
        }
        return urls;
    }

    private void collectLocs(Document sitemap, String baseUrl, List<String> urls, int maxPages) {
        for (String loc : sitemap.select("url > loc").eachText()) {
            if (isSameHost(loc, baseUrl)) {
                urls.add(loc.trim());
                if (urls.size() >= maxPages) {
                    return;
                }
            }
        }
    }

    private void addLink(List<PageCandidate> pages, Set<String> seen, String baseUrl, Element link,
                         PageSource source, int maxPages) {
        String href = link.absUrl("href");
        if (href.isBlank() || !href.startsWith("http") || !isSameHost(href, baseUrl) || isAsset(href)) {
            return;
        }
        String title = link.text().isBlank() ? null : link.text().trim();
        add(pages, seen, new PageCandidate(href, title, source), maxPages);
    }

    private static void add(List<PageCandidate> pages, Set<String> seen, PageCandidate candidate, int maxPages) {
        if (pages.size() < maxPages && seen.add(Fingerprints.normalizeUrl(candidate.url()))) {
            pages.add(candidate);
        }
    }

    private Document fetch(String url) throws IOException {
        return Jsoup.connect(url)
                .userAgent(userAgent)
                .timeout((int) scanProperties.getTimeouts().getScrape().toMillis())
                .followRedirects(true)
                .get();
    }

    private Document fetchXml(String url) throws IOException {
        return Jsoup.connect(url)
                .userAgent(userAgent)
                .timeout((int) scanProperties.getTimeouts().getScrape().toMillis())
                .ignoreContentType(true)
                .parser(Parser.xmlParser())
                .get();
    }

    static boolean isSameHost(String url, String baseUrl) {
        try {
            String host = URI.create(url.trim()).getHost();
            String baseHost = URI.create(baseUrl.trim()).getHost();
            return host != null && baseHost != null && stripWww(host).equalsIgnoreCase(stripWww(baseHost));
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private static boolean isAsset(String url) {
        String lower = url.toLowerCase(Locale.ROOT);
        int query = lower.indexOf('?');
        String path = query >= 0 ? lower.substring(0, query) : lower;
        return path.matches(".*\\.(pdf|jpe?g|png|gif|svg|webp|zip|mp4|mp3|css|js|xml)$")
                || lower.startsWith("mailto:") || lower.startsWith("tel:");
    }

    private static String stripWww(String host) {
        return host.startsWith("www.") ? host.substring(4) : host;
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
