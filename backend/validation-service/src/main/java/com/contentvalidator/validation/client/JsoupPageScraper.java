package com.contentvalidator.validation.client;

import com.contentvalidator.validation.config.ScanProperties;
import com.contentvalidator.validation.dto.ContentChunk;
import com.contentvalidator.validation.dto.PageContent;
import com.contentvalidator.validation.entity.ScanFailureReason;
import com.contentvalidator.validation.exception.PageFailureException;
import com.contentvalidator.validation.util.Fingerprints;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Fetches a page with Jsoup and splits its main content into heading-delimited chunks.
 */
@Component
@Slf4j
public class JsoupPageScraper implements PageScraper {

    private static final String NOISE_SELECTORS = String.join(", ",
            "script", "style", "noscript", "template",
            "nav", "[role=navigation]", "header", "[role=banner]", "footer", "[role=contentinfo]",
            "aside", ".sidebar", "[role=complementary]",
            "[class*=cookie]", "[id*=cookie]", "[class*=consent]",
            "[class*=modal]", "[class*=popup]", "[class*=advertisement]");

    private static final String MAIN_SELECTORS = "main, [role=main], article, #content, .content, #main, .main-content";

    private static final String BLOCK_SELECTORS = "h1, h2, h3, h4, h5, h6, p, li, blockquote, td, th, dd, dt, figcaption";

    private final ScanProperties scanProperties;
    private final UrlGuard urlGuard;
    private final String userAgent;

    public JsoupPageScraper(ScanProperties scanProperties, UrlGuard urlGuard,
                            @Value("${scan.http.user-agent:ContentValidator/1.0}") String userAgent) {
        this.scanProperties = scanProperties;
        this.urlGuard = urlGuard;
        this.userAgent = userAgent;
    }

    @Override
    public PageContent scrape(String url) {
        urlGuard.check(url);
        Document doc;
        try {
            doc = Jsoup.connect(url)
                    .userAgent(userAgent)
                    .timeout((int) scanProperties.getTimeouts().getScrape().toMillis())
                    .followRedirects(true)
                    .get();
        } catch (IOException e) {
            throw new PageFailureException(url, ScanFailureReason.fromException(e),
                    "Failed to fetch " + url + ": " + e.getMessage(), e);
        }

        if (doc.location() != null && !doc.location().isBlank() && !doc.location().equals(url)) {
            // redirected
            urlGuard.check(doc.location());
        }

        String html = doc.outerHtml();
        String title = doc.title();
        List<ContentChunk> chunks = extractChunks(doc);
        log.debug("Scraped {}: {} chunks", url, chunks.size());
        return new PageContent(url, title, html, chunks);
    }

    static List<ContentChunk> extractChunks(Document doc) {
        doc.select(NOISE_SELECTORS).remove();
        Element root = doc.selectFirst(MAIN_SELECTORS);
        if (root == null) {
            root = doc.body() != null ? doc.body() : doc;
        }

        List<ContentChunk> chunks = new ArrayList<>();
        String[] headings = new String[6];
        StringBuilder text = new StringBuilder();

        for (Element block : root.select(BLOCK_SELECTORS)) {
            if (hasBlockAncestor(block, root)) {
                // text already taken from the enclosing block
                continue;
            }
            String blockText = block.text().trim();
            if (blockText.isEmpty()) {
                continue;
            }
            int level = headingLevel(block.tagName());
            if (level > 0) {
                flush(chunks, headings, text);
                headings[level - 1] = blockText;
                for (int i = level; i < headings.length; i++) {
                    headings[i] = null;
                }
            } else {
                if (text.length() > 0) {
                    text.append('\n');
                }
                text.append(blockText);
            }
        }
        flush(chunks, headings, text);
        return chunks;
    }

    private static void flush(List<ContentChunk> chunks, String[] headings, StringBuilder text) {
        if (text.length() == 0) {
            return;
        }
        List<String> path = new ArrayList<>();
        for (String heading : headings) {
            if (heading != null) {
                path.add(heading);
            }
        }
        String chunkText = text.toString();
        chunks.add(new ContentChunk(path, chunkText, Fingerprints.contentHash(chunkText)));
        text.setLength(0);
    }

    private static boolean hasBlockAncestor(Element block, Element root) {
        for (Element parent = block.parent(); parent != null && parent != root; parent = parent.parent()) {
            if (parent.is(BLOCK_SELECTORS)) {
                return true;
            }
        }
        return false;
    }

    private static int headingLevel(String tagName) {
        if (tagName.length() == 2 && tagName.charAt(0) == 'h' && Character.isDigit(tagName.charAt(1))) {
            return tagName.charAt(1) - '0';
        }
        return 0;
    }
}
