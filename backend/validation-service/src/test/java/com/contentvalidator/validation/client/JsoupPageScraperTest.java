package com.contentvalidator.validation.client;

import com.contentvalidator.validation.dto.ContentChunk;
import org.jsoup.Jsoup;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class JsoupPageScraperTest {

    private static final String HTML = """
            <html><head><title>Pricing</title></head><body>
              <nav><a href="/">Home</a> <p>Menu text</p></nav>
              <main>
                <h1>Plans</h1>
                <p>Pick the plan that fits.</p>
                <h2>Starter</h2>
                <p>For small teams.</p>
                <ul><li>5 users</li><li>Email support</li></ul>
                <h2>Business</h2>
                <p>For growing companies.</p>
              </main>
              <footer><p>Copyright</p></footer>
            </body></html>
            """;

    @Test
    @DisplayName("Main content is split into chunks under their heading path")
    void chunksByHeading() {
        List<ContentChunk> chunks = JsoupPageScraper.extractChunks(Jsoup.parse(HTML));

        assertThat(chunks).hasSize(3);
        assertThat(chunks.get(0).headingPath()).containsExactly("Plans");
        assertThat(chunks.get(0).text()).isEqualTo("Pick the plan that fits.");
        assertThat(chunks.get(1).headingPath()).containsExactly("Plans", "Starter");
        assertThat(chunks.get(1).text()).contains("For small teams.", "5 users", "Email support");
        assertThat(chunks.get(2).headingPath()).containsExactly("Plans", "Business");
        assertThat(chunks).allSatisfy(chunk -> assertThat(chunk.contentHash()).hasSize(64));
    }

    @Test
    @DisplayName("Navigation and footer text is not part of the content")
    void dropsNoise() {
        List<ContentChunk> chunks = JsoupPageScraper.extractChunks(Jsoup.parse(HTML));

        assertThat(chunks).noneMatch(chunk -> chunk.text().contains("Menu text") || chunk.text().contains("Copyright"));
    }
}
