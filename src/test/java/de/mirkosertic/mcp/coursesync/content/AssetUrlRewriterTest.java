package de.mirkosertic.mcp.coursesync.content;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("AssetUrlRewriter Tests")
class AssetUrlRewriterTest {

    private final AssetUrlRewriter rewriter = new AssetUrlRewriter("assets", "https://cdn.example.org/files/");

    @Test
    @DisplayName("Should rewrite relative src and href attributes into the assets directory")
    void shouldRewriteAssetLinks() {
        final String body = "<img src=\"../../assets/img/a.png\"> <a href='assets/doc.pdf'>doc</a>";

        final String rewritten = rewriter.rewrite("java 101", body);

        assertThat(rewritten).isEqualTo("<img src=\"https://cdn.example.org/files/java+101/img/a.png\"> "
                + "<a href='https://cdn.example.org/files/java+101/doc.pdf'>doc</a>");
    }

    @Test
    @DisplayName("Should leave other links untouched")
    void shouldLeaveOtherLinks() {
        final String body = "<a href=\"https://example.org/assets/x\">x</a> see assets/y.png";

        assertThat(rewriter.rewrite("c", body)).isEqualTo(body);
    }
}
