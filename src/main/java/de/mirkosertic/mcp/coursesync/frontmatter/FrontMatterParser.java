package de.mirkosertic.mcp.coursesync.frontmatter;

/**
 * Splits raw file text into a front-matter metadata block and the body.
 * <p>
 * Implementations never fail: text without a leading delimiter yields empty metadata
 * and the unchanged input as body.
 */
public interface FrontMatterParser {

    FrontMatter parse(String text);
}
