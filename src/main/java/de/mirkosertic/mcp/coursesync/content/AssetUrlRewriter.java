package de.mirkosertic.mcp.coursesync.content;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites {@code src} and {@code href} attributes that point into the repository assets directory,
 * with any number of leading {@code ../}, to the public URL of the stored assets.
 */
public class AssetUrlRewriter {

    private final Pattern pattern;
    private final String baseUrl;

    public AssetUrlRewriter(final String assetsDirectory, final String baseUrl) {
        this.pattern = Pattern.compile("((?:src|href)\\s*=\\s*[\"'])(?:\\.\\./)*" + Pattern.quote(assetsDirectory) + "/",
                Pattern.CASE_INSENSITIVE);
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    public String rewrite(final String scopeId, final String body) {
        final String target = baseUrl + "/" + URLEncoder.encode(scopeId, StandardCharsets.UTF_8) + "/";
        return pattern.matcher(body).replaceAll("$1" + Matcher.quoteReplacement(target));
    }
}
