package ai.acsl.injector.inject;

import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Splits a source text into its leading include header and the body that follows. The header is the
 * leading run of include lines, blank lines between them allowed, up to the last include of that run.
 */
public record SourceLayout(String header, String body, int bodyStartByte) {

    public static final Pattern DEFAULT_INCLUDE_PATTERN = Pattern.compile("^\\s*#\\s*include\\s+[<\"][^>\"]+[>\"]");

    public SourceLayout {
        Objects.requireNonNull(header, "header");
        Objects.requireNonNull(body, "body");
    }

    public static SourceLayout split(String text, Pattern includePattern) {
        String[] lines = text.split("\n", -1);
        int lastInclude = -1;
        for (int i = 0; i < lines.length; i++) {
            if (includePattern.matcher(lines[i]).find()) {
                lastInclude = i;
            } else if (!lines[i].isBlank()) {
                break;
            }
        }
        if (lastInclude < 0) {
            return new SourceLayout("", text, 0);
        }

        int headerEnd = 0;
        for (int i = 0; i <= lastInclude; i++) {
            headerEnd += lines[i].length() + (i < lastInclude ? 1 : 0);
        }
        String header = text.substring(0, headerEnd);
        if (headerEnd >= text.length()) {
            return new SourceLayout(header, "", utf8Length(header));
        }
        return new SourceLayout(header, text.substring(headerEnd + 1), utf8Length(header) + 1);
    }

    private static int utf8Length(String value) {
        return value.getBytes(StandardCharsets.UTF_8).length;
    }
}
