package ai.acsl.injector.inject;

import ai.acsl.injector.tree.SourceText;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies injection points to raw source text. Predicates go right after the include header; function and
 * loop fragments are inserted into the body in descending byte order so that every pending offset stays
 * valid. The result is not meant to be fed back through injection: inserted text looks like source.
 */
public class TextSplicer {

    private static final Logger LOGGER = LoggerFactory.getLogger(TextSplicer.class);
    private static final Pattern BLANK_LINE_RUNS = Pattern.compile("\\n\\s*\\n\\s*\\n+");
    private static final String PART_SEPARATOR = "\n\n";

    private final Pattern includePattern;

    public TextSplicer() {
        this(SourceLayout.DEFAULT_INCLUDE_PATTERN);
    }

    public TextSplicer(Pattern includePattern) {
        this.includePattern = Objects.requireNonNull(includePattern, "includePattern");
    }

    /**
     * @param sourceText the text the injection points were planned against
     * @param fragments  the fragment sequence the points index into
     * @param points     injection points ordered by descending byte position
     * @throws InjectionException when a point is out of order, outside the body or indexes a missing fragment
     */
    public String splice(String sourceText, FragmentList fragments, List<InjectionPoint> points) {
        Objects.requireNonNull(sourceText, "sourceText");
        Objects.requireNonNull(fragments, "fragments");
        Objects.requireNonNull(points, "points");

        SourceLayout layout = SourceLayout.split(sourceText, includePattern);
        String body = insertFragments(layout, fragments, points);

        List<String> parts = new ArrayList<>(3);
        if (!layout.header().isEmpty()) {
            parts.add(layout.header());
        }
        String predicates = fragments.predicates().stream()
                .filter(predicate -> !predicate.isBlank())
                .map(String::strip)
                .collect(Collectors.joining(PART_SEPARATOR));
        if (!predicates.isEmpty()) {
            parts.add(predicates);
        }
        parts.add(body);

        String assembled = String.join(PART_SEPARATOR, parts);
        return BLANK_LINE_RUNS.matcher(assembled).replaceAll(PART_SEPARATOR).strip();
    }

    private String insertFragments(SourceLayout layout, FragmentList fragments, List<InjectionPoint> points) {
        SourceText body = new SourceText(layout.body());
        byte[] buffer = layout.body().getBytes(StandardCharsets.UTF_8);
        int previous = Integer.MAX_VALUE;
        for (InjectionPoint point : points) {
            if (point.bytePosition() > previous) {
                throw new InjectionException("Injection points must be ordered by descending byte position: "
                        + point.bytePosition() + " follows " + previous);
            }
            previous = point.bytePosition();

            int offset = point.bytePosition() - layout.bodyStartByte();
            if (offset < 0 || offset > body.byteLength()) {
                throw new InjectionException("Injection point for " + point.contextLabel() + " at byte "
                        + point.bytePosition() + " lies outside the source body");
            }
            if (!body.isCharBoundary(offset)) {
                throw new InjectionException("Injection point for " + point.contextLabel() + " at byte "
                        + point.bytePosition() + " splits a character");
            }
            String fragment = fragmentText(fragments, point);
            if (fragment.isBlank()) {
                continue;
            }
            byte[] insertion = (fragment.strip() + "\n").getBytes(StandardCharsets.UTF_8);
            byte[] expanded = new byte[buffer.length + insertion.length];
            System.arraycopy(buffer, 0, expanded, 0, offset);
            System.arraycopy(insertion, 0, expanded, offset, insertion.length);
            System.arraycopy(buffer, offset, expanded, offset + insertion.length, buffer.length - offset);
            buffer = expanded;
            LOGGER.debug("Inserted fragment {} before {} (line {})", point.fragmentIndex(), point.contextLabel(), point.lineNumber());
        }
        return new String(buffer, StandardCharsets.UTF_8);
    }

    private static String fragmentText(FragmentList fragments, InjectionPoint point) {
        try {
            return fragments.fragment(point.fragmentIndex());
        } catch (IndexOutOfBoundsException ex) {
            throw new InjectionException("Injection point for " + point.contextLabel() + " has no fragment", ex);
        }
    }
}
