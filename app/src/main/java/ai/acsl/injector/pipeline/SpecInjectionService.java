package ai.acsl.injector.pipeline;

import ai.acsl.injector.inject.FragmentList;
import ai.acsl.injector.inject.InjectionPlanner;
import ai.acsl.injector.inject.InjectionPoint;
import ai.acsl.injector.inject.TextSplicer;
import ai.acsl.injector.structure.CodeStructure;
import ai.acsl.injector.structure.ComparisonResult;
import ai.acsl.injector.structure.StructureComparator;
import ai.acsl.injector.structure.StructureExtractor;
import ai.acsl.injector.structure.StructureReport;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validates that a candidate keeps the reference's structure and, only then, splices the fragments into
 * the candidate.
 *
 * <p>Malformed fragment sequences ({@link ai.acsl.injector.inject.MalformedFragmentListException}) and
 * unparseable sources ({@link ai.acsl.injector.tree.SourceParseException}) propagate to the caller; a
 * structural mismatch or a failed splice comes back as a failed {@link InjectionResult}.
 */
public class SpecInjectionService {

    private static final Logger LOGGER = LoggerFactory.getLogger(SpecInjectionService.class);

    private final StructureExtractor extractor;
    private final StructureComparator comparator;
    private final InjectionPlanner planner;
    private final TextSplicer splicer;
    private final StructureReport report;
    private final boolean diagnostics;

    public SpecInjectionService() {
        this(new StructureExtractor(), new StructureComparator(), new InjectionPlanner(), new TextSplicer(), false);
    }

    public SpecInjectionService(StructureExtractor extractor, StructureComparator comparator, InjectionPlanner planner,
                                TextSplicer splicer, boolean diagnostics) {
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.comparator = Objects.requireNonNull(comparator, "comparator");
        this.planner = Objects.requireNonNull(planner, "planner");
        this.splicer = Objects.requireNonNull(splicer, "splicer");
        this.report = new StructureReport();
        this.diagnostics = diagnostics;
    }

    /**
     * Validates the raw fragment sequence, then behaves like {@link #validateAndInject(String, String, FragmentList)}.
     */
    public InjectionResult validateAndInject(String referenceText, String candidateText, Object rawFragments) {
        return validateAndInject(referenceText, candidateText, FragmentList.from(rawFragments));
    }

    public InjectionResult validateAndInject(String referenceText, String candidateText, FragmentList fragments) {
        Objects.requireNonNull(referenceText, "referenceText");
        Objects.requireNonNull(candidateText, "candidateText");
        Objects.requireNonNull(fragments, "fragments");

        CodeStructure reference = extractor.extract(referenceText);
        CodeStructure candidate = extractor.extract(candidateText);
        ComparisonResult comparison = comparator.compare(reference, candidate);
        if (diagnostics) {
            LOGGER.info("Structure comparison:\n{}", report.renderComparison(reference, candidate, comparison));
        }
        if (!comparison.matches()) {
            String diagnostic = comparison.diagnostic().orElse("structures differ");
            LOGGER.info("Rejecting candidate: {}", diagnostic);
            return InjectionResult.failed("Validation failed: " + diagnostic);
        }

        try {
            List<InjectionPoint> points = planner.plan(candidate, fragments);
            LOGGER.debug("Planned {} injection points over {} slots", points.size(), candidate.slotCount());
            return InjectionResult.succeeded(splicer.splice(candidateText, fragments, points));
        } catch (RuntimeException ex) {
            LOGGER.warn("Injection failed: {}", ex.getMessage(), ex);
            return InjectionResult.failed("Injection failed: " + ex.getMessage());
        }
    }

    public CodeStructure extract(String sourceText) {
        return extractor.extract(sourceText);
    }

    public ComparisonResult compare(String referenceText, String candidateText) {
        return comparator.compare(extractor.extract(referenceText), extractor.extract(candidateText));
    }
}
