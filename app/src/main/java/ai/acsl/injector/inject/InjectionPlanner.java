package ai.acsl.injector.inject;

import ai.acsl.injector.structure.CodeStructure;
import ai.acsl.injector.structure.FunctionInfo;
import ai.acsl.injector.structure.LoopInfo;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps a fragment sequence onto the slots of a structure: per function, its specification, then one
 * fragment per loop. Running out of fragments stops planning without error and surplus fragments are
 * ignored.
 */
public class InjectionPlanner {

    private static final Logger LOGGER = LoggerFactory.getLogger(InjectionPlanner.class);

    /**
     * Descending byte position; on a tie the higher fragment index comes first so that, once inserted,
     * fragments read in sequence order.
     */
    static final Comparator<InjectionPoint> APPLY_ORDER = Comparator
            .comparingInt(InjectionPoint::bytePosition)
            .thenComparingInt(InjectionPoint::fragmentIndex)
            .reversed();

    public List<InjectionPoint> plan(CodeStructure structure, FragmentList fragments) {
        Objects.requireNonNull(structure, "structure");
        Objects.requireNonNull(fragments, "fragments");

        List<InjectionPoint> points = new ArrayList<>();
        int cursor = 1;
        for (FunctionInfo function : structure.functions()) {
            if (cursor < fragments.size()) {
                addIfPresent(points, fragments, new InjectionPoint(InjectionPointKind.FUNCTION, function.bytePosition(),
                        function.lineNumber(), cursor, "function '" + function.name() + "'"));
                cursor++;
            }
            for (int i = 0; i < function.loops().size(); i++) {
                LoopInfo loop = function.loops().get(i);
                if (cursor < fragments.size()) {
                    addIfPresent(points, fragments, new InjectionPoint(InjectionPointKind.LOOP, loop.bytePosition(),
                            loop.lineNumber(), cursor,
                            "loop " + i + " in function '" + function.name() + "' (" + loop.kind().label() + " loop)"));
                    cursor++;
                }
            }
        }
        if (cursor - 1 < structure.slotCount()) {
            LOGGER.debug("Fragments exhausted after {} of {} slots", cursor - 1, structure.slotCount());
        } else if (cursor < fragments.size()) {
            LOGGER.debug("Ignoring {} surplus fragments", fragments.size() - cursor);
        }

        points.sort(APPLY_ORDER);
        return points;
    }

    private static void addIfPresent(List<InjectionPoint> points, FragmentList fragments, InjectionPoint point) {
        if (fragments.fragment(point.fragmentIndex()).isBlank()) {
            LOGGER.trace("Skipping blank fragment {} for {}", point.fragmentIndex(), point.contextLabel());
            return;
        }
        points.add(point);
    }
}
