package com.boundsmith.analysis;

import com.boundsmith.model.BoundaryPredicate;
import com.boundsmith.model.Predicate;
import com.boundsmith.model.RangePredicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Fuses a lower and an upper bound on the same subject inside one conjunction into a
 * {@link RangePredicate}. Only the tightest bound of each side is fused; every other
 * predicate passes through unchanged.
 */
public class RangeFuser {

    private static final Logger logger = LoggerFactory.getLogger(RangeFuser.class);

    /**
     * Fuses the predicates of one file.
     *
     * @param predicates Predicates in source order
     * @return Ranges and single-sided predicates; a range takes the place of whichever of its sides came first
     */
    public List<BoundaryPredicate> fuse(List<Predicate> predicates) {
        Map<GroupKey, List<Predicate>> groups = new LinkedHashMap<>();
        for (Predicate predicate : predicates) {
            if (predicate.isInConjunction()) {
                groups.computeIfAbsent(new GroupKey(predicate), key -> new ArrayList<>()).add(predicate);
            }
        }

        Map<Predicate, RangePredicate> rangeBySide = new IdentityHashMap<>();
        for (List<Predicate> group : groups.values()) {
            Predicate lower = tightestLower(group);
            Predicate upper = tightestUpper(group);
            if (lower == null || upper == null) {
                continue;
            }
            if (!RangePredicate.canFuse(lower, upper)) {
                logger.debug("Not fusing {} and {}", lower, upper);
                continue;
            }
            RangePredicate range = RangePredicate.of(lower, upper);
            rangeBySide.put(lower, range);
            rangeBySide.put(upper, range);
        }

        Set<RangePredicate> emitted = Collections.newSetFromMap(new IdentityHashMap<>());
        List<BoundaryPredicate> fused = new ArrayList<>();
        for (Predicate predicate : predicates) {
            RangePredicate range = rangeBySide.get(predicate);
            if (range == null) {
                fused.add(predicate);
            } else if (emitted.add(range)) {
                fused.add(range);
            }
        }
        logger.debug("Fused {} ranges out of {} predicates", emitted.size(), predicates.size());
        return fused;
    }

    /**
     * Greatest lower-bound literal; {@code >} beats {@code >=} on the same literal.
     */
    private static Predicate tightestLower(List<Predicate> group) {
        Predicate best = null;
        for (Predicate candidate : group) {
            if (!candidate.getOperator().isLowerBound()) {
                continue;
            }
            if (best == null) {
                best = candidate;
                continue;
            }
            int order = candidate.getLiteral().compareTo(best.getLiteral());
            if (order > 0 || (order == 0 && candidate.getOperator().isStrict() && !best.getOperator().isStrict())) {
                best = candidate;
            }
        }
        return best;
    }

    /**
     * Least upper-bound literal; {@code <} beats {@code <=} on the same literal.
     */
    private static Predicate tightestUpper(List<Predicate> group) {
        Predicate best = null;
        for (Predicate candidate : group) {
            if (!candidate.getOperator().isUpperBound()) {
                continue;
            }
            if (best == null) {
                best = candidate;
                continue;
            }
            int order = candidate.getLiteral().compareTo(best.getLiteral());
            if (order < 0 || (order == 0 && candidate.getOperator().isStrict() && !best.getOperator().isStrict())) {
                best = candidate;
            }
        }
        return best;
    }

    private static final class GroupKey {
        private final int conjunction;
        private final String subject;
        private final boolean length;

        GroupKey(Predicate predicate) {
            this.conjunction = predicate.getConjunction();
            this.subject = predicate.getSubject();
            this.length = predicate.isLengthSubject();
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof GroupKey)) {
                return false;
            }
            GroupKey that = (GroupKey) o;
            return conjunction == that.conjunction && length == that.length && subject.equals(that.subject);
        }

        @Override
        public int hashCode() {
            return Objects.hash(conjunction, subject, length);
        }
    }
}
