package model;

import java.util.EnumMap;
import java.util.Map;

/** Accumulated research points per branch. Points are spent down by tech unlocks. */
public final class ResearchPool {
    private final EnumMap<Branch, Double> points = new EnumMap<>(Branch.class);

    public ResearchPool() {
        for (Branch b : Branch.values()) points.put(b, 0.0);
    }

    public double get(Branch branch)               { return points.get(branch); }
    public void   set(Branch branch, double value) { points.put(branch, value); }
    public void   add(Branch branch, double delta) { points.put(branch, points.get(branch) + delta); }

    /**
     * Branch holding the most points. Ties resolve to the branch declared first,
     * which matches a stable descending sort over the declaration order.
     */
    public Branch largest() {
        Branch best = Branch.values()[0];
        for (Branch b : Branch.values()) {
            if (points.get(b) > points.get(best)) best = b;
        }
        return best;
    }

    public Map<Branch, Double> view() { return java.util.Collections.unmodifiableMap(new EnumMap<>(points)); }

    public ResearchPool copy() {
        ResearchPool p = new ResearchPool();
        p.points.putAll(points);
        return p;
    }

    @Override public boolean equals(Object o) {
        return o instanceof ResearchPool p && p.points.equals(points);
    }
    @Override public int hashCode() { return points.hashCode(); }
    @Override public String toString() { return points.toString(); }
}
