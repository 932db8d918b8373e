package model.catalog;

import model.Branch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Prerequisite-gated research DAG. Declaration order is kept per branch because the
 * unlock search takes the first affordable node in that order.
 */
public final class TechTree {
    private final Map<String, TechNode> byId;
    private final Map<Branch, List<TechNode>> byBranch;

    public TechTree(List<TechNode> nodes) {
        Map<String, TechNode> map = new LinkedHashMap<>();
        for (TechNode n : nodes) {
            if (n.id() == null || n.id().isBlank()) throw new IllegalStateException("tech without id: " + n);
            if (n.branch() == null) throw new IllegalStateException("tech " + n.id() + " has no branch");
            if (n.cost() < 0) throw new IllegalStateException("tech " + n.id() + " has negative cost");
            if (map.put(n.id(), n) != null) throw new IllegalStateException("duplicate tech id: " + n.id());
        }
        for (TechNode n : map.values()) {
            for (String p : n.prereqs()) {
                if (!map.containsKey(p)) {
                    throw new IllegalStateException("tech " + n.id() + " requires unknown tech " + p);
                }
            }
        }
        checkAcyclic(map);

        EnumMap<Branch, List<TechNode>> branches = new EnumMap<>(Branch.class);
        for (Branch b : Branch.values()) branches.put(b, new ArrayList<>());
        for (TechNode n : map.values()) branches.get(n.branch()).add(n);
        branches.replaceAll((b, list) -> List.copyOf(list));

        this.byId = Collections.unmodifiableMap(map);
        this.byBranch = Collections.unmodifiableMap(branches);
    }

    public TechNode node(String id) { return byId.get(id); }
    public List<TechNode> branch(Branch branch) { return byBranch.get(branch); }
    public int size() { return byId.size(); }

    private static void checkAcyclic(Map<String, TechNode> nodes) {
        Map<String, Integer> mark = new HashMap<>();   // 1 = on stack, 2 = done
        for (String id : nodes.keySet()) visit(id, nodes, mark, new HashSet<>());
    }

    private static void visit(String id, Map<String, TechNode> nodes, Map<String, Integer> mark, Set<String> path) {
        Integer m = mark.get(id);
        if (m != null && m == 2) return;
        if (m != null && m == 1) throw new IllegalStateException("tech prerequisite cycle through " + id + " via " + path);
        mark.put(id, 1);
        path.add(id);
        for (String p : nodes.get(id).prereqs()) visit(p, nodes, mark, path);
        path.remove(id);
        mark.put(id, 2);
    }
}
