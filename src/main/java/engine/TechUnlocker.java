package engine;

import model.Branch;
import model.FactionState;
import model.ScoreKey;
import model.catalog.TechEffect;
import model.catalog.TechNode;
import model.catalog.TechTree;

import java.util.ArrayList;
import java.util.List;

/**
 * Spends research on tech nodes. Per branch, repeatedly takes the first node in declaration
 * order that is still locked, has its prerequisites, and is affordable; so one turn may
 * unlock a chain.
 */
public final class TechUnlocker {

    private final TechTree tree;

    public TechUnlocker(TechTree tree) {
        this.tree = tree;
    }

    /** @return nodes unlocked in this call, in unlock order */
    public List<TechNode> unlockAvailable(FactionState f) {
        List<TechNode> unlocked = new ArrayList<>();
        for (Branch branch : Branch.values()) {
            TechNode next;
            while ((next = nextAffordable(f, branch)) != null) {
                f.research().set(branch, f.research().get(branch) - next.cost());
                f.unlockTech(next.id());
                for (TechEffect e : next.effects()) apply(f, e);
                unlocked.add(next);
            }
        }
        return unlocked;
    }

    private TechNode nextAffordable(FactionState f, Branch branch) {
        double points = f.research().get(branch);
        for (TechNode n : tree.branch(branch)) {
            if (f.hasTech(n.id()) || n.cost() > points) continue;
            if (f.unlockedTechs().containsAll(n.prereqs())) return n;
        }
        return null;
    }

    static void apply(FactionState f, TechEffect effect) {
        if (effect instanceof TechEffect.Capability c) {
            Stats.applyScoreDelta(f, ScoreKey.CAPABILITY, c.delta());
        } else if (effect instanceof TechEffect.Safety s) {
            Stats.applyScoreDelta(f, ScoreKey.SAFETY, s.delta());
        } else if (effect instanceof TechEffect.Resource r) {
            Stats.applyResourceDelta(f, r.key(), r.delta());
        } else if (effect instanceof TechEffect.Stat s) {
            Stats.applyStatDelta(f, s.key(), s.delta());
        } else if (effect instanceof TechEffect.UnlockAgi) {
            f.grantAgiCapability();
        } else {
            throw new IllegalArgumentException("Unknown tech effect: " + effect);
        }
    }
}
