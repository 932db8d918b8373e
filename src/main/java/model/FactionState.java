package model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Mutable per-faction state. Only the engine writes to it during a turn; the raw setters
 * exist for the engine's clamped helpers, initial setup and save restore.
 */
public final class FactionState {

    public static final int MIN_SECURITY_LEVEL = 1;
    public static final int MAX_SECURITY_LEVEL = 5;

    private final String id;
    private final String name;
    private final FactionType type;
    private final Resources resources;
    private final ResearchPool research = new ResearchPool();
    private final Set<String> unlockedTechs = new LinkedHashSet<>();

    private double safetyCulture;
    private double opsec;
    private double capabilityScore;
    private double safetyScore;
    private double exposure;
    private boolean canDeployAgi;
    private double publicOpinion;
    private int securityLevel;

    public FactionState(String id, String name, FactionType type, Resources resources) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = Objects.requireNonNull(name, "name");
        this.type = Objects.requireNonNull(type, "type");
        this.resources = (resources != null) ? resources : new Resources();
    }

    public String id()          { return id; }
    public String name()        { return name; }
    public FactionType type()   { return type; }
    public boolean isLab()      { return type == FactionType.LAB; }
    public boolean isGovernment() { return type == FactionType.GOVERNMENT; }

    public Resources resources()   { return resources; }
    public ResearchPool research() { return research; }

    public double safetyCulture()   { return safetyCulture; }
    public double opsec()           { return opsec; }
    public double capabilityScore() { return capabilityScore; }
    public double safetyScore()     { return safetyScore; }
    public double exposure()        { return exposure; }
    public boolean canDeployAgi()   { return canDeployAgi; }
    public double publicOpinion()   { return publicOpinion; }
    public int securityLevel()      { return securityLevel; }

    public double stat(StatKey key) {
        return (key == StatKey.OPSEC) ? opsec : safetyCulture;
    }

    public double score(ScoreKey key) {
        return (key == ScoreKey.CAPABILITY) ? capabilityScore : safetyScore;
    }

    /** Read-only view; ids appear in unlock order. */
    public Set<String> unlockedTechs() { return Collections.unmodifiableSet(unlockedTechs); }

    public boolean hasTech(String techId) { return unlockedTechs.contains(techId); }

    /** @return false when the tech was already unlocked (nothing changes). */
    public boolean unlockTech(String techId) { return unlockedTechs.add(techId); }

    // ----- raw setters (no clamping) -----
    public void setStat(StatKey key, double value) {
        if (key == StatKey.OPSEC) opsec = value; else safetyCulture = value;
    }
    public void setScore(ScoreKey key, double value) {
        if (key == ScoreKey.CAPABILITY) capabilityScore = value; else safetyScore = value;
    }
    public void setSafetyCulture(double v)   { this.safetyCulture = v; }
    public void setOpsec(double v)           { this.opsec = v; }
    public void setCapabilityScore(double v) { this.capabilityScore = v; }
    public void setSafetyScore(double v)     { this.safetyScore = v; }
    public void setExposure(double v)        { this.exposure = v; }
    public void setPublicOpinion(double v)   { this.publicOpinion = v; }
    public void setSecurityLevel(int v)      { this.securityLevel = v; }

    /** AGI capability is granted once by a tech effect and never revoked. */
    public void grantAgiCapability() { this.canDeployAgi = true; }

    /** Restore path only. */
    public void restoreAgiCapability(boolean value) { this.canDeployAgi = value; }

    public FactionState copy() {
        FactionState f = new FactionState(id, name, type, resources.copy());
        for (Branch b : Branch.values()) f.research.set(b, research.get(b));
        f.unlockedTechs.addAll(unlockedTechs);
        f.safetyCulture = safetyCulture;
        f.opsec = opsec;
        f.capabilityScore = capabilityScore;
        f.safetyScore = safetyScore;
        f.exposure = exposure;
        f.canDeployAgi = canDeployAgi;
        f.publicOpinion = publicOpinion;
        f.securityLevel = securityLevel;
        return f;
    }

    @Override public String toString() { return name + " (" + id + ")"; }
}
