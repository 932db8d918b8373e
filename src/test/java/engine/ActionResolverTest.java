package engine;

import config.ConfigManager;
import model.ActionChoice;
import model.Branch;
import model.FactionState;
import model.GameState;
import model.Openness;
import model.ResourceKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ActionResolverTest {

    private ActionResolver resolver;
    private TurnLog log;
    private List<FactionState> deployers;

    @BeforeEach
    void setUp() {
        ConfigManager cfg = ConfigManager.getInstance();
        resolver = new ActionResolver(cfg.getRules(), cfg.getActions());
        log = new TurnLog();
        deployers = new ArrayList<>();
    }

    private boolean resolve(GameState s, FactionState f, ActionChoice c) {
        return resolver.resolve(s, f, c, Fixtures.script(), log, deployers);
    }

    private static boolean logged(TurnLog log, String fragment) {
        return log.entries().stream().anyMatch(e -> e.contains(fragment));
    }

    @Test
    void deployProductsAddsCapitalAndTrust() {
        FactionState lab = Fixtures.lab("a");
        lab.resources().set(ResourceKey.CAPITAL, 35);
        GameState s = Fixtures.world(1, lab);

        assertTrue(resolve(s, lab, ActionChoice.open("deploy_products")));

        assertEquals(47, lab.resources().capital(), 1e-9);
        // +2 from the action, +2 for acting openly
        assertEquals(54, lab.resources().trust(), 1e-9);
        assertEquals(0, lab.exposure(), 1e-9);
    }

    @Test
    void secretActionAccumulatesExposureAndScalesResearch() {
        FactionState open = Fixtures.lab("a");
        FactionState secret = Fixtures.lab("b");
        GameState s = Fixtures.world(1, open, secret);

        resolve(s, open, ActionChoice.open("research_capabilities"));
        resolve(s, secret, ActionChoice.secret("research_capabilities"));

        double base = Stats.computeResearchGain(Fixtures.lab("x"), Branch.CAPABILITIES, 12);
        assertEquals(base * 0.9, open.research().get(Branch.CAPABILITIES), 1e-9);
        assertEquals(base * 1.1, secret.research().get(Branch.CAPABILITIES), 1e-9);
        assertEquals(1, secret.exposure(), 1e-9);
        assertEquals(47, secret.resources().trust(), 1e-9);
        assertEquals(1, secret.capabilityScore(), 1e-9);
    }

    @Test
    void wrongFactionTypeIsRejectedWithoutMutation() {
        FactionState gov = Fixtures.gov("g");
        GameState s = Fixtures.world(1, gov);

        assertFalse(resolve(s, gov, ActionChoice.open("research_capabilities")));

        assertTrue(logged(log, "invalid action"));
        assertEquals(0, gov.research().get(Branch.CAPABILITIES), 1e-9);
        assertEquals(50, gov.resources().trust(), 1e-9);
    }

    @Test
    void factionSpecificActionIsRejectedForOthers() {
        FactionState lab = Fixtures.lab("us_lab_b");
        GameState s = Fixtures.world(1, lab);

        assertFalse(resolve(s, lab, ActionChoice.open("open_research")));
        assertTrue(logged(log, "not available"));
    }

    @Test
    void unknownActionIsLoggedNotThrown() {
        FactionState lab = Fixtures.lab("a");
        GameState s = Fixtures.world(1, lab);

        assertFalse(resolve(s, lab, ActionChoice.open("warp_drive")));
        assertTrue(logged(log, "unknown action warp_drive"));
    }

    @Test
    void missingOpennessIsRejected() {
        FactionState lab = Fixtures.lab("a");
        GameState s = Fixtures.world(1, lab);

        assertFalse(resolve(s, lab, new ActionChoice("deploy_products", null)));
        assertEquals(50, lab.resources().capital(), 1e-9);
    }

    @Test
    void subsidizeFundsTargetLab() {
        FactionState gov = Fixtures.gov("g");
        FactionState lab = Fixtures.lab("a");
        GameState s = Fixtures.world(1, lab, gov);

        resolve(s, gov, ActionChoice.open("subsidize").targeting("a"));

        assertEquals(56, lab.resources().capital(), 1e-9);
        assertEquals(42, gov.resources().capital(), 1e-9);
        assertTrue(logged(log, "subsidized"));
    }

    @Test
    void subsidizeIgnoresNonLabTarget() {
        FactionState gov = Fixtures.gov("g");
        FactionState other = Fixtures.gov("h");
        GameState s = Fixtures.world(1, gov, other);

        resolve(s, gov, ActionChoice.open("subsidize").targeting("h"));

        assertEquals(50, other.resources().capital(), 1e-9);
        assertTrue(logged(log, "needs a lab target"));
    }

    @Test
    void regulatePenalizesTargetLab() {
        FactionState gov = Fixtures.gov("g");
        FactionState lab = Fixtures.lab("a");
        lab.setCapabilityScore(30);
        GameState s = Fixtures.world(1, lab, gov);

        resolve(s, gov, ActionChoice.open("regulate").targeting("a"));

        assertEquals(44, lab.resources().compute(), 1e-9);
        assertEquals(48, lab.resources().influence(), 1e-9);
        assertEquals(26, lab.capabilityScore(), 1e-9);
    }

    @Test
    void executiveOrderAlsoRaisesIssuerSafety() {
        FactionState gov = Fixtures.gov("us_gov");
        FactionState lab = Fixtures.lab("a");
        lab.setCapabilityScore(30);
        GameState s = Fixtures.world(1, lab, gov);

        resolve(s, gov, ActionChoice.open("executive_order").targeting("a"));

        assertEquals(42, lab.resources().compute(), 1e-9);
        assertEquals(24, lab.capabilityScore(), 1e-9);
        // +1 for acting openly, +2 from the order
        assertEquals(3, gov.safetyScore(), 1e-9);
    }

    @Test
    void defensiveMeasuresRaiseOpsecAndSecurityLevel() {
        FactionState lab = Fixtures.lab("a");
        GameState s = Fixtures.world(1, lab);

        resolve(s, lab, ActionChoice.open("defensive_measures"));

        assertEquals(54, lab.opsec(), 1e-9);
        assertEquals(2, lab.securityLevel());
    }

    @Test
    void counterintelRaisesOpsec() {
        FactionState gov = Fixtures.gov("g");
        GameState s = Fixtures.world(1, gov);

        resolve(s, gov, ActionChoice.open("counterintel"));

        assertEquals(56, gov.opsec(), 1e-9);
    }

    @Test
    void allianceIsSymmetricAndIdempotent() {
        FactionState a = Fixtures.gov("a");
        FactionState b = Fixtures.gov("b");
        GameState s = Fixtures.world(1, a, b);
        s.setTension("a", "b", 20);

        resolve(s, a, ActionChoice.open("form_alliance").targeting("b"));
        resolve(s, b, ActionChoice.open("form_alliance").targeting("a"));

        assertEquals(List.of("b"), s.alliesOf("a"));
        assertEquals(List.of("a"), s.alliesOf("b"));
        assertEquals(10, s.tension("a", "b"), 1e-9);
        assertTrue(s.treaties().contains("treaty:a|b"));
        assertTrue(logged(log, "reaffirmed its alliance"));
    }

    @Test
    void allianceWithSelfDoesNothing() {
        FactionState a = Fixtures.lab("a");
        GameState s = Fixtures.world(1, a);

        resolve(s, a, ActionChoice.open("form_alliance").targeting("a"));

        assertTrue(s.alliesOf("a").isEmpty());
    }

    @Test
    void openSourceReleaseLeaksToOtherLabsOnly() {
        FactionState a = Fixtures.lab("a");
        FactionState b = Fixtures.lab("b");
        FactionState g = Fixtures.gov("g");
        a.setCapabilityScore(20);
        GameState s = Fixtures.world(1, a, b, g);

        resolve(s, a, ActionChoice.open("open_source_release"));

        assertEquals(17, a.capabilityScore(), 1e-9);
        assertEquals(2, b.capabilityScore(), 1e-9);
        assertEquals(0, g.capabilityScore(), 1e-9);
    }

    @Test
    void deployAgiNeedsBreakthrough() {
        FactionState lab = Fixtures.lab("a");
        GameState s = Fixtures.world(1, lab);

        resolve(s, lab, ActionChoice.open("deploy_agi"));
        assertTrue(deployers.isEmpty());
        assertTrue(logged(log, "without the breakthrough"));

        lab.grantAgiCapability();
        resolve(s, lab, ActionChoice.open("deploy_agi"));
        assertEquals(List.of(lab), deployers);
    }

    @Test
    void espionageWithoutTargetIsLogged() {
        FactionState lab = Fixtures.lab("a");
        GameState s = Fixtures.world(1, lab);

        resolve(s, lab, new ActionChoice("espionage", Openness.SECRET, "a"));

        assertTrue(logged(log, "no valid target"));
        assertEquals(2, lab.exposure(), 1e-9);
    }
}
