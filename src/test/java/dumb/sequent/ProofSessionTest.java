package dumb.sequent;

import org.json.JSONObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static dumb.sequent.ProofNode.Status.CLOSED;
import static dumb.sequent.ProofNode.Status.OPEN;
import static dumb.sequent.RuleException.Reason.*;
import static dumb.sequent.Side.LHS;
import static dumb.sequent.Side.RHS;
import static org.junit.jupiter.api.Assertions.*;

class ProofSessionTest extends AbstractProofTest {

    private ProofSession session;

    @BeforeEach
    void setUp() {
        session = new ProofSession();
    }

    private List<ProofNode> apply(int node, String rule, Side side, int index) throws Exception {
        return session.apply(node, rule, side, index, null);
    }

    @Test
    void identityClosesImmediately() throws Exception {
        session.start("p |- p");
        assertTrue(apply(0, "id", null, -1).isEmpty());
        assertEquals(CLOSED, session.status());
        assertTrue(session.tree().openLeaves().isEmpty());
    }

    @Test
    void conjunctionOnTheLeft() throws Exception {
        session.start("p and q |- p");
        var children = apply(0, "∧L", LHS, 0);
        assertEquals(1, children.size());
        assertEquals(seq("p, q |- p"), children.get(0).sequent);
        assertEquals(OPEN, session.status());
        apply(children.get(0).id, "id", LHS, 0);
        assertEquals(CLOSED, session.status());
    }

    @Test
    void skipOnTheLeft() throws Exception {
        session.start("[skip]P |- P");
        var child = apply(0, "[skip]L", LHS, 0).get(0);
        assertEquals(seq("P |- P"), child.sequent);
        apply(child.id, "id", null, -1);
        assertEquals(CLOSED, session.status());
    }

    @Test
    void sequenceThenSkip() throws Exception {
        session.start("[skip; a]Q |- [a]Q");
        var n1 = apply(0, "[;]L", LHS, 0).get(0);
        assertEquals(seq("[skip][a]Q |- [a]Q"), n1.sequent);
        var n2 = apply(n1.id, "[skip]L", LHS, 0).get(0);
        assertEquals(seq("[a]Q |- [a]Q"), n2.sequent);
        apply(n2.id, "id", null, -1);
        assertEquals(CLOSED, session.status());
    }

    @Test
    void contractionThenIdentity() throws Exception {
        session.start("p, p |- p");
        var child = apply(0, "CL", null, -1).get(0);
        assertEquals(seq("p |- p"), child.sequent);
        apply(child.id, "id", null, -1);
        assertEquals(CLOSED, session.status());
    }

    @Test
    void failedRuleLeavesTheTreeUntouched() throws Exception {
        session.start("p or q |- r");
        var e = assertThrows(RuleException.class, () -> apply(0, "andL", LHS, 0));
        assertEquals(PRECONDITION_FAILED, e.reason());
        var root = session.tree().root;
        assertTrue(root.isOpenLeaf());
        assertTrue(root.children().isEmpty());
        assertEquals(1, session.tree().nodes().size());

        var children = apply(0, "orL", LHS, 0);
        assertEquals(List.of(1, 2), children.stream().map(n -> n.id).toList());
    }

    @Test
    void expandedNodeIsNotOpen() throws Exception {
        session.start("p and q |- p");
        apply(0, "andL", LHS, 0);
        assertEquals(NODE_NOT_OPEN, assertThrows(RuleException.class, () -> apply(0, "andL", LHS, 0)).reason());
    }

    @Test
    void closedLeafIsNotOpen() throws Exception {
        session.start("p |- p");
        apply(0, "id", null, -1);
        assertEquals(NODE_NOT_OPEN, assertThrows(RuleException.class, () -> apply(0, "id", null, -1)).reason());
    }

    @Test
    void unknownNodeAndRule() throws Exception {
        session.start("p |- p");
        assertEquals(UNKNOWN_NODE, assertThrows(RuleException.class, () -> apply(42, "id", null, -1)).reason());
        assertEquals(UNKNOWN_RULE, assertThrows(RuleException.class, () -> apply(0, "frobnicate", null, -1)).reason());
    }

    @Test
    void noProofStarted() {
        assertFalse(session.started());
        assertThrows(IllegalStateException.class, () -> session.tree());
    }

    @Test
    void closurePropagatesOnlyWhenEveryBranchCloses() throws Exception {
        session.start("p, q |- p and q");
        var branches = apply(0, "andR", RHS, 0);
        assertEquals(2, branches.size());
        assertEquals(2, session.tree().root.application().orElseThrow().premises());
        apply(branches.get(0).id, "id", null, -1);
        assertTrue(branches.get(0).isClosed());
        assertEquals(OPEN, session.status());
        assertEquals(List.of(branches.get(1)), session.tree().openLeaves());

        apply(branches.get(1).id, "id", null, -1);
        assertEquals(CLOSED, session.status());
        assertTrue(session.tree().nodes().stream().allMatch(ProofNode::isClosed));
    }

    @Test
    void nodeMissingARequiredPremiseStaysOpen() {
        var root = new ProofNode(0, seq("p, q |- p and q"), null);
        var left = new ProofNode(1, seq("p, q |- p"), root);
        left.expand(new ProofNode.Application("id", null, -1, null, 0), List.of());
        assertTrue(left.recompute());
        assertTrue(left.isClosed());

        root.expand(new ProofNode.Application("∧R", RHS, 0, null, 2), List.of(left));
        assertFalse(root.recompute());
        assertEquals(OPEN, root.status());
    }

    @Test
    void parentLinksAndDepth() throws Exception {
        session.start("|- p -> (q -> p)");
        var n1 = apply(0, "impR", RHS, 0).get(0);
        var n2 = apply(n1.id, "impR", RHS, 0).get(0);
        assertEquals(2, n2.depth());
        assertSame(n1, n2.parent().orElseThrow());
        assertSame(session.tree().root, n1.parent().orElseThrow());
        assertTrue(session.tree().root.parent().isEmpty());
        assertSame(n2, session.tree().find(n2.id).orElseThrow());
    }

    @Test
    void ruleArgumentIsParsed() throws Exception {
        session.start("forall x. p(x) |- p(c)");
        var child = session.apply(0, "allL", LHS, 0, "c").get(0);
        assertEquals(seq("forall x. p(x), p(c) |- p(c)"), child.sequent);
        var application = session.tree().root.application().orElseThrow();
        assertEquals("∀L", application.rule());
        assertEquals("c", application.argument());
        apply(child.id, "id", null, -1);
        assertEquals(CLOSED, session.status());
    }

    @Test
    void whileInvariantProof() throws Exception {
        session.start("x = 0, n >= 0 |- [while x < n do x := x + 1]x = n");
        var goals = session.apply(0, "whileInv", RHS, 0, "x <= n");
        assertEquals(3, goals.size());
        assertEquals(seq("x ≤ n, not x < n |- x = n"), goals.get(2).sequent);
        assertEquals(3, session.tree().openLeaves().size());
    }

    @Test
    void restartResetsFreshNames() throws Exception {
        session.start("|- forall x. p(x)");
        assertEquals(seq("|- p(x_1)"), apply(0, "allR", RHS, 0).get(0).sequent);
        session.start("|- forall x. p(x)");
        assertEquals(1, session.tree().nodes().size());
        assertEquals(seq("|- p(x_1)"), apply(0, "allR", RHS, 0).get(0).sequent);
    }

    @Test
    void templateRuleByName() throws Exception {
        session.register(RuleTemplate.unary("orSwap", RHS, "RIGHT, LEFT"));
        session.start("|- p or q");
        var child = apply(0, "orSwap", null, 0).get(0);
        assertEquals(seq("|- q, p"), child.sequent);
        assertEquals("orSwap", session.tree().root.application().orElseThrow().rule());
        assertEquals(1, session.tree().root.application().orElseThrow().premises());
    }

    @Test
    void closingTemplateRecordsNoPremises() throws Exception {
        session.register(RuleTemplate.close("trusted", RHS));
        session.start("|- p");
        assertTrue(apply(0, "trusted", null, 0).isEmpty());
        assertEquals(0, session.tree().root.application().orElseThrow().premises());
        assertEquals(CLOSED, session.status());
    }

    @Test
    void export() throws Exception {
        session.start("p and q |- p");
        var child = apply(0, "andL", LHS, 0).get(0);
        apply(child.id, "id", null, -1);

        var d = session.export();
        assertTrue(d.closed());
        assertEquals("∧L", d.rule());
        assertEquals(1, d.premises().size());
        assertEquals("id", d.premises().get(0).rule());
        assertTrue(d.premises().get(0).premises().isEmpty());

        var json = new JSONObject(d.toJson().toString());
        assertTrue(json.getBoolean("closed"));
        assertEquals("(p ∧ q) ⊢ p", json.getJSONObject("sequent").getString("text"));
        assertEquals("and", json.getJSONObject("sequent").getJSONArray("lhs").getJSONObject(0).getString("type"));
    }

    @Test
    void treeRendering() throws Exception {
        session.start("p and q |- p");
        apply(0, "andL", LHS, 0);
        var text = session.tree().toString();
        assertTrue(text.contains("#0 (p ∧ q) ⊢ p   by ∧L LHS 0"), text);
        assertTrue(text.contains("  #1 p, q ⊢ p"), text);
    }
}
