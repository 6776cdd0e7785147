package io.github.eutro.ssadce.test;

import io.github.eutro.ssadce.core.ext.CommonExts;
import io.github.eutro.ssadce.core.ops.Callee;
import io.github.eutro.ssadce.core.ops.CommonOps;
import io.github.eutro.ssadce.core.ops.IrOps;
import io.github.eutro.ssadce.core.ops.IrOps.BinOp;
import io.github.eutro.ssadce.core.passes.MalformedFunctionException;
import io.github.eutro.ssadce.core.passes.meta.CheckSsa;
import io.github.eutro.ssadce.core.passes.meta.StructuralError;
import io.github.eutro.ssadce.core.passes.opts.*;
import io.github.eutro.ssadce.core.ssa.*;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import static io.github.eutro.ssadce.test.Utils.*;
import static org.junit.jupiter.api.Assertions.*;

public class DeadCodeEliminationTest {
    @Test
    void testUnreachableTailRemoved() {
        Function f = new Function("tail");
        BasicBlock entry = f.newBb("entry");
        BasicBlock dead = f.newBb("dead");
        BasicBlock exit = f.newBb("exit");
        IRBuilder ib = new IRBuilder(f, entry);
        Var v1 = bin(ib, BinOp.ADD, 10, 20, "v1");
        ib.insertCtrl(CommonOps.ret(v1));
        ib.setBlock(dead);
        Var v2 = bin(ib, BinOp.SUB, 5, 3, "v2");
        ib.insertCtrl(Control.br(exit));
        ib.setBlock(exit);
        Var v3 = bin(ib, BinOp.MUL, v2, ib.constant(2), "v3");
        ib.insertCtrl(CommonOps.ret(v3));

        OptimizationStats stats = DeadCodeElimination.INSTANCE.run(f);

        assertEquals(Collections.singletonList(entry), f.blocks);
        assertEquals(Collections.singletonList("%v1 = binop add 10 20"), effects(f));
        assertEquals(2, stats.getBlocksRemoved());
        assertEquals(0, stats.getInstructionsRemoved());
        assertEquals(2, stats.getIterations());
        assertTrue(stats.isConverged());
        assertFalse(CheckSsa.INSTANCE.verify(f).isPresent());
    }

    @Test
    void testDeadChainRemovedTransitively() {
        Function f = new Function("chain");
        IRBuilder ib = new IRBuilder(f, f.newBb());
        Var v1 = bin(ib, BinOp.ADD, 1, 2, "v1");
        Var v2 = bin(ib, BinOp.MUL, v1, ib.constant(3), "v2");
        bin(ib, BinOp.SUB, v2, ib.constant(5), "v3");
        Var v4 = bin(ib, BinOp.ADD, 10, 20, "v4");
        ib.insertCtrl(CommonOps.ret(v4));

        OptimizationStats stats = DeadCodeElimination.INSTANCE.run(f);

        assertEquals(Collections.singletonList("%v4 = binop add 10 20"), effects(f));
        assertEquals(3, stats.getInstructionsRemoved());
        assertEquals(0, stats.getBlocksRemoved());
        assertEquals(2, stats.getIterations());
    }

    @Test
    void testLocalStoreWithoutLoadRemoved() {
        Function f = new Function("store");
        IRBuilder ib = new IRBuilder(f, f.newBb());
        Var p = ib.alloca("p", ValType.I64);
        ib.insert(IrOps.store(ib.constant(7), p));
        ib.insertCtrl(CommonOps.ret());

        OptimizationStats stats = DeadCodeElimination.INSTANCE.run(f);

        assertTrue(effects(f).isEmpty());
        assertEquals(2, stats.getInstructionsRemoved());
        assertTrue(stats.getConservativeDecisions().isEmpty());
    }

    @Test
    void testStoreToEscapedAllocationKept() {
        Function f = new Function("escape");
        IRBuilder ib = new IRBuilder(f, f.newBb("entry"));
        Var p = ib.alloca("p", ValType.I64);
        ib.insert(IrOps.store(ib.constant(7), p));
        ib.insert(IrOps.call(Callee.external("sink"), p));
        ib.insertCtrl(CommonOps.ret());

        OptimizationStats stats = DeadCodeElimination.INSTANCE.run(f);

        assertEquals(3, effects(f).size());
        assertEquals(0, stats.getInstructionsRemoved());
        assertEquals(1, stats.getIterations());
        List<ConservativeDecision> decisions = stats.getConservativeDecisions();
        assertTrue(decisions.contains(new ConservativeDecision("store 7 %p", "entry", ConservativeReason.ESCAPED_POINTER)),
                decisions::toString);
        assertTrue(decisions.contains(new ConservativeDecision("call extern sink %p", "entry", ConservativeReason.POTENTIAL_SIDE_EFFECT)),
                decisions::toString);
    }

    @Test
    void testStoreThroughDerivedPointerKept() {
        Function f = new Function("alias");
        IRBuilder ib = new IRBuilder(f, f.newBb("entry"));
        Var p = ib.alloca("p", ValType.I64);
        Var q = ib.insert(IrOps.gep(p, ib.constant(1)), "q", ValType.PTR);
        ib.insert(IrOps.store(ib.constant(7), q));
        ib.insertCtrl(CommonOps.ret());

        OptimizationStats stats = DeadCodeElimination.INSTANCE.run(f);

        assertEquals(3, effects(f).size());
        assertEquals(Collections.singletonList(ConservativeReason.MAY_ALIAS),
                stats.getConservativeDecisions().stream().map(d -> d.reason).collect(Collectors.toList()));
    }

    @Test
    void testLoadedStoreKeptUntilLoadDies() {
        Function live = new Function("live");
        IRBuilder ib = new IRBuilder(live, live.newBb());
        Var p = ib.alloca("p", ValType.I64);
        ib.insert(IrOps.store(ib.constant(7), p));
        Var x = ib.insert(IrOps.load(p), "x");
        ib.insertCtrl(CommonOps.ret(x));
        assertFalse(DeadCodeElimination.INSTANCE.run(live).hadEffect());
        assertEquals(3, effects(live).size());

        Function dead = new Function("dead");
        ib = new IRBuilder(dead, dead.newBb());
        p = ib.alloca("p", ValType.I64);
        ib.insert(IrOps.store(ib.constant(7), p));
        ib.insert(IrOps.load(p), "x");
        ib.insertCtrl(CommonOps.ret());
        OptimizationStats stats = DeadCodeElimination.INSTANCE.run(dead);
        assertTrue(effects(dead).isEmpty());
        assertEquals(3, stats.getInstructionsRemoved());
        assertEquals(2, stats.getIterations());
    }

    @Test
    void testPhiEntryRemovedWithPredecessor() {
        Function f = new Function("phi");
        BasicBlock entry = f.newBb("entry");
        BasicBlock orphan = f.newBb("orphan");
        BasicBlock join = f.newBb("join");
        IRBuilder ib = new IRBuilder(f, entry);
        Var a = arg(ib, 0, "a");
        ib.insertCtrl(Control.br(join));
        ib.setBlock(orphan);
        Var b = arg(ib, 1, "b");
        ib.insertCtrl(Control.br(join));
        ib.setBlock(join);
        Var x = ib.insert(CommonOps.phi(Arrays.asList(entry, orphan), Arrays.asList(a, b)), "x");
        ib.insertCtrl(CommonOps.ret(x));

        OptimizationStats stats = DeadCodeElimination.INSTANCE.run(f);

        assertEquals(1, stats.getBlocksRemoved());
        assertEquals(0, stats.getInstructionsRemoved());
        Effect phi = join.getEffects().get(0);
        assertSame(CommonOps.PHI, phi.insn().op.key);
        assertEquals(Collections.singletonList(entry), CommonOps.PHI.cast(phi.insn().op).arg);
        assertEquals(Collections.singletonList(a), phi.insn().args());
        assertFalse(CheckSsa.INSTANCE.verify(f).isPresent());
    }

    @Test
    void testPhiOwnsItsPredecessorList() {
        Function f = new Function("sharedPreds");
        BasicBlock entry = f.newBb("entry");
        BasicBlock orphan = f.newBb("orphan");
        BasicBlock join = f.newBb("join");
        IRBuilder ib = new IRBuilder(f, entry);
        Var a = arg(ib, 0, "a");
        ib.insertCtrl(Control.br(join));
        ib.setBlock(orphan);
        Var b = arg(ib, 1, "b");
        ib.insertCtrl(Control.br(join));
        ib.setBlock(join);
        List<BasicBlock> preds = Collections.unmodifiableList(Arrays.asList(entry, orphan));
        Var x = ib.insert(CommonOps.PHI.create(preds).insn(a, b), "x");
        ib.insertCtrl(CommonOps.ret(x));

        OptimizationStats stats = DeadCodeElimination.INSTANCE.run(f);

        assertEquals(1, stats.getBlocksRemoved());
        assertEquals(Collections.singletonList(entry), CommonOps.PHI.immediate(join.getEffects().get(0).insn()));
        assertEquals(Arrays.asList(entry, orphan), preds);
    }

    @Test
    void testNothingToRemove() {
        Function f = new Function("clean");
        IRBuilder ib = new IRBuilder(f, f.newBb());
        Var x = arg(ib, 0, "x");
        Var y = bin(ib, BinOp.ADD, x, ib.constant(1), "y");
        ib.insertCtrl(CommonOps.ret(y));

        OptimizationStats stats = DeadCodeElimination.INSTANCE.run(f);

        assertEquals(1, stats.getIterations());
        assertEquals(0, stats.getInstructionsRemoved());
        assertEquals(0, stats.getBlocksRemoved());
        assertFalse(stats.hadEffect());
        assertTrue(stats.isConverged());
        assertTrue(stats.getWarnings().isEmpty());
        assertFalse(CheckSsa.INSTANCE.verify(f).isPresent());
    }

    @Test
    void testSecondRunIsNoop() {
        Function f = new Function("twice");
        BasicBlock entry = f.newBb("entry");
        BasicBlock dead = f.newBb("dead");
        IRBuilder ib = new IRBuilder(f, entry);
        Var x = arg(ib, 0, "x");
        bin(ib, BinOp.MUL, x, x, "sq");
        ib.insertCtrl(CommonOps.ret(x));
        ib.setBlock(dead);
        ib.insertCtrl(IrOps.unreachable());

        assertTrue(DeadCodeElimination.INSTANCE.run(f).hadEffect());
        String once = f.toString();
        OptimizationStats again = DeadCodeElimination.INSTANCE.run(f);
        assertFalse(again.hadEffect());
        assertEquals(1, again.getIterations());
        assertEquals(once, f.toString());
    }

    @Test
    void testLoopKeepsLiveValues() {
        Function f = new Function("loop");
        BasicBlock entry = f.newBb("entry");
        BasicBlock header = f.newBb("header");
        BasicBlock body = f.newBb("body");
        BasicBlock exit = f.newBb("exit");
        IRBuilder ib = new IRBuilder(f, entry);
        ib.insertCtrl(Control.br(header));

        ib.setBlock(header);
        Var i = f.newVar("i");
        Var next = f.newVar("next");
        ib.insert(CommonOps.phi(Arrays.asList(entry, body), Arrays.asList(ib.constant(0), next)), i);
        Var cond = bin(ib, BinOp.LT, i, ib.constant(10), "cond");
        ib.insertCtrl(IrOps.condBr(cond, body, exit));

        ib.setBlock(body);
        bin(ib, BinOp.MUL, i, ib.constant(2), "unused");
        ib.insert(IrOps.binary(BinOp.ADD, i, ib.constant(1)), next);
        ib.insertCtrl(Control.br(header));

        ib.setBlock(exit);
        ib.insertCtrl(CommonOps.ret(i));

        OptimizationStats stats = DeadCodeElimination.INSTANCE.run(f);

        assertEquals(1, stats.getInstructionsRemoved());
        assertEquals(0, stats.getBlocksRemoved());
        assertEquals(4, f.blocks.size());
        assertEquals(Collections.singletonList("%next = binop add %i 1"), effects(body));
        assertFalse(CheckSsa.INSTANCE.verify(f).isPresent());
    }

    @Test
    void testPureCallsOnlyRemovedWhenTrusted() {
        Function callee = new Function("square");
        CommonExts.markPure(callee);
        IRBuilder cb = new IRBuilder(callee, callee.newBb());
        Var n = arg(cb, 0, "n");
        cb.insertCtrl(CommonOps.ret(bin(cb, BinOp.MUL, n, n, "sq")));

        Function conservative = callsOnce("conservative", callee);
        OptimizationStats stats = DeadCodeElimination.INSTANCE.run(conservative);
        assertEquals(0, stats.getInstructionsRemoved());
        assertEquals(ConservativeReason.UNKNOWN_CALL_PURITY, stats.getConservativeDecisions().get(0).reason);

        Function trusting = callsOnce("trusting", callee);
        DeadCodeElimination trust = new DeadCodeElimination(DceOptions.builder().trustPureCalls(true).build());
        stats = trust.run(trusting);
        assertEquals(1, stats.getInstructionsRemoved());
        assertTrue(stats.getConservativeDecisions().isEmpty());
    }

    private static Function callsOnce(String name, Function callee) {
        Function f = new Function(name);
        IRBuilder ib = new IRBuilder(f, f.newBb());
        Var x = arg(ib, 0, "x");
        ib.insert(IrOps.call(Callee.of(callee), x), "r");
        ib.insertCtrl(CommonOps.ret(x));
        return f;
    }

    @Test
    void testDecisionsNotRecordedWhenDisabled() {
        Function f = new Function("quiet");
        IRBuilder ib = new IRBuilder(f, f.newBb());
        ib.insert(IrOps.call(Callee.external("log")));
        ib.insertCtrl(CommonOps.ret());

        DeadCodeElimination dce = new DeadCodeElimination(DceOptions.builder().recordConservativeDecisions(false).build());
        assertTrue(dce.run(f).getConservativeDecisions().isEmpty());
        assertEquals(1, effects(f).size());
    }

    @Test
    void testDecisionsDedupedAcrossRounds() {
        Function f = new Function("dedupe");
        IRBuilder ib = new IRBuilder(f, f.newBb("entry"));
        ib.insert(IrOps.call(Callee.external("log")));
        Var x = arg(ib, 0, "x");
        Var y = bin(ib, BinOp.ADD, x, x, "y");
        bin(ib, BinOp.ADD, y, y, "z");
        ib.insertCtrl(CommonOps.ret());

        OptimizationStats stats = DeadCodeElimination.INSTANCE.run(f);
        assertEquals(2, stats.getIterations());
        assertEquals(1, stats.getConservativeDecisions().size());
    }

    @Test
    void testIdenticalKeptCallsRecordedSeparately() {
        Function f = new Function("twice");
        IRBuilder ib = new IRBuilder(f, f.newBb("entry"));
        ib.insert(IrOps.call(Callee.external("log")));
        ib.insert(IrOps.call(Callee.external("log")));
        ib.insertCtrl(CommonOps.ret());

        List<ConservativeDecision> decisions = DeadCodeElimination.INSTANCE.run(f).getConservativeDecisions();
        assertEquals(2, decisions.size());
        for (ConservativeDecision decision : decisions) {
            assertEquals("call extern log", decision.instruction);
            assertEquals(ConservativeReason.POTENTIAL_SIDE_EFFECT, decision.reason);
        }
    }

    @Test
    void testIterationLimitIsAWarning() {
        Function f = new Function("limited");
        BasicBlock entry = f.newBb("entry");
        BasicBlock dead = f.newBb("dead");
        IRBuilder ib = new IRBuilder(f, entry);
        bin(ib, BinOp.ADD, 1, 2, "v");
        ib.insertCtrl(CommonOps.ret());
        ib.setBlock(dead);
        ib.insertCtrl(CommonOps.ret());

        DeadCodeElimination dce = new DeadCodeElimination(DceOptions.builder().maxIterations(1).build());
        OptimizationStats stats = dce.run(f);
        assertEquals(1, stats.getIterations());
        assertFalse(stats.isConverged());
        assertEquals(1, stats.getBlocksRemoved());
        assertEquals(1, stats.getInstructionsRemoved());
        assertEquals(1, stats.getWarnings().size());
        assertFalse(CheckSsa.INSTANCE.verify(f).isPresent());
    }

    @Test
    void testLivenessFallbackStillCorrect() {
        Function f = passThrough("fallback");
        IRBuilder ib = new IRBuilder(f, block(f, "mid"));
        Var x = block(f, "entry").getEffects().get(0).getResult();
        bin(ib, BinOp.ADD, x, x, "dead");

        DeadCodeElimination dce = new DeadCodeElimination(DceOptions.builder().maxLivenessIterations(1).build());
        OptimizationStats stats = dce.run(f);
        assertEquals(1, stats.getInstructionsRemoved());
        assertTrue(stats.isConverged());
        assertFalse(stats.getWarnings().isEmpty());
        assertTrue(stats.getWarnings().get(0).contains("liveness"));
        assertEquals(Collections.singletonList("%x = arg 0"), effects(f));
    }

    @Test
    void testDeclarationsUntouched() {
        Function decl = new Function("ext", true);
        assertSame(OptimizationStats.EMPTY, DeadCodeElimination.INSTANCE.run(decl));
    }

    @Test
    void testMalformedInputRejected() {
        Function f = new Function("broken");
        IRBuilder ib = new IRBuilder(f, f.newBb("entry"));
        bin(ib, BinOp.ADD, 1, 2, "v");

        MalformedFunctionException e = assertThrows(MalformedFunctionException.class,
                () -> DeadCodeElimination.INSTANCE.run(f));
        assertEquals("broken", e.getFunctionName());
        assertEquals(StructuralError.Kind.MISSING_TERMINATOR, e.getError().get().kind);
        assertEquals(1, effects(f).size());
    }

    @Test
    void testStatsMergeAndReport() {
        Function a = passThrough("a");
        BasicBlock orphan = a.newBb("orphan");
        orphan.setControl(CommonOps.ret());
        OptimizationStats sa = DeadCodeElimination.INSTANCE.run(a);

        Function b = new Function("b");
        IRBuilder ib = new IRBuilder(b, b.newBb());
        ib.insert(IrOps.call(Callee.external("log")));
        ib.insertCtrl(CommonOps.ret());
        OptimizationStats sb = DeadCodeElimination.INSTANCE.run(b);

        OptimizationStats merged = sa.merge(sb);
        assertEquals(1, merged.getBlocksRemoved());
        assertEquals(3, merged.getIterations());
        assertEquals(1, merged.getConservativeDecisions().size());
        assertTrue(merged.isConverged());

        String report = merged.formatReport("a+b");
        assertTrue(report.startsWith("DCE statistics for 'a+b':"), report);
        assertTrue(report.contains("blocks removed: 1"), report);
        assertTrue(report.contains("conservative decisions: 1"), report);
    }
}
