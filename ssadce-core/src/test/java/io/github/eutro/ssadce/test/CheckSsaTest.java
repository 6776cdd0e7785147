package io.github.eutro.ssadce.test;

import io.github.eutro.ssadce.core.ops.Callee;
import io.github.eutro.ssadce.core.ops.CommonOps;
import io.github.eutro.ssadce.core.ops.IrOps;
import io.github.eutro.ssadce.core.ops.IrOps.BinOp;
import io.github.eutro.ssadce.core.passes.meta.CheckSsa;
import io.github.eutro.ssadce.core.passes.meta.StructuralError;
import io.github.eutro.ssadce.core.passes.meta.StructuralError.Kind;
import io.github.eutro.ssadce.core.passes.meta.StructuralException;
import io.github.eutro.ssadce.core.ssa.*;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.Optional;

import static io.github.eutro.ssadce.test.Utils.*;
import static org.junit.jupiter.api.Assertions.*;

public class CheckSsaTest {
    private static Kind kindOf(Function f) {
        Optional<StructuralError> error = CheckSsa.INSTANCE.verify(f);
        assertTrue(error.isPresent(), f::toString);
        assertEquals(f.name, error.get().functionName);
        return error.get().kind;
    }

    @Test
    void testWellFormed() {
        assertFalse(CheckSsa.INSTANCE.verify(diamond("ok")).isPresent());
        assertFalse(CheckSsa.INSTANCE.verify(passThrough("ok")).isPresent());
    }

    @Test
    void testMissingEntry() {
        Function f = diamond("noEntry");
        f.setEntry(null);
        assertEquals(Kind.MISSING_ENTRY, kindOf(f));

        Function g = new Function("foreignEntry");
        g.newBb().setControl(CommonOps.ret());
        g.setEntry(new Function("other").newBb());
        assertEquals(Kind.MISSING_ENTRY, kindOf(g));
    }

    @Test
    void testMissingTerminator() {
        Function f = new Function("open");
        f.newBb().setControl(CommonOps.ret());
        f.newBb("open");
        assertEquals(Kind.MISSING_TERMINATOR, kindOf(f));
    }

    @Test
    void testDanglingTarget() {
        Function f = new Function("jump");
        BasicBlock elsewhere = new Function("other").newBb();
        f.newBb().setControl(Control.br(elsewhere));
        assertEquals(Kind.DANGLING_TARGET, kindOf(f));
    }

    @Test
    void testDuplicateDefinition() {
        Function f = new Function("twice");
        IRBuilder ib = new IRBuilder(f, f.newBb());
        Var x = f.newVar("x");
        ib.insert(CommonOps.ARG.create(0).insn(), x);
        ib.insert(CommonOps.ARG.create(1).insn(), x);
        ib.insertCtrl(CommonOps.ret(x));
        assertEquals(Kind.DUPLICATE_DEFINITION, kindOf(f));
    }

    @Test
    void testDanglingOperand() {
        Function f = new Function("undefined");
        IRBuilder ib = new IRBuilder(f, f.newBb());
        Var ghost = f.newVar("ghost");
        bin(ib, BinOp.ADD, ghost, ib.constant(1), "y");
        ib.insertCtrl(CommonOps.ret());
        assertEquals(Kind.DANGLING_OPERAND, kindOf(f));

        Function g = new Function("undefinedReturn");
        g.newBb().setControl(CommonOps.ret(g.newVar("ghost")));
        assertEquals(Kind.DANGLING_OPERAND, kindOf(g));
    }

    @Test
    void testOperandCount() {
        Function store = new Function("store");
        IRBuilder ib = new IRBuilder(store, store.newBb());
        ib.insert(IrOps.STORE.insn(ib.constant(1)));
        ib.insertCtrl(CommonOps.ret());
        assertEquals(Kind.OPERAND_COUNT, kindOf(store));

        Function ret = new Function("ret");
        ib = new IRBuilder(ret, ret.newBb());
        ib.insertCtrl(CommonOps.ret(ib.constant(1), ib.constant(2)));
        assertEquals(Kind.OPERAND_COUNT, kindOf(ret));

        Function branch = new Function("branch");
        BasicBlock entry = branch.newBb();
        BasicBlock exit = branch.newBb();
        entry.setControl(IrOps.COND_BR.insn().jumpsTo(exit, exit));
        exit.setControl(CommonOps.ret());
        assertEquals(Kind.OPERAND_COUNT, kindOf(branch));

        Function calls = new Function("calls");
        ib = new IRBuilder(calls, calls.newBb());
        ib.insert(IrOps.call(Callee.external("log"), ib.constant(1), ib.constant(2)));
        ib.insertCtrl(CommonOps.ret());
        assertFalse(CheckSsa.INSTANCE.verify(calls).isPresent());
    }

    @Test
    void testPhiMismatch() {
        Function f = diamond("phi");
        BasicBlock entry = block(f, "entry");
        BasicBlock left = block(f, "left");
        BasicBlock join = block(f, "join");
        IRBuilder ib = new IRBuilder(f, join);
        // entry is not a predecessor of join
        ib.insert(CommonOps.phi(Arrays.asList(left, entry), Arrays.asList(ib.constant(1), ib.constant(2))), "m");
        assertEquals(Kind.PHI_MISMATCH, kindOf(f));

        Function g = diamond("phiMissing");
        ib = new IRBuilder(g, block(g, "join"));
        ib.insert(CommonOps.phi(Collections.singletonList(block(g, "left")), Collections.singletonList(ib.constant(1))), "m");
        assertEquals(Kind.PHI_MISMATCH, kindOf(g));
    }

    @Test
    void testRunAsPassThrows() {
        Function f = new Function("pass");
        f.newBb();
        StructuralException e = assertThrows(StructuralException.class, () -> CheckSsa.INSTANCE.run(f));
        assertEquals(Kind.MISSING_TERMINATOR, e.getError().kind);

        Function ok = passThrough("passOk");
        assertSame(ok, CheckSsa.INSTANCE.run(ok));
    }

    @Test
    void testStalePredecessorsRecomputed() {
        Function f = passThrough("stale");
        assertFalse(CheckSsa.INSTANCE.verify(f).isPresent());

        // reroute entry straight to exit after predecessors were cached
        BasicBlock exit = block(f, "exit");
        BasicBlock mid = block(f, "mid");
        block(f, "entry").setControl(Control.br(exit));
        mid.setControl(IrOps.unreachable());
        Var x = block(f, "entry").getEffects().get(0).getResult();
        exit.getEffects().add(0, CommonOps.phi(Collections.singletonList(mid), Collections.singletonList(x)).assignTo(f.newVar("m")));
        assertEquals(Kind.PHI_MISMATCH, kindOf(f));
    }
}
