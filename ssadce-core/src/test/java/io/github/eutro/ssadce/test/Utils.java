package io.github.eutro.ssadce.test;

import io.github.eutro.ssadce.core.ops.CommonOps;
import io.github.eutro.ssadce.core.ops.IrOps;
import io.github.eutro.ssadce.core.ops.IrOps.BinOp;
import io.github.eutro.ssadce.core.ssa.*;

import java.util.ArrayList;
import java.util.List;

public class Utils {
    public static Var arg(IRBuilder ib, int n, String name) {
        return ib.insert(CommonOps.ARG.create(n).insn(), name);
    }

    public static Var bin(IRBuilder ib, BinOp op, Var lhs, Var rhs, String name) {
        return ib.insert(IrOps.binary(op, lhs, rhs), name);
    }

    public static Var bin(IRBuilder ib, BinOp op, long lhs, long rhs, String name) {
        return bin(ib, op, ib.constant(lhs), ib.constant(rhs), name);
    }

    /**
     * The effects of every block, in order, as strings.
     */
    public static List<String> effects(Function func) {
        List<String> out = new ArrayList<>();
        for (BasicBlock block : func.blocks) {
            for (Effect effect : block.getEffects()) {
                out.add(effect.toString());
            }
        }
        return out;
    }

    public static List<String> effects(BasicBlock block) {
        List<String> out = new ArrayList<>();
        for (Effect effect : block.getEffects()) {
            out.add(effect.toString());
        }
        return out;
    }

    public static List<String> labels(Iterable<BasicBlock> blocks) {
        List<String> out = new ArrayList<>();
        for (BasicBlock block : blocks) {
            out.add(block.getLabel());
        }
        return out;
    }

    /**
     * <pre>
     * entry: %x = arg 0; br mid
     * mid:   br exit
     * exit:  return %x
     * </pre>
     */
    public static Function passThrough(String name) {
        Function f = new Function(name);
        BasicBlock entry = f.newBb("entry");
        BasicBlock mid = f.newBb("mid");
        BasicBlock exit = f.newBb("exit");
        IRBuilder ib = new IRBuilder(f, entry);
        Var x = arg(ib, 0, "x");
        ib.insertCtrl(Control.br(mid));
        ib.setBlock(mid);
        ib.insertCtrl(Control.br(exit));
        ib.setBlock(exit);
        ib.insertCtrl(CommonOps.ret(x));
        return f;
    }

    /**
     * <pre>
     * entry: cond_br %c @left @right
     * left:  br @join
     * right: br @join
     * join:  return
     * </pre>
     */
    public static Function diamond(String name) {
        Function f = new Function(name);
        BasicBlock entry = f.newBb("entry");
        BasicBlock left = f.newBb("left");
        BasicBlock right = f.newBb("right");
        BasicBlock join = f.newBb("join");
        IRBuilder ib = new IRBuilder(f, entry);
        Var c = arg(ib, 0, "c");
        ib.insertCtrl(IrOps.condBr(c, left, right));
        ib.setBlock(left);
        ib.insertCtrl(Control.br(join));
        ib.setBlock(right);
        ib.insertCtrl(Control.br(join));
        ib.setBlock(join);
        ib.insertCtrl(CommonOps.ret());
        return f;
    }

    public static BasicBlock block(Function func, String label) {
        for (BasicBlock block : func.blocks) {
            if (block.getLabel().equals(label)) return block;
        }
        throw new IllegalArgumentException("no block " + label + " in " + func.name);
    }
}
