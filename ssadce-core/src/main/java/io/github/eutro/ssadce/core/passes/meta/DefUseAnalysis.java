package io.github.eutro.ssadce.core.passes.meta;

import io.github.eutro.ssadce.core.passes.IRPass;
import io.github.eutro.ssadce.core.ssa.*;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the {@link DefUseChains} of a function.
 * <p>
 * Immediates are neither definitions nor tracked uses.
 */
public class DefUseAnalysis implements IRPass<Function, DefUseChains> {
    public static final DefUseAnalysis INSTANCE = new DefUseAnalysis();

    @Override
    public DefUseChains run(Function func) {
        Map<Var, Effect> defs = new LinkedHashMap<>();
        Map<Var, List<DefUseChains.UseSite>> uses = new LinkedHashMap<>();
        for (BasicBlock block : func.blocks) {
            List<Effect> effects = block.getEffects();
            for (int i = 0; i < effects.size(); i++) {
                Effect effect = effects.get(i);
                addUses(uses, block, i, effect.insn());
                for (Var var : effect.getAssignsTo()) {
                    defs.put(var, effect);
                }
            }
            Control ctrl = block.getControl();
            if (ctrl != null) {
                addUses(uses, block, effects.size(), ctrl.insn());
            }
        }
        return new DefUseChains(defs, uses);
    }

    private static void addUses(Map<Var, List<DefUseChains.UseSite>> uses, BasicBlock block, int position, Insn insn) {
        List<Var> args = insn.args();
        for (int j = 0; j < args.size(); j++) {
            Var arg = args.get(j);
            if (arg.isConstant()) continue;
            uses.computeIfAbsent(arg, $ -> new ArrayList<>())
                    .add(new DefUseChains.UseSite(block, position, insn, j));
        }
    }
}
