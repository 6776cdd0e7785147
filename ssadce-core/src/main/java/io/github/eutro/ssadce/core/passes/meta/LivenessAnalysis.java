package io.github.eutro.ssadce.core.passes.meta;

import io.github.eutro.ssadce.core.ops.CommonOps;
import io.github.eutro.ssadce.core.ops.InsnKind;
import io.github.eutro.ssadce.core.passes.IRPass;
import io.github.eutro.ssadce.core.ssa.*;
import io.github.eutro.ssadce.core.util.GraphWalker;

import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Computes which values are live, by backward dataflow over the blocks of a function.
 * <p>
 * For each block, {@code liveIn = gen ∪ (liveOut − kill)} and {@code liveOut} is the union of
 * the {@code liveIn} of its successors, plus the values it passes to their phis. The blocks are
 * swept in post-order until no set changes, or until the iteration bound is hit.
 * <p>
 * Post-order rather than reverse post-order is deliberate: information flows backwards here,
 * so visiting successors before their predecessors lets an acyclic function settle in one sweep.
 */
public class LivenessAnalysis implements IRPass<Function, LivenessInfo> {
    private static final Logger LOGGER = Logger.getLogger(LivenessAnalysis.class.getName());

    public static final int DEFAULT_MAX_ITERATIONS = 8;
    public static final LivenessAnalysis INSTANCE = new LivenessAnalysis(DEFAULT_MAX_ITERATIONS);

    private final int maxIterations;

    public LivenessAnalysis(int maxIterations) {
        if (maxIterations <= 0) {
            throw new IllegalArgumentException("maxIterations must be positive, got " + maxIterations);
        }
        this.maxIterations = maxIterations;
    }

    @Override
    public LivenessInfo run(Function func) {
        Map<BasicBlock, LiveData> blocks = new LinkedHashMap<>();
        for (BasicBlock block : func.blocks) {
            blocks.put(block, new LiveData());
        }
        for (BasicBlock block : func.blocks) {
            computeLocal(block, blocks);
        }
        for (LiveData data : blocks.values()) {
            data.liveIn.addAll(data.gen);
            data.liveOut.addAll(data.exitUses);
        }

        List<BasicBlock> order = sweepOrder(func);
        int iterations = 0;
        boolean changed = true;
        while (changed && iterations < maxIterations) {
            changed = false;
            iterations++;
            for (BasicBlock block : order) {
                LiveData data = blocks.get(block);
                for (BasicBlock succ : block.getSuccessors()) {
                    LiveData succData = blocks.get(succ);
                    if (succData == null) continue;
                    for (Var var : succData.liveIn) {
                        if (data.liveOut.add(var) && !data.kill.contains(var)) {
                            data.liveIn.add(var);
                            changed = true;
                        }
                    }
                }
            }
        }

        Set<Var> liveAtDefinition;
        if (changed) {
            LOGGER.log(Level.WARNING, "Liveness of {0} did not converge in {1} iterations, using use counts",
                    new Object[]{func.name, iterations});
            liveAtDefinition = usedAnywhere(func);
        } else {
            liveAtDefinition = new HashSet<>();
            for (BasicBlock block : func.blocks) {
                walkBackwards(block, blocks.get(block), liveAtDefinition);
            }
        }
        return new LivenessInfo(blocks, liveAtDefinition, iterations, !changed);
    }

    private static void computeLocal(BasicBlock block, Map<BasicBlock, LiveData> blocks) {
        LiveData data = blocks.get(block);
        for (Effect effect : block.getEffects()) {
            Insn insn = effect.insn();
            if (insn.kind() == InsnKind.PHI) {
                // used at the exit of the predecessor instead
                List<BasicBlock> preds = CommonOps.PHI.immediate(insn);
                List<Var> args = insn.args();
                for (int i = 0; i < args.size() && i < preds.size(); i++) {
                    LiveData predData = blocks.get(preds.get(i));
                    if (predData != null && !args.get(i).isConstant()) {
                        predData.exitUses.add(args.get(i));
                    }
                }
            } else {
                for (Var arg : insn.args()) {
                    if (!arg.isConstant() && !data.kill.contains(arg)) data.gen.add(arg);
                }
            }
            data.kill.addAll(effect.getAssignsTo());
        }
        Control ctrl = block.getControl();
        if (ctrl != null) {
            for (Var arg : ctrl.insn().args()) {
                if (!arg.isConstant() && !data.kill.contains(arg)) data.gen.add(arg);
            }
        }
    }

    private static List<BasicBlock> sweepOrder(Function func) {
        List<BasicBlock> order = new ArrayList<>();
        if (func.getEntry() != null) {
            order.addAll(GraphWalker.blockWalker(func).postOrder().toList());
        }
        Set<BasicBlock> walked = Collections.newSetFromMap(new IdentityHashMap<>());
        walked.addAll(order);
        for (BasicBlock block : func.blocks) {
            if (!walked.contains(block)) order.add(block);
        }
        order.retainAll(func.blocks);
        return order;
    }

    private static void walkBackwards(BasicBlock block, LiveData data, Set<Var> liveAtDefinition) {
        Set<Var> live = new HashSet<>(data.liveOut);
        Control ctrl = block.getControl();
        if (ctrl != null) {
            addUses(live, ctrl.insn());
        }
        List<Effect> effects = block.getEffects();
        for (ListIterator<Effect> li = effects.listIterator(effects.size()); li.hasPrevious(); ) {
            Effect effect = li.previous();
            for (Var var : effect.getAssignsTo()) {
                if (live.remove(var)) liveAtDefinition.add(var);
            }
            if (effect.insn().kind() != InsnKind.PHI) {
                addUses(live, effect.insn());
            }
        }
    }

    private static void addUses(Set<Var> live, Insn insn) {
        for (Var arg : insn.args()) {
            if (!arg.isConstant()) live.add(arg);
        }
    }

    private static Set<Var> usedAnywhere(Function func) {
        Set<Var> used = new HashSet<>();
        for (BasicBlock block : func.blocks) {
            for (Effect effect : block.getEffects()) {
                addUses(used, effect.insn());
            }
            Control ctrl = block.getControl();
            if (ctrl != null) addUses(used, ctrl.insn());
        }
        return used;
    }
}
