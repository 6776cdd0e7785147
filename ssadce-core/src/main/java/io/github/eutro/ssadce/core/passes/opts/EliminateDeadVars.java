package io.github.eutro.ssadce.core.passes.opts;

import io.github.eutro.ssadce.core.ext.CommonExts;
import io.github.eutro.ssadce.core.ops.Callee;
import io.github.eutro.ssadce.core.ops.InsnKind;
import io.github.eutro.ssadce.core.ops.IrOps;
import io.github.eutro.ssadce.core.passes.InPlaceIRPass;
import io.github.eutro.ssadce.core.passes.meta.*;
import io.github.eutro.ssadce.core.ssa.*;

import java.util.*;
import java.util.function.BiConsumer;

/**
 * An optimisation pass that removes instructions whose results are dead
 * and whose removal cannot be observed.
 * <p>
 * Instructions whose results are not live are removed first, then removal cascades:
 * an operand whose last use was removed is reconsidered straight away, and so are the
 * stores to an allocation whose last load was removed. Pure and reading instructions
 * go once dead, stores go once nothing reads their (local) target, and allocations
 * go once unused. Phis are removed when dead, but never simplified.
 */
public class EliminateDeadVars implements InPlaceIRPass<Function> {
    public static final EliminateDeadVars INSTANCE = new EliminateDeadVars(SideEffectClassifier.CONSERVATIVE);

    private final SideEffectClassifier classifier;

    public EliminateDeadVars(SideEffectClassifier classifier) {
        this.classifier = classifier;
    }

    @Override
    public void runInPlace(Function function) {
        apply(function,
                DefUseAnalysis.INSTANCE.run(function),
                LivenessAnalysis.INSTANCE.run(function),
                EscapeAnalysis.INSTANCE.run(function),
                (effect, decision) -> {
                });
    }

    /**
     * Remove dead instructions from a function.
     *
     * @param function  The function.
     * @param chains    The def-use chains of the function as it is now.
     * @param liveness  The liveness of the function as it is now.
     * @param escapes   The escape statuses of the function as it is now.
     * @param decisions Receives each effect kept only to be safe, with a record of why.
     * @return The number of instructions removed.
     */
    public int apply(
            Function function,
            DefUseChains chains,
            LivenessInfo liveness,
            EscapeTable escapes,
            BiConsumer<Effect, ConservativeDecision> decisions
    ) {
        Sweep sweep = new Sweep(chains, escapes, decisions);
        for (BasicBlock block : function.blocks) {
            for (Effect effect : block.getEffects()) {
                Var result = effect.getResult();
                if (effect.insn().kind() == InsnKind.STORE) {
                    sweep.storesTo.computeIfAbsent(effect.insn().args().get(1), $ -> new ArrayList<>()).add(effect);
                }
                if (result == null || !liveness.isLive(result)) {
                    sweep.work.add(effect);
                }
            }
        }
        sweep.run();

        if (sweep.removed.isEmpty()) return 0;
        for (BasicBlock block : function.blocks) {
            block.getEffects().removeIf(sweep.removed::contains);
        }
        return sweep.removed.size();
    }

    private class Sweep {
        final DefUseChains chains;
        final EscapeTable escapes;
        final BiConsumer<Effect, ConservativeDecision> decisions;

        final Map<Var, Integer> useCounts = new HashMap<>();
        final Map<Var, Integer> loadCounts = new HashMap<>();
        final Map<Var, List<Effect>> storesTo = new HashMap<>();
        final Set<Effect> removed = Collections.newSetFromMap(new IdentityHashMap<>());
        final Deque<Effect> work = new ArrayDeque<>();

        Sweep(DefUseChains chains, EscapeTable escapes, BiConsumer<Effect, ConservativeDecision> decisions) {
            this.chains = chains;
            this.escapes = escapes;
            this.decisions = decisions;
        }

        int useCount(Var var) {
            return useCounts.computeIfAbsent(var, chains::useCount);
        }

        int loadCount(Var ptr) {
            return loadCounts.computeIfAbsent(ptr, chains::loadsFrom);
        }

        void run() {
            while (!work.isEmpty()) {
                consider(work.removeFirst());
            }
        }

        void consider(Effect effect) {
            if (removed.contains(effect)) return;
            Var result = effect.getResult();
            if (result != null && useCount(result) > 0) return;

            Insn insn = effect.insn();
            switch (classifier.classify(insn, escapes)) {
                case PURE:
                case MEMORY_READ:
                    remove(effect);
                    break;
                case MEMORY_WRITE:
                    if (insn.kind() != InsnKind.STORE || loadCount(insn.args().get(1)) == 0) {
                        remove(effect);
                    }
                    break;
                case EFFECTFUL:
                    recordKept(effect);
                    break;
            }
        }

        void remove(Effect effect) {
            removed.add(effect);
            Insn insn = effect.insn();
            List<Var> args = insn.args();
            for (int i = 0; i < args.size(); i++) {
                Var arg = args.get(i);
                if (arg.isConstant()) continue;
                int uses = useCount(arg) - 1;
                useCounts.put(arg, uses);
                if (uses == 0) {
                    Effect def = chains.definition(arg);
                    if (def != null) work.add(def);
                }
                if (insn.kind() == InsnKind.LOAD && i == 0) {
                    int loads = loadCount(arg) - 1;
                    loadCounts.put(arg, loads);
                    if (loads == 0) {
                        work.addAll(storesTo.getOrDefault(arg, Collections.emptyList()));
                    }
                }
            }
        }

        void recordKept(Effect effect) {
            Insn insn = effect.insn();
            ConservativeReason reason;
            if (insn.kind() == InsnKind.STORE) {
                Var dest = insn.args().get(1);
                // stores through pointers of unknown origin never looked removable
                if (escapes.rootOf(dest) == null) return;
                reason = escapes.targetStatus(dest) == EscapeStatus.ADDRESS_TAKEN
                        ? ConservativeReason.MAY_ALIAS
                        : ConservativeReason.ESCAPED_POINTER;
            } else if (insn.kind() == InsnKind.CALL) {
                Callee callee = IrOps.CALL.immediate(insn);
                reason = callee.external
                        ? ConservativeReason.POTENTIAL_SIDE_EFFECT
                        : ConservativeReason.UNKNOWN_CALL_PURITY;
            } else {
                return;
            }
            BasicBlock block = effect.getNullable(CommonExts.OWNING_BLOCK);
            decisions.accept(effect, new ConservativeDecision(
                    effect.toString(),
                    block == null ? "?" : block.getLabel(),
                    reason));
        }
    }
}
