package io.github.eutro.ssadce.core.passes.meta;

import io.github.eutro.ssadce.core.ops.InsnKind;
import io.github.eutro.ssadce.core.passes.IRPass;
import io.github.eutro.ssadce.core.ssa.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Classifies the allocations of a function by how far their addresses travel.
 * <p>
 * Allocations start out {@link EscapeStatus#LOCAL}. Using an address, or a pointer
 * derived from it, as the base of address arithmetic makes it at least
 * {@link EscapeStatus#ADDRESS_TAKEN}. Using it as the address of a load or store
 * leaves it alone, and any other use makes it {@link EscapeStatus#ESCAPED}.
 * Statuses only ever become more conservative.
 */
public class EscapeAnalysis implements IRPass<Function, EscapeTable> {
    public static final EscapeAnalysis INSTANCE = new EscapeAnalysis();

    @Override
    public EscapeTable run(Function func) {
        Map<Var, EscapeStatus> statuses = new LinkedHashMap<>();
        Map<Var, Var> roots = new LinkedHashMap<>();
        for (BasicBlock block : func.blocks) {
            for (Effect effect : block.getEffects()) {
                Var result = effect.getResult();
                if (result != null && effect.insn().kind() == InsnKind.ALLOCA) {
                    statuses.put(result, EscapeStatus.LOCAL);
                    roots.put(result, result);
                }
            }
        }
        if (statuses.isEmpty()) return new EscapeTable(statuses, roots);

        // derived pointers may be defined in blocks listed after their uses
        boolean changed;
        do {
            changed = false;
            for (BasicBlock block : func.blocks) {
                for (Effect effect : block.getEffects()) {
                    Var result = effect.getResult();
                    if (result == null || effect.insn().kind() != InsnKind.GEP || roots.containsKey(result)) continue;
                    Var root = roots.get(effect.insn().args().get(0));
                    if (root != null) {
                        roots.put(result, root);
                        changed = true;
                    }
                }
            }
        } while (changed);

        for (BasicBlock block : func.blocks) {
            for (Effect effect : block.getEffects()) {
                scan(effect.insn(), statuses, roots);
            }
            Control ctrl = block.getControl();
            if (ctrl != null) scan(ctrl.insn(), statuses, roots);
        }
        return new EscapeTable(statuses, roots);
    }

    private static void scan(Insn insn, Map<Var, EscapeStatus> statuses, Map<Var, Var> roots) {
        List<Var> args = insn.args();
        for (int i = 0; i < args.size(); i++) {
            Var root = roots.get(args.get(i));
            if (root == null) continue;
            EscapeStatus use = useStatus(insn.kind(), i);
            statuses.put(root, statuses.get(root).join(use));
        }
    }

    private static EscapeStatus useStatus(InsnKind kind, int operand) {
        switch (kind) {
            case LOAD:
                return EscapeStatus.LOCAL;
            case STORE:
                // store value ptr
                return operand == 1 ? EscapeStatus.LOCAL : EscapeStatus.ESCAPED;
            case GEP:
                return operand == 0 ? EscapeStatus.ADDRESS_TAKEN : EscapeStatus.ESCAPED;
            default:
                return EscapeStatus.ESCAPED;
        }
    }
}
