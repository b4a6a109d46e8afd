package io.github.eutro.ncs2nss.core.passes.convert;

import io.github.eutro.ncs2nss.core.DiagnosticKind;
import io.github.eutro.ncs2nss.core.Diagnostics;
import io.github.eutro.ncs2nss.core.actions.SignatureResolver;
import io.github.eutro.ncs2nss.core.actions.SignatureTable;
import io.github.eutro.ncs2nss.core.ast.*;
import io.github.eutro.ncs2nss.core.cfg.BasicBlock;
import io.github.eutro.ncs2nss.core.cfg.ControlFlowGraph;
import io.github.eutro.ncs2nss.core.cfg.Loop;
import io.github.eutro.ncs2nss.core.cfg.Subroutine;
import io.github.eutro.ncs2nss.core.ext.CommonExts;
import io.github.eutro.ncs2nss.core.ext.MetadataState;
import io.github.eutro.ncs2nss.core.ncs.GameVariant;
import io.github.eutro.ncs2nss.core.ncs.Instruction;
import io.github.eutro.ncs2nss.core.ncs.InstructionStream;
import io.github.eutro.ncs2nss.core.ncs.Opcode;
import io.github.eutro.ncs2nss.core.ncs.TypeQualifier;
import io.github.eutro.ncs2nss.core.passes.InPlaceIRPass;
import io.github.eutro.ncs2nss.core.passes.meta.FindShortCircuits;
import io.github.eutro.ncs2nss.core.util.GraphWalker;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.util.*;

/**
 * Replays the stack of every subroutine symbolically, turning instructions back into
 * expressions and statements, attached per block as {@link CommonExts#BLOCK_CODE}.
 * <p>
 * A stack cell is either a variable, or a temporary holding the expression that computed it.
 * NWScript leaves a variable declared with an initializer on the stack as the initializer's value,
 * so temporaries stay expressions until the code treats them as variables: stores into them,
 * copies of impure values, and copies from other blocks. At that point they are <i>promoted</i>
 * to a declared variable, with the declaration placed where the value was computed.
 * <p>
 * Subroutines are recovered callers first, so argument types flow into parameters before
 * the callee is looked at. Deferred actions are recovered inline, on a copy of the stack
 * at the point their state is saved.
 */
public class RecoverExpressions implements InPlaceIRPass<ControlFlowGraph> {
    private static final Logger LOGGER = System.getLogger(RecoverExpressions.class.getName());

    private static final Map<Opcode, Operator> BINARY_OPERATORS = new EnumMap<>(Opcode.class);

    static {
        BINARY_OPERATORS.put(Opcode.LOGAND, Operator.LOG_AND);
        BINARY_OPERATORS.put(Opcode.LOGOR, Operator.LOG_OR);
        BINARY_OPERATORS.put(Opcode.INCOR, Operator.BIT_OR);
        BINARY_OPERATORS.put(Opcode.EXCOR, Operator.BIT_XOR);
        BINARY_OPERATORS.put(Opcode.BOOLAND, Operator.BIT_AND);
        BINARY_OPERATORS.put(Opcode.EQUAL, Operator.EQ);
        BINARY_OPERATORS.put(Opcode.NEQUAL, Operator.NEQ);
        BINARY_OPERATORS.put(Opcode.GEQ, Operator.GEQ);
        BINARY_OPERATORS.put(Opcode.GT, Operator.GT);
        BINARY_OPERATORS.put(Opcode.LT, Operator.LT);
        BINARY_OPERATORS.put(Opcode.LEQ, Operator.LEQ);
        BINARY_OPERATORS.put(Opcode.SHLEFT, Operator.SHL);
        BINARY_OPERATORS.put(Opcode.SHRIGHT, Operator.SHR);
        BINARY_OPERATORS.put(Opcode.USHRIGHT, Operator.USHR);
        BINARY_OPERATORS.put(Opcode.ADD, Operator.ADD);
        BINARY_OPERATORS.put(Opcode.SUB, Operator.SUB);
        BINARY_OPERATORS.put(Opcode.MUL, Operator.MUL);
        BINARY_OPERATORS.put(Opcode.DIV, Operator.DIV);
        BINARY_OPERATORS.put(Opcode.MOD, Operator.MOD);
    }

    @NotNull
    private final SignatureTable table;
    private final boolean strictSignatures;

    public RecoverExpressions(@NotNull SignatureTable table, boolean strictSignatures) {
        this.table = table;
        this.strictSignatures = strictSignatures;
    }

    @Override
    public void runInPlace(ControlFlowGraph graph) {
        Diagnostics diagnostics = graph.getExtOrThrow(CommonExts.DIAGNOSTICS);
        Context ctx = new Context(graph, new SignatureResolver(table, strictSignatures, diagnostics), diagnostics);
        for (Subroutine sub : recoveryOrder(graph)) {
            new FunctionRecovery(ctx, sub, new Scope()).recover(null);
        }
        List<LocalSlot> globals = new ArrayList<>();
        if (ctx.globalCells != null) {
            for (Cell cell : ctx.globalCells) {
                LocalSlot whole = cell.wholeSlot();
                if (whole != null && !globals.contains(whole)) globals.add(whole);
            }
        }
        graph.attachExt(CommonExts.GLOBALS, globals);
        graph.attachExt(CommonExts.GLOBAL_STATEMENTS, ctx.globalStatements);
    }

    /**
     * Order the subroutines so that callers come before their callees where possible:
     * the entry stub, the globals initializer, then a pre-order walk of the call graph from the main function.
     * Deferred actions are walked through, but are recovered by whoever saves them.
     */
    static List<Subroutine> recoveryOrder(ControlFlowGraph graph) {
        List<Subroutine> subs = graph.getExtOrThrow(CommonExts.SUBROUTINES);
        Map<Integer, Subroutine> byEntry = graph.getExtOrThrow(CommonExts.SUBROUTINE_BY_ENTRY);
        Set<Subroutine> seen = new HashSet<>();
        List<Subroutine> order = new ArrayList<>();
        for (Subroutine sub : subs) {
            if (sub.getKind() == Subroutine.Kind.ENTRY_STUB) visit(sub, byEntry, seen, order);
        }
        Subroutine globals = graph.getNullable(CommonExts.GLOBALS_SUBROUTINE);
        if (globals != null) visit(globals, byEntry, seen, order);
        visit(graph.getExtOrThrow(CommonExts.MAIN_SUBROUTINE), byEntry, seen, order);
        for (Subroutine sub : subs) {
            if (sub.getKind() != Subroutine.Kind.CLOSURE) visit(sub, byEntry, seen, order);
        }
        return order;
    }

    private static void visit(Subroutine sub, Map<Integer, Subroutine> byEntry, Set<Subroutine> seen, List<Subroutine> order) {
        if (!seen.add(sub)) return;
        if (sub.getKind() != Subroutine.Kind.CLOSURE) order.add(sub);
        for (int l = 0; l < sub.size(); l++) {
            BasicBlock block = sub.basicBlock(l);
            Subroutine callee = byEntry.get(block.getCallee());
            if (callee != null) visit(callee, byEntry, seen, order);
            Subroutine closure = byEntry.get(block.getClosure());
            if (closure != null) visit(closure, byEntry, seen, order);
        }
    }

    private static final class Context {
        final ControlFlowGraph graph;
        final InstructionStream code;
        final GameVariant variant;
        final SignatureResolver resolver;
        final Diagnostics diagnostics;
        final Map<Integer, Subroutine> byEntry;
        final List<Region> globalStatements = new ArrayList<>();
        @Nullable
        List<Cell> globalCells;
        int sequence;

        Context(ControlFlowGraph graph, SignatureResolver resolver, Diagnostics diagnostics) {
            this.graph = graph;
            this.code = graph.getCode();
            this.variant = code.getVariant();
            this.resolver = resolver;
            this.diagnostics = diagnostics;
            this.byEntry = graph.getExtOrThrow(CommonExts.SUBROUTINE_BY_ENTRY);
        }
    }

    /**
     * What a function and the actions it saves have in common: the variables they declare.
     */
    private static final class Scope {
        final List<LocalSlot> created = new ArrayList<>();
        final Map<LocalSlot, BlockCode> declaredIn = new IdentityHashMap<>();
        final Set<LocalSlot> uninitialized = Collections.newSetFromMap(new IdentityHashMap<>());
        int placeholders;
    }

    /**
     * A stack cell. Cells are shared between the stacks of different blocks,
     * so promoting one is seen everywhere it was copied to.
     */
    static final class Cell {
        @Nullable
        LocalSlot slot;
        @Nullable
        LocalSlot promoted;
        Expr value;
        int part;
        int width = 1;
        BlockCode owner;
        @Nullable
        Region anchor;
        int sequence;
        boolean consumed;

        static Cell of(LocalSlot slot) {
            Cell cell = new Cell();
            cell.slot = slot;
            return cell;
        }

        boolean isTemp() {
            return slot == null;
        }

        @Nullable
        LocalSlot wholeSlot() {
            if (slot == null) return null;
            return slot.getAliasOf() != null ? slot.getAliasOf() : slot;
        }
    }

    private static final class FunctionRecovery {
        final Context ctx;
        final Subroutine sub;
        final SubroutineSignature sig;
        final Scope scope;
        final boolean globalsSub;
        final Deque<Expr.Closure> pendingClosures = new ArrayDeque<>();

        BlockCode[] blocks;
        List<Cell>[] exits;
        int[] entryDepth;
        List<Integer> rpo;
        Collection<Loop> loops;

        int local;
        BasicBlock block;
        BlockCode bc;
        List<Cell> st;
        boolean imbalanceReported;
        boolean afterSaveBp;
        int lastCopy = -1;
        int lastCopyGlobal = -1;

        FunctionRecovery(Context ctx, Subroutine sub, Scope scope) {
            this.ctx = ctx;
            this.sub = sub;
            this.sig = sub.getExtOrThrow(CommonExts.SIGNATURE);
            this.scope = scope;
            this.globalsSub = sub.getKind() == Subroutine.Kind.GLOBALS;
        }

        @SuppressWarnings("unchecked")
        void recover(@Nullable List<Cell> initial) {
            MetadataState ms = sub.getExtOrThrow(CommonExts.METADATA_STATE);
            Map<Integer, Integer> joins = sub.getExtOrRun(CommonExts.SHORT_CIRCUIT_JOINS, sub, FindShortCircuits.INSTANCE);
            ms.ensureValid(sub, MetadataState.PREDS, MetadataState.DOMS, MetadataState.LOOPS);
            int[][] preds = sub.getExtOrThrow(CommonExts.PREDS);
            int[] idom = sub.getExtOrThrow(CommonExts.IDOM);
            loops = sub.getExtOrThrow(CommonExts.LOOPS).values();

            int n = sub.size();
            blocks = new BlockCode[n];
            exits = new List[n];
            entryDepth = new int[n];
            Arrays.fill(entryDepth, -1);
            rpo = GraphWalker.reversePostOrder(sub);
            int[] rank = new int[n];
            Arrays.fill(rank, Integer.MAX_VALUE);
            for (int i = 0; i < rpo.size(); i++) rank[rpo.get(i)] = i;

            for (int l : rpo) {
                List<Cell> entry;
                if (l == 0) {
                    entry = initial != null ? new ArrayList<>(initial) : frameCells();
                } else {
                    entry = entryStack(l, preds[l], idom[l], joins.get(l), rank);
                }
                entryDepth[l] = entry.size();
                runBlock(l, entry, rank);
            }
            for (int l = 0; l < n; l++) {
                if (blocks[l] == null) blocks[l] = new BlockCode(l, ctx.graph.offsetOf(sub.block(l)));
            }
            for (BlockCode code : blocks) {
                code.statements.removeIf(s -> s instanceof Region.Declare && ((Region.Declare) s).slot.isCancelled());
            }
            sub.attachExt(CommonExts.BLOCK_CODE, blocks);
            if (sub.getKind() != Subroutine.Kind.CLOSURE) nameSlots();
            LOGGER.log(Level.DEBUG, "Recovered {0} ({1})", sig.getName(), sub);
        }

        private List<Cell> frameCells() {
            List<Cell> cells = new ArrayList<>();
            for (LocalSlot slot : sig.returnSlots) cells.add(Cell.of(slot));
            for (int k = sig.params.size() - 1; k >= 0; k--) cells.add(Cell.of(sig.params.get(k)));
            return cells;
        }

        private List<Cell> entryStack(int l, int[] preds, int idom, @Nullable Integer preferred, int[] rank) {
            int chosen = -1;
            if (preferred != null && exits[preferred] != null) {
                chosen = preferred;
            } else if (idom != -1 && exits[idom] != null && contains(preds, idom)) {
                chosen = idom;
            } else {
                for (int p : preds) {
                    if (exits[p] != null && (chosen == -1 || rank[p] < rank[chosen])) chosen = p;
                }
            }
            int offset = ctx.graph.offsetOf(sub.block(l));
            if (chosen == -1) {
                ctx.diagnostics.report(DiagnosticKind.STACK_IMBALANCE, offset, "No stack state reaches this block");
                return new ArrayList<>();
            }
            List<Cell> stack = new ArrayList<>(exits[chosen]);
            for (int p : preds) {
                if (p != chosen && exits[p] != null && exits[p].size() != stack.size()) {
                    ctx.diagnostics.report(DiagnosticKind.STACK_IMBALANCE, offset,
                            "Predecessors disagree on stack depth: " + stack.size() + " and " + exits[p].size());
                    break;
                }
            }
            return stack;
        }

        private static boolean contains(int[] arr, int v) {
            for (int x : arr) if (x == v) return true;
            return false;
        }

        private void runBlock(int l, List<Cell> stack, int[] rank) {
            local = l;
            block = sub.basicBlock(l);
            st = stack;
            bc = blocks[l] = new BlockCode(l, ctx.graph.offsetOf(sub.block(l)));
            imbalanceReported = false;
            lastCopy = -1;
            lastCopyGlobal = -1;
            for (int i = block.getFirst(); i <= block.getLast(); i++) {
                step(ctx.code.get(i));
            }
            exits[l] = st;
            for (int s : sub.successors()[l]) {
                if (entryDepth[s] != -1 && rank[s] <= rank[l] && entryDepth[s] != st.size()) {
                    ctx.diagnostics.report(DiagnosticKind.STACK_IMBALANCE, ctx.graph.offsetOf(sub.block(s)),
                            "Loop re-enters with stack depth " + st.size() + ", expected " + entryDepth[s]);
                }
            }
        }

        private void step(Instruction insn) {
            int copied = lastCopy;
            int copiedGlobal = lastCopyGlobal;
            lastCopy = -1;
            lastCopyGlobal = -1;
            Opcode opcode = insn.getOpcode();
            switch (opcode) {
                case RSADD:
                    reserve(insn);
                    break;
                case CONST:
                    push(constant(insn), 1);
                    break;
                case CPTOPSP:
                    copyTop(insn);
                    break;
                case CPDOWNSP:
                    copyDown(insn);
                    break;
                case CPTOPBP:
                    copyTopGlobal(insn);
                    break;
                case CPDOWNBP:
                    copyDownGlobal(insn);
                    break;
                case MOVSP:
                    discard(-insn.getA() / 4, insn);
                    break;
                case ACTION:
                    action(insn);
                    break;
                case NEG:
                case COMP:
                case NOT:
                    unary(insn);
                    break;
                case INCSP:
                case DECSP:
                    incDec(insn, copied);
                    break;
                case INCBP:
                case DECBP:
                    incDecGlobal(insn, copiedGlobal);
                    break;
                case JZ:
                case JNZ:
                    branch(insn);
                    break;
                case JSR:
                    call(insn);
                    break;
                case RETN:
                    bc.setReturns(true);
                    break;
                case DESTRUCT:
                    destruct(insn);
                    break;
                case SAVEBP:
                    saveBp();
                    break;
                case STORE_STATE:
                    storeState(insn);
                    break;
                case JMP:
                case NOP:
                case RESTOREBP:
                case STORE_STATEALL:
                    break;
                default:
                    if (BINARY_OPERATORS.containsKey(opcode)) {
                        binary(insn);
                    }
                    break;
            }
        }

        // region stack primitives

        private void report(DiagnosticKind kind, Instruction insn, String message) {
            ctx.diagnostics.report(kind, insn.getOffset(), message);
        }

        private LocalSlot placeholder(Instruction insn) {
            LocalSlot slot = new LocalSlot(LocalSlot.Kind.PLACEHOLDER, NssType.ANY, insn.getOffset());
            slot.setName("__unknown_param_" + ++scope.placeholders);
            return slot;
        }

        private void ensure(int n, Instruction insn) {
            if (st.size() >= n) return;
            int missing = n - st.size();
            if (!imbalanceReported) {
                report(DiagnosticKind.STACK_IMBALANCE, insn, "Stack underflow by " + missing + " cell(s) at " + insn.mnemonic());
                imbalanceReported = true;
            }
            for (int k = 0; k < missing; k++) {
                st.add(0, Cell.of(placeholder(insn)));
            }
        }

        private Cell newTemp(Expr value, int part, int width, int sequence) {
            Cell cell = new Cell();
            cell.value = value;
            cell.part = part;
            cell.width = width;
            cell.owner = bc;
            cell.anchor = bc.lastStatement();
            cell.sequence = sequence;
            return cell;
        }

        private void push(Expr value, int width) {
            int sequence = ctx.sequence++;
            for (int p = 0; p < width; p++) {
                st.add(newTemp(value, p, width, sequence));
            }
        }

        private Expr pop(int n, Instruction insn) {
            ensure(n, insn);
            Expr value = read(st, st.size() - n, n);
            st.subList(st.size() - n, st.size()).clear();
            return value;
        }

        private static Expr ref(LocalSlot slot) {
            LocalSlot vector = slot.getAliasOf();
            if (vector != null) return new Expr.Member(ref(vector), slot.getComponent());
            return slot.kind == LocalSlot.Kind.GLOBAL ? new Expr.GlobalRef(slot) : new Expr.LocalRef(slot);
        }

        private static Expr cellValue(Cell cell) {
            if (cell.slot != null) return ref(cell.slot);
            if (cell.width == 1) return cell.value;
            return new Expr.Member(cell.value, cell.part);
        }

        private Expr read(List<Cell> cells, int from, int n) {
            Cell first = cells.get(from);
            if (n == 1) return cellValue(first);
            if (first.isTemp() && first.width == n && first.part == 0 && sameTemp(cells, from, n)) {
                return first.value;
            }
            if (n == 3) {
                LocalSlot vector = vectorOf(cells, from);
                if (vector == null) vector = mergeVector(cells, from);
                if (vector != null) return ref(vector);
                return new Expr.VectorLiteral(cellValue(first), cellValue(cells.get(from + 1)), cellValue(cells.get(from + 2)));
            }
            // structures are only tracked by their first cell
            return cellValue(first);
        }

        private static boolean sameTemp(List<Cell> cells, int from, int n) {
            Expr value = cells.get(from).value;
            for (int k = 0; k < n; k++) {
                Cell cell = cells.get(from + k);
                if (!cell.isTemp() || cell.value != value || cell.part != k) return false;
            }
            return true;
        }

        @Nullable
        private static LocalSlot vectorOf(List<Cell> cells, int from) {
            LocalSlot vector = null;
            for (int k = 0; k < 3; k++) {
                LocalSlot slot = cells.get(from + k).slot;
                if (slot == null || slot.getAliasOf() == null || slot.getComponent() != k) return null;
                if (vector == null) vector = slot.getAliasOf();
                else if (vector != slot.getAliasOf()) return null;
            }
            return vector;
        }

        /**
         * Three bare float locals used together as a vector are the components of one vector local.
         */
        @Nullable
        private LocalSlot mergeVector(List<Cell> cells, int from) {
            LocalSlot[] parts = new LocalSlot[3];
            for (int k = 0; k < 3; k++) {
                LocalSlot slot = cells.get(from + k).slot;
                if (slot == null || slot.kind != LocalSlot.Kind.LOCAL || slot.getAliasOf() != null
                        || slot.isCancelled() || !scope.uninitialized.contains(slot)
                        || (slot.getType() != NssType.FLOAT && slot.getType() != NssType.ANY)) {
                    return null;
                }
                parts[k] = slot;
            }
            LocalSlot vector = new LocalSlot(LocalSlot.Kind.LOCAL, NssType.VECTOR, parts[0].definedAt);
            for (int k = 0; k < 3; k++) parts[k].aliasTo(vector, k);
            BlockCode where = scope.declaredIn.get(parts[0]);
            if (where != null) {
                for (int i = 0; i < where.statements.size(); i++) {
                    Region stmt = where.statements.get(i);
                    if (stmt instanceof Region.Declare && ((Region.Declare) stmt).slot == parts[0]) {
                        where.statements.add(i + 1, new Region.Declare(vector, null));
                        break;
                    }
                }
                scope.declaredIn.put(vector, where);
            }
            scope.created.add(vector);
            return vector;
        }

        private LocalSlot.Kind variableKind() {
            return globalsSub && !afterSaveBp ? LocalSlot.Kind.GLOBAL : LocalSlot.Kind.LOCAL;
        }

        /**
         * Turn a temporary into a declared variable, initialized with its value where it was computed.
         */
        private LocalSlot promote(int idx, LocalSlot.Kind kind) {
            Cell cell = st.get(idx);
            if (cell.slot != null) return cell.wholeSlot();
            int base = idx - cell.part;
            Expr value = cell.value;

            Expr init = value;
            for (int j = 0; j < base; j++) {
                Cell lower = st.get(j);
                if (lower.value == value && lower.part == 0) {
                    init = ref(lower.slot != null ? lower.wholeSlot() : promote(j, kind));
                    break;
                }
            }

            NssType type;
            if (cell.width == 3) type = NssType.VECTOR;
            else if (cell.width > 1) type = NssType.STRUCT;
            else type = value.type() == NssType.VOID ? NssType.ANY : value.type();
            LocalSlot slot = new LocalSlot(kind, type, cell.owner.offset);
            for (int k = 0; k < cell.width && base + k < st.size(); k++) {
                Cell part = st.get(base + k);
                if (!part.isTemp() || part.value != value) continue;
                if (cell.width == 1) {
                    part.slot = slot;
                } else {
                    LocalSlot component = new LocalSlot(kind, NssType.FLOAT, cell.owner.offset);
                    component.aliasTo(slot, k);
                    part.slot = component;
                }
                part.promoted = slot;
            }
            cell.owner.insertAfter(cell.anchor, cell.sequence, new Region.Declare(slot, init));
            scope.declaredIn.put(slot, cell.owner);
            scope.created.add(slot);
            return slot;
        }

        /**
         * Promote the temporaries that still read a variable about to be overwritten.
         */
        private void beforeStore(LocalSlot target, int limit) {
            for (int i = 0; i < limit && i < st.size(); i++) {
                Cell cell = st.get(i);
                if (cell.isTemp() && cell.value.references(target)) promote(i, LocalSlot.Kind.LOCAL);
            }
        }

        private boolean ownedHere(Cell cell) {
            int b = cell.owner.block;
            return b < blocks.length && blocks[b] == cell.owner;
        }

        /**
         * Whether a pure temporary can be re-read in the current block rather than stored.
         * It cannot if the current block may run again after the temporary's variable changes.
         */
        private boolean canReread(Cell cell) {
            if (!ownedHere(cell)) return false;
            int owner = cell.owner.block;
            if (owner == local) return true;
            for (Loop loop : loops) {
                if (loop.contains(local) && !loop.contains(owner)) return false;
            }
            return true;
        }

        private void use(Expr e, NssType type, Instruction insn) {
            if (!type.isKnown() || type == NssType.VOID || type == NssType.ACTION) return;
            if (e instanceof Expr.LocalRef) {
                LocalSlot slot = ((Expr.LocalRef) e).slot;
                if (slot.getAliasOf() != null) return;
                NssType before = slot.getType();
                if (!slot.unify(type)) {
                    report(DiagnosticKind.TYPE_CONFLICT, insn,
                            "Variable used as both " + before.getSourceName() + " and " + type.getSourceName());
                }
            }
        }

        // endregion

        private NssType typeOf(TypeQualifier q) {
            switch (q) {
                case INT:
                    return NssType.INT;
                case FLOAT:
                    return NssType.FLOAT;
                case STRING:
                    return NssType.STRING;
                case OBJECT:
                    return NssType.OBJECT;
                default:
                    return q.isEngine() ? ctx.variant.engineType(q.engineIndex()) : NssType.ANY;
            }
        }

        private void reserve(Instruction insn) {
            LocalSlot slot = new LocalSlot(variableKind(), typeOf(insn.getQualifier()), insn.getOffset());
            bc.statements.add(new Region.Declare(slot, null));
            scope.declaredIn.put(slot, bc);
            scope.uninitialized.add(slot);
            scope.created.add(slot);
            st.add(Cell.of(slot));
        }

        private static Expr constant(Instruction insn) {
            switch (insn.getQualifier()) {
                case FLOAT:
                    return new Expr.Literal(NssType.FLOAT, insn.getFloatValue());
                case STRING:
                    return new Expr.Literal(NssType.STRING, insn.getStringValue());
                case OBJECT:
                    return new Expr.Literal(NssType.OBJECT, insn.getA());
                default:
                    return Expr.Literal.ofInt(insn.getA());
            }
        }

        private boolean isShortCircuitDup(Instruction insn) {
            return sub.forcedSuccessor(local) != -1 && insn.getIndex() == block.getLast() - 1;
        }

        private void copyTop(Instruction insn) {
            int back = -insn.getA() / 4;
            int n = insn.getB() / 4;
            ensure(back, insn);
            int from = st.size() - back;
            if (n > back) {
                report(DiagnosticKind.STACK_IMBALANCE, insn, "Copy of " + n + " cells reaches past the top of the stack");
                n = back;
            }
            boolean dup = isShortCircuitDup(insn);
            for (int k = 0; k < n; k++) {
                Cell cell = st.get(from + k);
                if (cell.isTemp() && !((cell.value.isPure() || dup) && canReread(cell))) {
                    promote(from + k, variableKind());
                }
            }
            if (n == 1 || n == 3) {
                push(read(st, from, n), n);
            } else {
                for (int k = 0; k < n; k++) push(cellValue(st.get(from + k)), 1);
            }
            if (n == 1) lastCopy = from;
        }

        @Nullable
        private LocalSlot storeSlot(List<Cell> cells, int from, int n, boolean stack) {
            if (stack) {
                for (int k = 0; k < n; k++) {
                    if (cells.get(from + k).isTemp()) promote(from + k, variableKind());
                }
            }
            if (n == 1) return cells.get(from).slot;
            if (n == 3) {
                LocalSlot vector = vectorOf(cells, from);
                return vector != null ? vector : mergeVector(cells, from);
            }
            return null;
        }

        private void assign(LocalSlot slot, Expr value, int sourceFrom, Instruction insn) {
            LocalSlot whole = slot.getAliasOf() != null ? slot.getAliasOf() : slot;
            beforeStore(whole, sourceFrom);
            NssType target = slot.getType();
            NssType actual = value.type();
            if (target.isKnown() && actual.isKnown() && target != actual && !slot.isConflicted()) {
                report(DiagnosticKind.TYPE_CONFLICT, insn,
                        "Storing " + actual.getSourceName() + " into a " + target.getSourceName() + " variable");
                value = new Expr.Cast(target, value);
            } else {
                slot.unify(actual);
            }
            bc.statements.add(new Region.Statement(new Expr.Assign(ref(slot), value)));
        }

        private void consumeSource(int from, int n, @Nullable LocalSlot target, List<Cell> targets, int targetFrom) {
            int sequence = ctx.sequence++;
            for (int k = 0; k < n; k++) {
                Expr value = target != null ? ref(target) : cellValue(targets.get(targetFrom + k));
                Cell cell = newTemp(value, target != null ? k : 0, target != null ? n : 1, sequence);
                cell.consumed = true;
                st.set(from + k, cell);
            }
        }

        private void copyDown(Instruction insn) {
            int back = -insn.getA() / 4;
            int n = insn.getB() / 4;
            ensure(Math.max(back, n), insn);
            int from = st.size() - back;
            int src = st.size() - n;
            if (from == src) return;
            Cell first = st.get(from);
            if (first.slot != null && first.slot.kind == LocalSlot.Kind.RETURN) {
                Expr value = read(st, src, n);
                if (n == 1) {
                    NssType before = first.slot.getType();
                    if (!first.slot.unify(value.type())) {
                        report(DiagnosticKind.TYPE_CONFLICT, insn,
                                "Returning both " + before.getSourceName() + " and " + value.type().getSourceName());
                    }
                }
                bc.statements.add(new Region.Return(value));
                for (int k = 0; k < n; k++) st.get(src + k).consumed = true;
                return;
            }
            LocalSlot slot = storeSlot(st, from, n, true);
            if (slot != null) {
                assign(slot, read(st, src, n), src, insn);
            } else {
                for (int k = 0; k < n; k++) {
                    assign(storeSlot(st, from + k, 1, true), read(st, src + k, 1), src, insn);
                }
            }
            consumeSource(src, n, slot, st, from);
        }

        private List<Cell> globalRange(int back, int n, Instruction insn) {
            List<Cell> globals = ctx.globalCells;
            int from = globals == null ? -1 : globals.size() - back;
            List<Cell> cells = new ArrayList<>(n);
            if (globals == null || from < 0 || from + n > globals.size()) {
                report(DiagnosticKind.STACK_IMBALANCE, insn, "Reference to an unknown global");
                for (int k = 0; k < n; k++) cells.add(Cell.of(placeholder(insn)));
                return cells;
            }
            cells.addAll(globals.subList(from, from + n));
            return cells;
        }

        private void copyTopGlobal(Instruction insn) {
            int n = insn.getB() / 4;
            List<Cell> cells = globalRange(-insn.getA() / 4, n, insn);
            if (n == 1 || n == 3) {
                push(read(cells, 0, n), n);
            } else {
                for (Cell cell : cells) push(cellValue(cell), 1);
            }
            if (n == 1) lastCopyGlobal = insn.getA();
        }

        private void copyDownGlobal(Instruction insn) {
            int n = insn.getB() / 4;
            ensure(n, insn);
            int src = st.size() - n;
            List<Cell> cells = globalRange(-insn.getA() / 4, n, insn);
            LocalSlot slot = storeSlot(cells, 0, n, false);
            if (slot != null) {
                assign(slot, read(st, src, n), src, insn);
            } else {
                for (int k = 0; k < n; k++) {
                    LocalSlot part = cells.get(k).slot;
                    if (part != null) assign(part, read(st, src + k, 1), src, insn);
                }
            }
            consumeSource(src, n, slot, cells, 0);
        }

        private void discard(int n, Instruction insn) {
            ensure(n, insn);
            Set<Expr> emitted = Collections.newSetFromMap(new IdentityHashMap<>());
            for (int k = st.size() - n; k < st.size(); k++) {
                Cell cell = st.get(k);
                if (cell.isTemp() && !cell.consumed && !cell.value.isPure() && emitted.add(cell.value)) {
                    cell.owner.insertAfter(cell.anchor, cell.sequence, new Region.Statement(cell.value));
                    cell.consumed = true;
                }
            }
            st.subList(st.size() - n, st.size()).clear();
        }

        private void action(Instruction insn) {
            int routine = insn.getA();
            int argc = insn.getB();
            SignatureResolver.Resolution res = ctx.resolver.resolve(routine, argc, insn.getOffset());
            List<Expr> args = new ArrayList<>(argc);
            for (int k = 0; k < argc; k++) {
                NssType type = k < res.argTypes.size() ? res.argTypes.get(k) : NssType.ANY;
                if (type == NssType.ACTION) {
                    Expr.Closure closure = pendingClosures.pollLast();
                    if (closure == null) {
                        report(DiagnosticKind.STACK_IMBALANCE, insn, "Action argument without a saved state");
                        closure = new Expr.Closure(null);
                    }
                    args.add(closure);
                    continue;
                }
                Expr arg = pop(Math.max(1, type.getCells()), insn);
                use(arg, type, insn);
                args.add(arg);
            }
            Expr call = res.signature != null
                    ? Expr.Call.engine(res.signature, args)
                    : Expr.Call.unknownEngine(routine, args);
            if (res.returnType == NssType.VOID) {
                bc.statements.add(new Region.Statement(call));
            } else {
                push(call, Math.max(1, res.returnType.getCells()));
            }
        }

        private NssType[] operandTypes(Instruction insn) {
            TypeQualifier q = insn.getQualifier();
            switch (q) {
                case INT_INT:
                    return new NssType[]{NssType.INT, NssType.INT};
                case FLOAT_FLOAT:
                    return new NssType[]{NssType.FLOAT, NssType.FLOAT};
                case OBJECT_OBJECT:
                    return new NssType[]{NssType.OBJECT, NssType.OBJECT};
                case STRING_STRING:
                    return new NssType[]{NssType.STRING, NssType.STRING};
                case STRUCT_STRUCT:
                    return new NssType[]{NssType.STRUCT, NssType.STRUCT};
                case INT_FLOAT:
                    return new NssType[]{NssType.INT, NssType.FLOAT};
                case FLOAT_INT:
                    return new NssType[]{NssType.FLOAT, NssType.INT};
                case VECTOR_VECTOR:
                    return new NssType[]{NssType.VECTOR, NssType.VECTOR};
                case VECTOR_FLOAT:
                    return new NssType[]{NssType.VECTOR, NssType.FLOAT};
                case FLOAT_VECTOR:
                    return new NssType[]{NssType.FLOAT, NssType.VECTOR};
                default: {
                    NssType engine = ctx.variant.engineType(q.engineIndex());
                    return new NssType[]{engine, engine};
                }
            }
        }

        private void binary(Instruction insn) {
            Operator op = BINARY_OPERATORS.get(insn.getOpcode());
            NssType[] types = operandTypes(insn);
            int structCells = Math.max(1, insn.getA() / 4);
            int lc = types[0] == NssType.STRUCT ? structCells : types[0].getCells();
            int rc = types[1] == NssType.STRUCT ? structCells : types[1].getCells();
            Expr rhs = pop(rc, insn);
            Expr lhs = pop(lc, insn);
            use(lhs, types[0], insn);
            use(rhs, types[1], insn);
            NssType result;
            if (op.isComparison() || op == Operator.LOG_AND || op == Operator.LOG_OR) {
                result = NssType.INT;
            } else if (types[0] == NssType.VECTOR || types[1] == NssType.VECTOR) {
                result = NssType.VECTOR;
            } else if (types[0] == NssType.FLOAT || types[1] == NssType.FLOAT) {
                result = NssType.FLOAT;
            } else {
                result = types[0];
            }
            push(new Expr.BinaryOp(op, lhs, rhs, result), result.getCells());
        }

        private void unary(Instruction insn) {
            Operator op;
            NssType type;
            switch (insn.getOpcode()) {
                case NEG:
                    op = Operator.NEG;
                    type = insn.getQualifier() == TypeQualifier.FLOAT ? NssType.FLOAT : NssType.INT;
                    break;
                case COMP:
                    op = Operator.COMP;
                    type = NssType.INT;
                    break;
                default:
                    op = Operator.NOT;
                    type = NssType.INT;
                    break;
            }
            Expr operand = pop(1, insn);
            use(operand, type, insn);
            push(new Expr.UnaryOp(op, operand, type), 1);
        }

        private void incDec(Instruction insn, int copied) {
            boolean increment = insn.getOpcode() == Opcode.INCSP;
            int back = -insn.getA() / 4;
            ensure(back, insn);
            int idx = st.size() - back;
            Cell target = st.get(idx);
            LocalSlot slot = target.slot != null ? target.slot : promote(idx, variableKind());
            Expr ref = ref(slot);
            use(ref, NssType.INT, insn);
            if (copied == idx && idx == st.size() - 2) {
                beforeStore(slot, st.size() - 1);
                st.set(st.size() - 1, newTemp(new Expr.IncDec(ref, increment, false), 0, 1, ctx.sequence++));
            } else {
                beforeStore(slot, st.size());
                bc.statements.add(new Region.Statement(new Expr.IncDec(ref, increment, false)));
            }
        }

        private void incDecGlobal(Instruction insn, int copiedGlobal) {
            boolean increment = insn.getOpcode() == Opcode.INCBP;
            List<Cell> cells = globalRange(-insn.getA() / 4, 1, insn);
            LocalSlot slot = cells.get(0).slot;
            if (slot == null) return;
            Expr ref = ref(slot);
            use(ref, NssType.INT, insn);
            if (copiedGlobal == insn.getA() && !st.isEmpty()) {
                beforeStore(slot, st.size() - 1);
                st.set(st.size() - 1, newTemp(new Expr.IncDec(ref, increment, false), 0, 1, ctx.sequence++));
            } else {
                beforeStore(slot, st.size());
                bc.statements.add(new Region.Statement(new Expr.IncDec(ref, increment, false)));
            }
        }

        private void branch(Instruction insn) {
            Expr condition = pop(1, insn);
            if (sub.forcedSuccessor(local) != -1) return;
            use(condition, NssType.INT, insn);
            bc.setCondition(condition);
        }

        private void call(Instruction insn) {
            Subroutine callee = ctx.byEntry.get(block.getCallee());
            SubroutineSignature target = callee == null ? null : callee.getNullable(CommonExts.SIGNATURE);
            if (target == null) {
                report(DiagnosticKind.STACK_IMBALANCE, insn, "Call to an unknown subroutine");
                return;
            }
            int p = target.paramCells;
            int r = target.returnCells;
            ensure(p + r, insn);
            List<Expr> args = new ArrayList<>(p);
            for (int k = 0; k < p; k++) {
                Expr arg = pop(1, insn);
                LocalSlot param = target.params.get(k);
                NssType before = param.getType();
                if (!param.unify(arg.type())) {
                    report(DiagnosticKind.TYPE_CONFLICT, insn, "Argument " + (k + 1) + " of " + target.getName()
                            + " passed both " + before.getSourceName() + " and " + arg.type().getSourceName());
                }
                use(arg, param.getType(), insn);
                args.add(arg);
            }
            for (int k = 0; k < r; k++) {
                Cell cell = st.get(st.size() - r + k);
                LocalSlot slot = cell.slot;
                if (slot != null && (slot.kind == LocalSlot.Kind.LOCAL || slot.kind == LocalSlot.Kind.GLOBAL)) {
                    target.returnSlots.get(k).unify(slot.getType());
                    slot.cancel();
                }
            }
            st.subList(st.size() - r, st.size()).clear();
            Expr call = Expr.Call.subroutine(target, args);
            if (r == 0) {
                bc.statements.add(new Region.Statement(call));
            } else {
                push(call, r);
            }
        }

        private void destruct(Instruction insn) {
            int total = insn.getA() / 4;
            int keepFrom = insn.getB() / 4;
            int keep = insn.getC() / 4;
            ensure(total, insn);
            int base = st.size() - total;
            List<Cell> kept = new ArrayList<>(keep);
            for (int k = 0; k < keep && base + keepFrom + k < st.size(); k++) {
                Cell cell = st.get(base + keepFrom + k);
                if (cell.isTemp() && cell.width > 1) {
                    Cell component = newTemp(new Expr.Member(cell.value, cell.part), 0, 1, cell.sequence);
                    component.owner = cell.owner;
                    component.anchor = cell.anchor;
                    kept.add(component);
                } else {
                    kept.add(cell);
                }
            }
            st.subList(base, st.size()).clear();
            st.addAll(kept);
        }

        private void saveBp() {
            if (!globalsSub) return;
            for (int i = 0; i < st.size(); i++) {
                if (st.get(i).isTemp()) promote(i, LocalSlot.Kind.GLOBAL);
            }
            ctx.globalCells = new ArrayList<>(st);
            afterSaveBp = true;
            for (int l : rpo) {
                BlockCode code = blocks[l];
                if (code != null) {
                    for (Region stmt : code.statements) {
                        if (stmt instanceof Region.Declare && ((Region.Declare) stmt).slot.isCancelled()) continue;
                        ctx.globalStatements.add(stmt);
                    }
                }
                if (l == local) break;
            }
        }

        private void storeState(Instruction insn) {
            Subroutine closure = ctx.byEntry.get(block.getClosure());
            if (closure == null) {
                report(DiagnosticKind.STACK_IMBALANCE, insn, "Saved state without an action");
                pendingClosures.add(new Expr.Closure(null));
                return;
            }
            new FunctionRecovery(ctx, closure, scope).recover(new ArrayList<>(st));
            pendingClosures.add(new Expr.Closure(closure));
        }

        private void nameSlots() {
            List<LocalSlot> params = sig.params;
            for (int k = 0; k < params.size(); k++) {
                LocalSlot param = params.get(k);
                param.setName(param.getType().getSourceName() + "Param" + (k + 1));
            }
            int counter = 0;
            for (LocalSlot slot : scope.created) {
                if (slot.isCancelled() || slot.isNamed() || slot.kind != LocalSlot.Kind.LOCAL) continue;
                slot.setName(slot.getType().getSourceName() + ++counter);
            }
            if (globalsSub && ctx.globalCells != null) {
                int globals = 0;
                for (Cell cell : ctx.globalCells) {
                    LocalSlot whole = cell.wholeSlot();
                    if (whole == null || whole.isNamed() || whole.kind != LocalSlot.Kind.GLOBAL) continue;
                    whole.setName(whole.getType().getSourceName() + "Global" + ++globals);
                }
            }
        }
    }
}
