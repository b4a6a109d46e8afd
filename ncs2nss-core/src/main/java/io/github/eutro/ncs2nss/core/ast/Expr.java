package io.github.eutro.ncs2nss.core.ast;

import io.github.eutro.ncs2nss.core.actions.EngineFunctionSignature;
import io.github.eutro.ncs2nss.core.cfg.Subroutine;
import io.github.eutro.ncs2nss.core.ext.CommonExts;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * An expression, built bottom-up from stack effects. Immutable once built.
 * <p>
 * The variants are the nested classes, told apart by {@link #kind}.
 * Equality is structural, except that calls are only ever equal to themselves.
 */
public abstract class Expr {
    public enum Kind {
        LITERAL,
        LOCAL_REF,
        GLOBAL_REF,
        BINARY_OP,
        UNARY_OP,
        CALL,
        CAST,
        ASSIGN,
        INC_DEC,
        VECTOR_LITERAL,
        MEMBER,
        CLOSURE,
    }

    @NotNull
    public final Kind kind;

    Expr(@NotNull Kind kind) {
        this.kind = kind;
    }

    @NotNull
    public abstract NssType type();

    /**
     * Whether evaluating this has no side effects, so it may be dropped or duplicated.
     *
     * @return Whether this is pure.
     */
    public boolean isPure() {
        boolean[] pure = {true};
        forEachChild(c -> pure[0] &= c.isPure());
        return pure[0];
    }

    /**
     * Visit the direct subexpressions, left to right.
     *
     * @param f The visitor.
     */
    public void forEachChild(Consumer<Expr> f) {
    }

    /**
     * Whether this refers to the slot anywhere.
     *
     * @param slot The slot.
     * @return Whether it is referenced.
     */
    public boolean references(LocalSlot slot) {
        boolean[] found = {false};
        forEachChild(c -> found[0] |= c.references(slot));
        return found[0];
    }

    /**
     * Collect the slots this refers to, in order of first reference.
     *
     * @param into The list to add to.
     */
    public void collectSlots(List<LocalSlot> into) {
        forEachChild(c -> c.collectSlots(into));
    }

    /**
     * Build the logical negation of a condition, inverting comparisons rather than wrapping them.
     *
     * @param cond The condition.
     * @return The negated condition.
     */
    public static Expr negate(Expr cond) {
        if (cond instanceof BinaryOp) {
            BinaryOp bin = (BinaryOp) cond;
            Operator inverse = bin.op.inverse();
            if (inverse != null) return new BinaryOp(inverse, bin.lhs, bin.rhs, bin.type);
        } else if (cond instanceof UnaryOp && ((UnaryOp) cond).op == Operator.NOT) {
            return ((UnaryOp) cond).operand;
        }
        return new UnaryOp(Operator.NOT, cond, NssType.INT);
    }

    public static final class Literal extends Expr {
        @NotNull
        private final NssType type;
        /**
         * An {@link Integer}, {@link Float} or {@link String}. Objects are integers, with 0 for
         * {@code OBJECT_SELF} and 1 for {@code OBJECT_INVALID}.
         */
        @NotNull
        public final Object value;

        public Literal(@NotNull NssType type, @NotNull Object value) {
            super(Kind.LITERAL);
            this.type = type;
            this.value = value;
        }

        public static Literal ofInt(int value) {
            return new Literal(NssType.INT, value);
        }

        @NotNull
        @Override
        public NssType type() {
            return type;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Literal)) return false;
            Literal literal = (Literal) o;
            return type == literal.type && value.equals(literal.value);
        }

        @Override
        public int hashCode() {
            return Objects.hash(type, value);
        }
    }

    /**
     * A local variable or parameter. Also used for globals, through {@link GlobalRef}.
     */
    public static class LocalRef extends Expr {
        @NotNull
        public final LocalSlot slot;

        public LocalRef(@NotNull LocalSlot slot) {
            this(Kind.LOCAL_REF, slot);
        }

        LocalRef(Kind kind, @NotNull LocalSlot slot) {
            super(kind);
            this.slot = slot;
        }

        @NotNull
        @Override
        public NssType type() {
            return slot.getType();
        }

        @Override
        public boolean references(LocalSlot slot) {
            return this.slot == slot || this.slot.getAliasOf() == slot;
        }

        @Override
        public void collectSlots(List<LocalSlot> into) {
            if (!into.contains(slot)) into.add(slot);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || o.getClass() != getClass()) return false;
            return slot == ((LocalRef) o).slot;
        }

        @Override
        public int hashCode() {
            return System.identityHashCode(slot);
        }
    }

    public static final class GlobalRef extends LocalRef {
        public GlobalRef(@NotNull LocalSlot slot) {
            super(Kind.GLOBAL_REF, slot);
        }
    }

    public static final class BinaryOp extends Expr {
        @NotNull
        public final Operator op;
        @NotNull
        public final Expr lhs, rhs;
        @NotNull
        private final NssType type;

        public BinaryOp(@NotNull Operator op, @NotNull Expr lhs, @NotNull Expr rhs, @NotNull NssType type) {
            super(Kind.BINARY_OP);
            this.op = op;
            this.lhs = lhs;
            this.rhs = rhs;
            this.type = type;
        }

        @NotNull
        @Override
        public NssType type() {
            return type;
        }

        @Override
        public void forEachChild(Consumer<Expr> f) {
            f.accept(lhs);
            f.accept(rhs);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof BinaryOp)) return false;
            BinaryOp that = (BinaryOp) o;
            return op == that.op && lhs.equals(that.lhs) && rhs.equals(that.rhs);
        }

        @Override
        public int hashCode() {
            return Objects.hash(op, lhs, rhs);
        }
    }

    public static final class UnaryOp extends Expr {
        @NotNull
        public final Operator op;
        @NotNull
        public final Expr operand;
        @NotNull
        private final NssType type;

        public UnaryOp(@NotNull Operator op, @NotNull Expr operand, @NotNull NssType type) {
            super(Kind.UNARY_OP);
            this.op = op;
            this.operand = operand;
            this.type = type;
        }

        @NotNull
        @Override
        public NssType type() {
            return type;
        }

        @Override
        public void forEachChild(Consumer<Expr> f) {
            f.accept(operand);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof UnaryOp)) return false;
            UnaryOp that = (UnaryOp) o;
            return op == that.op && operand.equals(that.operand);
        }

        @Override
        public int hashCode() {
            return Objects.hash(op, operand);
        }
    }

    /**
     * A call to an engine function or a subroutine of the script. Exactly one of
     * {@link #engine} and {@link #subroutine} is set, unless the engine function is unknown.
     */
    public static final class Call extends Expr {
        @NotNull
        public final String name;
        @Nullable
        public final EngineFunctionSignature engine;
        @Nullable
        public final SubroutineSignature subroutine;
        @NotNull
        public final List<Expr> args;
        @NotNull
        private final NssType type;

        private Call(@NotNull String name,
                     @Nullable EngineFunctionSignature engine,
                     @Nullable SubroutineSignature subroutine,
                     @NotNull List<Expr> args,
                     @NotNull NssType type) {
            super(Kind.CALL);
            this.name = name;
            this.engine = engine;
            this.subroutine = subroutine;
            this.args = Collections.unmodifiableList(new ArrayList<>(args));
            this.type = type;
        }

        public static Call engine(@NotNull EngineFunctionSignature sig, @NotNull List<Expr> args) {
            return new Call(sig.name, sig, null, args, sig.returnType);
        }

        /**
         * A call to an engine function missing from the signature table.
         *
         * @param routine The routine index.
         * @param args    The arguments.
         * @return The call.
         */
        public static Call unknownEngine(int routine, @NotNull List<Expr> args) {
            return new Call("Action_" + routine, null, null, args, NssType.ANY);
        }

        public static Call subroutine(@NotNull SubroutineSignature sig, @NotNull List<Expr> args) {
            return new Call(sig.getName(), null, sig, args, NssType.VOID);
        }

        /**
         * Get the name to call. Subroutines are named only once the whole script is recovered.
         *
         * @return The name.
         */
        @NotNull
        public String getName() {
            return subroutine != null ? subroutine.getName() : name;
        }

        @NotNull
        @Override
        public NssType type() {
            return subroutine != null ? subroutine.getReturnType() : type;
        }

        @Override
        public boolean isPure() {
            return false;
        }

        @Override
        public void forEachChild(Consumer<Expr> f) {
            args.forEach(f);
        }
    }

    public static final class Cast extends Expr {
        @NotNull
        private final NssType type;
        @NotNull
        public final Expr operand;

        public Cast(@NotNull NssType type, @NotNull Expr operand) {
            super(Kind.CAST);
            this.type = type;
            this.operand = operand;
        }

        @NotNull
        @Override
        public NssType type() {
            return type;
        }

        @Override
        public void forEachChild(Consumer<Expr> f) {
            f.accept(operand);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Cast)) return false;
            Cast that = (Cast) o;
            return type == that.type && operand.equals(that.operand);
        }

        @Override
        public int hashCode() {
            return Objects.hash(type, operand);
        }
    }

    /**
     * An assignment, {@code target = value} or, with an operator, {@code target op= value}.
     */
    public static final class Assign extends Expr {
        @NotNull
        public final Expr target;
        @Nullable
        public final Operator compound;
        @NotNull
        public final Expr value;

        public Assign(@NotNull Expr target, @Nullable Operator compound, @NotNull Expr value) {
            super(Kind.ASSIGN);
            this.target = target;
            this.compound = compound;
            this.value = value;
        }

        public Assign(@NotNull Expr target, @NotNull Expr value) {
            this(target, null, value);
        }

        @NotNull
        @Override
        public NssType type() {
            return target.type();
        }

        @Override
        public boolean isPure() {
            return false;
        }

        @Override
        public void forEachChild(Consumer<Expr> f) {
            f.accept(target);
            f.accept(value);
        }
    }

    public static final class IncDec extends Expr {
        @NotNull
        public final Expr target;
        public final boolean increment;
        public final boolean prefix;

        public IncDec(@NotNull Expr target, boolean increment, boolean prefix) {
            super(Kind.INC_DEC);
            this.target = target;
            this.increment = increment;
            this.prefix = prefix;
        }

        @NotNull
        @Override
        public NssType type() {
            return target.type();
        }

        @Override
        public boolean isPure() {
            return false;
        }

        @Override
        public void forEachChild(Consumer<Expr> f) {
            f.accept(target);
        }
    }

    public static final class VectorLiteral extends Expr {
        @NotNull
        public final Expr x, y, z;

        public VectorLiteral(@NotNull Expr x, @NotNull Expr y, @NotNull Expr z) {
            super(Kind.VECTOR_LITERAL);
            this.x = x;
            this.y = y;
            this.z = z;
        }

        @NotNull
        @Override
        public NssType type() {
            return NssType.VECTOR;
        }

        @Override
        public void forEachChild(Consumer<Expr> f) {
            f.accept(x);
            f.accept(y);
            f.accept(z);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof VectorLiteral)) return false;
            VectorLiteral that = (VectorLiteral) o;
            return x.equals(that.x) && y.equals(that.y) && z.equals(that.z);
        }

        @Override
        public int hashCode() {
            return Objects.hash(x, y, z);
        }
    }

    /**
     * A component of a vector: {@code .x}, {@code .y} or {@code .z}.
     */
    public static final class Member extends Expr {
        private static final String[] NAMES = {"x", "y", "z"};

        @NotNull
        public final Expr operand;
        public final int component;

        public Member(@NotNull Expr operand, int component) {
            super(Kind.MEMBER);
            this.operand = operand;
            this.component = component;
        }

        public String getMemberName() {
            return NAMES[component];
        }

        @NotNull
        @Override
        public NssType type() {
            return NssType.FLOAT;
        }

        @Override
        public void forEachChild(Consumer<Expr> f) {
            f.accept(operand);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Member)) return false;
            Member that = (Member) o;
            return component == that.component && operand.equals(that.operand);
        }

        @Override
        public int hashCode() {
            return Objects.hash(operand, component);
        }
    }

    /**
     * A deferred action, as passed to {@code DelayCommand} or {@code AssignCommand}.
     * <p>
     * The action's code is a subroutine of its own, whose structured body is read when it is needed.
     */
    public static final class Closure extends Expr {
        @Nullable
        public final Subroutine subroutine;

        public Closure(@Nullable Subroutine subroutine) {
            super(Kind.CLOSURE);
            this.subroutine = subroutine;
        }

        /**
         * Get the structured code of the action.
         *
         * @return The body, or an empty sequence if the action's code could not be found.
         */
        @NotNull
        public Region getBody() {
            Region body = subroutine == null ? null : subroutine.getNullable(CommonExts.BODY);
            return body == null ? new Region.Sequence(Collections.emptyList()) : body;
        }

        /**
         * Get the single expression the action evaluates, if it is that simple.
         *
         * @return The expression, or null.
         */
        @Nullable
        public Expr asExpression() {
            List<Region> stmts = Region.statements(getBody());
            if (!stmts.isEmpty() && stmts.get(stmts.size() - 1) instanceof Region.Return
                    && ((Region.Return) stmts.get(stmts.size() - 1)).value == null) {
                stmts.remove(stmts.size() - 1);
            }
            if (stmts.size() == 1 && stmts.get(0) instanceof Region.Statement) {
                return ((Region.Statement) stmts.get(0)).expr;
            }
            return null;
        }

        @NotNull
        @Override
        public NssType type() {
            return NssType.ACTION;
        }

        @Override
        public boolean isPure() {
            return true;
        }
    }
}
