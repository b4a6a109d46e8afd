package io.github.eutro.ncs2nss.core.ast;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A node of the structured statement tree. The variants are the nested classes, told apart by {@link #kind}.
 */
public abstract class Region {
    public enum Kind {
        SEQUENCE,
        IF,
        WHILE,
        DO_WHILE,
        FOR,
        SWITCH,
        BREAK,
        CONTINUE,
        RETURN,
        STATEMENT,
        DECLARE,
        LABEL,
        GOTO,
    }

    @NotNull
    public final Kind kind;

    Region(@NotNull Kind kind) {
        this.kind = kind;
    }

    /**
     * Whether control never continues past this region normally.
     *
     * @return Whether this ends in a return, break, continue or goto.
     */
    public boolean isTerminal() {
        switch (kind) {
            case RETURN:
            case BREAK:
            case CONTINUE:
            case GOTO:
                return true;
            case SEQUENCE: {
                List<Region> children = ((Sequence) this).children;
                return !children.isEmpty() && children.get(children.size() - 1).isTerminal();
            }
            case IF: {
                If anIf = (If) this;
                return anIf.elseBranch != null && anIf.thenBranch.isTerminal() && anIf.elseBranch.isTerminal();
            }
            default:
                return false;
        }
    }

    /**
     * Flatten a region into a list of statements, unwrapping sequences.
     *
     * @param region The region.
     * @return A new, mutable list.
     */
    public static List<Region> statements(Region region) {
        List<Region> out = new ArrayList<>();
        if (region instanceof Sequence) {
            for (Region child : ((Sequence) region).children) {
                out.addAll(statements(child));
            }
        } else {
            out.add(region);
        }
        return out;
    }

    public static final class Sequence extends Region {
        public final List<Region> children;

        public Sequence(List<Region> children) {
            super(Kind.SEQUENCE);
            this.children = Collections.unmodifiableList(new ArrayList<>(children));
        }

        public boolean isEmpty() {
            return children.isEmpty();
        }
    }

    public static final class If extends Region {
        @NotNull
        public final Expr condition;
        @NotNull
        public final Region thenBranch;
        @Nullable
        public final Region elseBranch;

        public If(@NotNull Expr condition, @NotNull Region thenBranch, @Nullable Region elseBranch) {
            super(Kind.IF);
            this.condition = condition;
            this.thenBranch = thenBranch;
            this.elseBranch = elseBranch;
        }
    }

    public static final class While extends Region {
        @NotNull
        public final Expr condition;
        @NotNull
        public final Region body;

        public While(@NotNull Expr condition, @NotNull Region body) {
            super(Kind.WHILE);
            this.condition = condition;
            this.body = body;
        }
    }

    public static final class DoWhile extends Region {
        @NotNull
        public final Region body;
        @NotNull
        public final Expr condition;

        public DoWhile(@NotNull Region body, @NotNull Expr condition) {
            super(Kind.DO_WHILE);
            this.body = body;
            this.condition = condition;
        }
    }

    public static final class For extends Region {
        @Nullable
        public final Expr init;
        @NotNull
        public final Expr condition;
        @Nullable
        public final Expr step;
        @NotNull
        public final Region body;

        public For(@Nullable Expr init, @NotNull Expr condition, @Nullable Expr step, @NotNull Region body) {
            super(Kind.FOR);
            this.init = init;
            this.condition = condition;
            this.step = step;
            this.body = body;
        }
    }

    /**
     * One arm of a {@link Switch}. An arm with no labels is the default.
     */
    public static final class Case {
        public final List<Expr.Literal> labels;
        @NotNull
        public final Region body;

        public Case(List<Expr.Literal> labels, @NotNull Region body) {
            this.labels = Collections.unmodifiableList(new ArrayList<>(labels));
            this.body = body;
        }

        public boolean isDefault() {
            return labels.isEmpty();
        }
    }

    public static final class Switch extends Region {
        @NotNull
        public final Expr selector;
        public final List<Case> cases;

        public Switch(@NotNull Expr selector, List<Case> cases) {
            super(Kind.SWITCH);
            this.selector = selector;
            this.cases = Collections.unmodifiableList(new ArrayList<>(cases));
        }
    }

    public static final class Break extends Region {
        public static final Break INSTANCE = new Break();

        private Break() {
            super(Kind.BREAK);
        }
    }

    public static final class Continue extends Region {
        public static final Continue INSTANCE = new Continue();

        private Continue() {
            super(Kind.CONTINUE);
        }
    }

    public static final class Return extends Region {
        @Nullable
        public final Expr value;

        public Return(@Nullable Expr value) {
            super(Kind.RETURN);
            this.value = value;
        }
    }

    /**
     * An expression evaluated for its effect: a call, assignment or increment.
     */
    public static final class Statement extends Region {
        @NotNull
        public final Expr expr;

        public Statement(@NotNull Expr expr) {
            super(Kind.STATEMENT);
            this.expr = expr;
        }
    }

    public static final class Declare extends Region {
        @NotNull
        public final LocalSlot slot;
        @Nullable
        public final Expr init;

        public Declare(@NotNull LocalSlot slot, @Nullable Expr init) {
            super(Kind.DECLARE);
            this.slot = slot;
            this.init = init;
        }
    }

    /**
     * Marks code that could not be structured, by the offset of its first instruction.
     */
    public static final class Label extends Region {
        public final int offset;

        public Label(int offset) {
            super(Kind.LABEL);
            this.offset = offset;
        }
    }

    /**
     * A jump into code already placed elsewhere, which structured statements cannot express.
     */
    public static final class Goto extends Region {
        public final int offset;

        public Goto(int offset) {
            super(Kind.GOTO);
            this.offset = offset;
        }
    }
}
