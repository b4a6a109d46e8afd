package io.github.eutro.ncs2nss.core.passes.convert;

import io.github.eutro.ncs2nss.core.ast.*;
import io.github.eutro.ncs2nss.core.passes.IRPass;

import java.math.BigDecimal;
import java.util.List;

/**
 * Prints a recovered {@link Script} as NWScript source.
 * <p>
 * Globals come first, then prototypes for every function but the entry point,
 * then the function bodies in bytecode order, which puts the entry point last.
 */
public class EmitSource implements IRPass<Script, String> {
    public static final EmitSource INSTANCE = new EmitSource();

    private static final String INDENT = "    ";
    private static final int PRIMARY = 100;
    private static final int POSTFIX = 14;

    @Override
    public String run(Script script) {
        Printer p = new Printer();
        if (!script.globals.isEmpty()) {
            p.line(0, "// Globals");
            for (Region stmt : script.globals) p.stmt(0, stmt);
            p.blank();
        }
        List<FunctionDecl> functions = script.functions;
        if (functions.size() > 1) {
            p.line(0, "// Prototypes");
            for (int i = 0; i < functions.size() - 1; i++) {
                p.line(0, header(functions.get(i).signature) + ";");
            }
            p.blank();
        }
        for (int i = 0; i < functions.size(); i++) {
            FunctionDecl fn = functions.get(i);
            p.line(0, header(fn.signature) + " {");
            p.body(1, fn.body);
            p.line(0, "}");
            if (i != functions.size() - 1) p.blank();
        }
        return p.toString();
    }

    static String header(SubroutineSignature sig) {
        StringBuilder sb = new StringBuilder();
        sb.append(sig.getReturnType().getSignatureName()).append(' ').append(sig.getName()).append('(');
        for (int i = 0; i < sig.params.size(); i++) {
            if (i != 0) sb.append(", ");
            LocalSlot param = sig.params.get(i);
            sb.append(param.getType().getSignatureName()).append(' ').append(param.getName());
        }
        return sb.append(')').toString();
    }

    private static final class Printer {
        private final StringBuilder sb = new StringBuilder();

        void line(int depth, String text) {
            for (int i = 0; i < depth; i++) sb.append(INDENT);
            sb.append(text).append('\n');
        }

        void blank() {
            sb.append('\n');
        }

        void body(int depth, Region region) {
            for (Region stmt : Region.statements(region)) stmt(depth, stmt);
        }

        void stmt(int depth, Region region) {
            switch (region.kind) {
                case SEQUENCE:
                    body(depth, region);
                    break;
                case DECLARE: {
                    Region.Declare decl = (Region.Declare) region;
                    String text = decl.slot.getType().getSourceName() + " " + decl.slot.getName();
                    if (decl.init != null) text += " = " + expr(decl.init, Operator.ASSIGN_PRECEDENCE);
                    line(depth, text + ";");
                    break;
                }
                case STATEMENT:
                    line(depth, expr(((Region.Statement) region).expr, 0) + ";");
                    break;
                case RETURN: {
                    Expr value = ((Region.Return) region).value;
                    line(depth, value == null ? "return;" : "return " + expr(value, 0) + ";");
                    break;
                }
                case BREAK:
                    line(depth, "break;");
                    break;
                case CONTINUE:
                    line(depth, "continue;");
                    break;
                case IF:
                    ifChain(depth, (Region.If) region);
                    break;
                case WHILE: {
                    Region.While loop = (Region.While) region;
                    line(depth, "while (" + condition(loop.condition) + ") {");
                    body(depth + 1, loop.body);
                    line(depth, "}");
                    break;
                }
                case DO_WHILE: {
                    Region.DoWhile loop = (Region.DoWhile) region;
                    line(depth, "do {");
                    body(depth + 1, loop.body);
                    line(depth, "} while (" + condition(loop.condition) + ");");
                    break;
                }
                case FOR: {
                    Region.For loop = (Region.For) region;
                    line(depth, "for (" + (loop.init == null ? "" : expr(loop.init, 0)) + "; "
                            + condition(loop.condition) + "; "
                            + (loop.step == null ? "" : expr(loop.step, 0)) + ") {");
                    body(depth + 1, loop.body);
                    line(depth, "}");
                    break;
                }
                case SWITCH: {
                    Region.Switch sw = (Region.Switch) region;
                    line(depth, "switch (" + expr(sw.selector, 0) + ") {");
                    for (Region.Case c : sw.cases) {
                        if (c.isDefault()) {
                            line(depth + 1, "default:");
                        } else {
                            for (Expr.Literal label : c.labels) line(depth + 1, "case " + literal(label) + ":");
                        }
                        body(depth + 2, c.body);
                    }
                    line(depth, "}");
                    break;
                }
                case LABEL:
                    line(depth, "// " + label(((Region.Label) region).offset) + ":");
                    break;
                case GOTO:
                    line(depth, "// goto " + label(((Region.Goto) region).offset) + ";");
                    break;
            }
        }

        private void ifChain(int depth, Region.If anIf) {
            line(depth, "if (" + condition(anIf.condition) + ") {");
            Region.If current = anIf;
            while (true) {
                body(depth + 1, current.thenBranch);
                if (current.elseBranch == null) break;
                List<Region> rest = Region.statements(current.elseBranch);
                if (rest.size() == 1 && rest.get(0) instanceof Region.If) {
                    current = (Region.If) rest.get(0);
                    line(depth, "} else if (" + condition(current.condition) + ") {");
                } else {
                    line(depth, "} else {");
                    body(depth + 1, current.elseBranch);
                    break;
                }
            }
            line(depth, "}");
        }

        @Override
        public String toString() {
            return sb.toString();
        }
    }

    private static String label(int offset) {
        return String.format("label_%04x", offset);
    }

    private static String condition(Expr cond) {
        if (cond instanceof Expr.Literal && cond.type() == NssType.INT) {
            int value = (Integer) ((Expr.Literal) cond).value;
            if (value == 1) return "TRUE";
            if (value == 0) return "FALSE";
        }
        return expr(cond, 0);
    }

    private static int precedence(Expr e) {
        switch (e.kind) {
            case BINARY_OP:
                return ((Expr.BinaryOp) e).op.precedence;
            case UNARY_OP:
            case CAST:
                return Operator.UNARY_PRECEDENCE;
            case INC_DEC:
                return ((Expr.IncDec) e).prefix ? Operator.UNARY_PRECEDENCE : POSTFIX;
            case ASSIGN:
                return Operator.ASSIGN_PRECEDENCE;
            case LITERAL: {
                Object value = ((Expr.Literal) e).value;
                boolean negative = value instanceof Integer && (Integer) value < 0
                        || value instanceof Float && (Float) value < 0;
                return negative ? Operator.UNARY_PRECEDENCE : PRIMARY;
            }
            default:
                return PRIMARY;
        }
    }

    /**
     * Print an expression, parenthesized if it binds looser than the context requires.
     *
     * @param e       The expression.
     * @param context The minimum precedence the position accepts without parentheses.
     * @return The source text.
     */
    static String expr(Expr e, int context) {
        String text = bare(e);
        return precedence(e) < context ? "(" + text + ")" : text;
    }

    private static String bare(Expr e) {
        switch (e.kind) {
            case LITERAL:
                return literal((Expr.Literal) e);
            case LOCAL_REF:
            case GLOBAL_REF:
                return variable(((Expr.LocalRef) e).slot);
            case BINARY_OP: {
                Expr.BinaryOp bin = (Expr.BinaryOp) e;
                int p = bin.op.precedence;
                boolean sameAssoc = bin.rhs instanceof Expr.BinaryOp && ((Expr.BinaryOp) bin.rhs).op == bin.op
                        && bin.op.isAssociative();
                return expr(bin.lhs, p) + " " + bin.op.symbol + " " + expr(bin.rhs, sameAssoc ? p : p + 1);
            }
            case UNARY_OP: {
                Expr.UnaryOp un = (Expr.UnaryOp) e;
                String operand = expr(un.operand, Operator.UNARY_PRECEDENCE);
                // keep "- -x" from printing as a decrement
                if (un.op == Operator.NEG && operand.startsWith("-")) operand = "(" + operand + ")";
                return un.op.symbol + operand;
            }
            case CALL: {
                Expr.Call call = (Expr.Call) e;
                StringBuilder sb = new StringBuilder(call.getName()).append('(');
                for (int i = 0; i < call.args.size(); i++) {
                    if (i != 0) sb.append(", ");
                    sb.append(expr(call.args.get(i), Operator.ASSIGN_PRECEDENCE));
                }
                return sb.append(')').toString();
            }
            case CAST: {
                Expr.Cast cast = (Expr.Cast) e;
                return "(" + cast.type().getSourceName() + ")" + expr(cast.operand, Operator.UNARY_PRECEDENCE);
            }
            case ASSIGN: {
                Expr.Assign assign = (Expr.Assign) e;
                String op = assign.compound == null ? "=" : assign.compound.symbol + "=";
                return expr(assign.target, PRIMARY) + " " + op + " " + expr(assign.value, Operator.ASSIGN_PRECEDENCE);
            }
            case INC_DEC: {
                Expr.IncDec incDec = (Expr.IncDec) e;
                String op = incDec.increment ? "++" : "--";
                String target = expr(incDec.target, PRIMARY);
                return incDec.prefix ? op + target : target + op;
            }
            case VECTOR_LITERAL: {
                Expr.VectorLiteral vec = (Expr.VectorLiteral) e;
                if (vec.x instanceof Expr.Literal && vec.y instanceof Expr.Literal && vec.z instanceof Expr.Literal) {
                    return "[" + bare(vec.x) + ", " + bare(vec.y) + ", " + bare(vec.z) + "]";
                }
                return "Vector(" + expr(vec.x, Operator.ASSIGN_PRECEDENCE) + ", "
                        + expr(vec.y, Operator.ASSIGN_PRECEDENCE) + ", "
                        + expr(vec.z, Operator.ASSIGN_PRECEDENCE) + ")";
            }
            case MEMBER: {
                Expr.Member member = (Expr.Member) e;
                return expr(member.operand, PRIMARY) + "." + member.getMemberName();
            }
            case CLOSURE: {
                Expr.Closure closure = (Expr.Closure) e;
                Expr single = closure.asExpression();
                if (single != null) return expr(single, Operator.ASSIGN_PRECEDENCE);
                int n = Region.statements(closure.getBody()).size();
                return "/* action of " + n + " statements */";
            }
            default:
                throw new IllegalArgumentException("Unknown expression kind " + e.kind);
        }
    }

    private static String variable(LocalSlot slot) {
        LocalSlot vector = slot.getAliasOf();
        if (vector != null) return vector.getName() + "." + "xyz".charAt(slot.getComponent());
        return slot.getName();
    }

    static String literal(Expr.Literal lit) {
        switch (lit.type()) {
            case FLOAT:
                return formatFloat((Float) lit.value);
            case STRING:
                return quote((String) lit.value);
            case OBJECT: {
                int value = (Integer) lit.value;
                return value == 0 ? "OBJECT_SELF" : "OBJECT_INVALID";
            }
            default:
                return String.valueOf(lit.value);
        }
    }

    static String formatFloat(float f) {
        if (Float.isNaN(f) || Float.isInfinite(f)) return "0.0";
        String text = new BigDecimal(Float.toString(f)).toPlainString();
        return text.indexOf('.') == -1 ? text + ".0" : text;
    }

    static String quote(String s) {
        StringBuilder sb = new StringBuilder("\"");
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"':
                    sb.append("\\\"");
                    break;
                case '\\':
                    sb.append("\\\\");
                    break;
                case '\n':
                    sb.append("\\n");
                    break;
                default:
                    sb.append(c);
                    break;
            }
        }
        return sb.append('"').toString();
    }
}
