package com.garnet.ast.print;

import com.garnet.ast.EmptyTree;
import com.garnet.ast.Expression;
import com.garnet.ast.TreeVisitor;
import com.garnet.ast.decl.*;
import com.garnet.ast.expr.*;
import com.garnet.ast.flow.*;
import com.garnet.ast.ref.*;
import com.garnet.core.GlobalState;
import com.garnet.core.SymbolRef;

import java.util.List;

import static com.garnet.ast.print.PrintUtils.printTabs;

/**
 * 结构化输出：每个节点打印种类名和全部字段，用于调试和快照测试。
 *
 * <pre>
 * Assign{
 *   lhs = ...
 *   rhs = ...
 * }
 * </pre>
 */
public class RawTreePrinter implements TreeVisitor<String, Integer> {

    private final GlobalState gs;

    public RawTreePrinter(GlobalState gs) {
        this.gs = gs;
    }

    public String print(Expression tree) {
        return tree.accept(this, 0);
    }

    private String raw(Expression tree, int tabs) {
        return tree.accept(this, tabs);
    }

    private String symbolName(SymbolRef symbol) {
        return symbol.data(gs).getName().show(gs);
    }

    private String fullName(SymbolRef symbol) {
        return symbol.data(gs).fullName(gs);
    }

    private static void open(StringBuilder sb, Expression node) {
        sb.append(node.nodeName()).append("{").append('\n');
    }

    private static void close(StringBuilder sb, int tabs) {
        printTabs(sb, tabs);
        sb.append("}");
    }

    private void field(StringBuilder sb, int tabs, String name, String value) {
        printTabs(sb, tabs + 1);
        sb.append(name).append(" = ").append(value).append('\n');
    }

    private void child(StringBuilder sb, int tabs, String name, Expression value) {
        field(sb, tabs, name, raw(value, tabs + 1));
    }

    /**
     * 单行列表：name = [a, b]
     */
    private void inlineList(StringBuilder sb, int tabs, String name, List<? extends Expression> elems) {
        printTabs(sb, tabs + 1);
        sb.append(name).append(" = [");
        boolean first = true;
        for (Expression e : elems) {
            if (!first) {
                sb.append(", ");
            }
            first = false;
            sb.append(raw(e, tabs + 2));
        }
        sb.append("]").append('\n');
    }

    /**
     * 多行列表，每个元素独占一行
     */
    private void blockList(StringBuilder sb, int tabs, String name, List<? extends Expression> elems) {
        printTabs(sb, tabs + 1);
        sb.append(name).append(" = [").append('\n');
        for (Expression e : elems) {
            printTabs(sb, tabs + 2);
            sb.append(raw(e, tabs + 2)).append('\n');
        }
        printTabs(sb, tabs + 1);
        sb.append("]").append('\n');
    }

    private String shortForm(Expression node, String field, Expression value, int tabs) {
        return node.nodeName() + "{ " + field + " = " + raw(value, tabs) + " }";
    }

    // ===== 定义 =====

    @Override
    public String visitClassDef(ClassDef node, Integer tabs) {
        StringBuilder sb = new StringBuilder();
        open(sb, node);
        field(sb, tabs, "kind", node.getKind() == ClassDefKind.MODULE ? "module" : "class");
        field(sb, tabs, "name", raw(node.getName(), tabs + 1) + "<" + symbolName(node.getSymbol()) + ">");
        inlineList(sb, tabs, "ancestors", node.getAncestors());
        printTabs(sb, tabs + 1);
        sb.append("rhs = [").append('\n');
        boolean first = true;
        for (Expression stat : node.getRhs()) {
            if (!first) {
                sb.append('\n');
            }
            first = false;
            printTabs(sb, tabs + 2);
            sb.append(raw(stat, tabs + 2)).append('\n');
        }
        printTabs(sb, tabs + 1);
        sb.append("]").append('\n');
        close(sb, tabs);
        return sb.toString();
    }

    @Override
    public String visitMethodDef(MethodDef node, Integer tabs) {
        StringBuilder sb = new StringBuilder();
        open(sb, node);
        StringBuilder flags = new StringBuilder();
        if (node.isSelf()) {
            flags.append(" self");
        }
        if (node.isDslSynthesized()) {
            flags.append(" dsl");
        }
        printTabs(sb, tabs + 1);
        sb.append("flags =").append(flags.length() == 0 ? " 0" : flags.toString()).append('\n');
        field(sb, tabs, "name", node.getName().show(gs) + "<" + symbolName(node.getSymbol()) + ">");
        inlineList(sb, tabs, "args", node.getArgs());
        child(sb, tabs, "rhs", node.getRhs());
        close(sb, tabs);
        return sb.toString();
    }

    // ===== 控制流 =====

    @Override
    public String visitIf(If node, Integer tabs) {
        StringBuilder sb = new StringBuilder();
        open(sb, node);
        child(sb, tabs, "cond", node.getCond());
        child(sb, tabs, "thenp", node.getThenp());
        child(sb, tabs, "elsep", node.getElsep());
        close(sb, tabs);
        return sb.toString();
    }

    @Override
    public String visitWhile(While node, Integer tabs) {
        StringBuilder sb = new StringBuilder();
        open(sb, node);
        child(sb, tabs, "cond", node.getCond());
        child(sb, tabs, "body", node.getBody());
        close(sb, tabs);
        return sb.toString();
    }

    @Override
    public String visitBreak(Break node, Integer tabs) {
        return shortForm(node, "expr", node.getExpr(), tabs);
    }

    @Override
    public String visitRetry(Retry node, Integer tabs) {
        return "Retry{}";
    }

    @Override
    public String visitNext(Next node, Integer tabs) {
        return shortForm(node, "expr", node.getExpr(), tabs);
    }

    @Override
    public String visitReturn(Return node, Integer tabs) {
        return shortForm(node, "expr", node.getExpr(), tabs);
    }

    @Override
    public String visitYield(Yield node, Integer tabs) {
        StringBuilder sb = new StringBuilder();
        open(sb, node);
        blockList(sb, tabs, "args", node.getArgs());
        close(sb, tabs);
        return sb.toString();
    }

    @Override
    public String visitRescueCase(RescueCase node, Integer tabs) {
        StringBuilder sb = new StringBuilder();
        open(sb, node);
        blockList(sb, tabs, "exceptions", node.getExceptions());
        child(sb, tabs, "var", node.getVar());
        child(sb, tabs, "body", node.getBody());
        close(sb, tabs);
        return sb.toString();
    }

    @Override
    public String visitRescue(Rescue node, Integer tabs) {
        StringBuilder sb = new StringBuilder();
        open(sb, node);
        child(sb, tabs, "body", node.getBody());
        blockList(sb, tabs, "rescueCases", node.getRescueCases());
        child(sb, tabs, "else", node.getElse());
        child(sb, tabs, "ensure", node.getEnsure());
        close(sb, tabs);
        return sb.toString();
    }

    // ===== 引用与形参 =====

    @Override
    public String visitField(Field node, Integer tabs) {
        StringBuilder sb = new StringBuilder();
        open(sb, node);
        field(sb, tabs, "symbol", fullName(node.getSymbol()));
        close(sb, tabs);
        return sb.toString();
    }

    @Override
    public String visitLocal(Local node, Integer tabs) {
        StringBuilder sb = new StringBuilder();
        open(sb, node);
        field(sb, tabs, "localVariable", node.getLocalVariable().toString(gs));
        close(sb, tabs);
        return sb.toString();
    }

    @Override
    public String visitUnresolvedIdent(UnresolvedIdent node, Integer tabs) {
        String kind;
        switch (node.getKind()) {
            case INSTANCE:
                kind = "Instance";
                break;
            case CLASS:
                kind = "Class";
                break;
            case GLOBAL:
                kind = "Global";
                break;
            default:
                kind = "Local";
        }
        StringBuilder sb = new StringBuilder();
        open(sb, node);
        field(sb, tabs, "kind", kind);
        field(sb, tabs, "name", node.getName().show(gs));
        close(sb, tabs);
        return sb.toString();
    }

    @Override
    public String visitRestArg(RestArg node, Integer tabs) {
        return shortForm(node, "expr", node.getExpr(), tabs);
    }

    @Override
    public String visitKeywordArg(KeywordArg node, Integer tabs) {
        return shortForm(node, "expr", node.getExpr(), tabs);
    }

    @Override
    public String visitOptionalArg(OptionalArg node, Integer tabs) {
        StringBuilder sb = new StringBuilder();
        open(sb, node);
        child(sb, tabs, "expr", node.getExpr());
        child(sb, tabs, "default_", node.getDefault());
        close(sb, tabs);
        return sb.toString();
    }

    @Override
    public String visitShadowArg(ShadowArg node, Integer tabs) {
        return shortForm(node, "expr", node.getExpr(), tabs);
    }

    @Override
    public String visitBlockArg(BlockArg node, Integer tabs) {
        return shortForm(node, "expr", node.getExpr(), tabs);
    }

    // ===== 指令 =====

    @Override
    public String visitAssign(Assign node, Integer tabs) {
        StringBuilder sb = new StringBuilder();
        open(sb, node);
        child(sb, tabs, "lhs", node.getLhs());
        child(sb, tabs, "rhs", node.getRhs());
        close(sb, tabs);
        return sb.toString();
    }

    @Override
    public String visitSend(Send node, Integer tabs) {
        StringBuilder sb = new StringBuilder();
        open(sb, node);
        child(sb, tabs, "recv", node.getRecv());
        field(sb, tabs, "fun", node.getFun().show(gs));
        field(sb, tabs, "block", node.hasBlock() ? raw(node.getBlock(), tabs + 1) : "null");
        blockList(sb, tabs, "args", node.getArgs());
        close(sb, tabs);
        return sb.toString();
    }

    @Override
    public String visitCast(Cast node, Integer tabs) {
        StringBuilder sb = new StringBuilder();
        open(sb, node);
        field(sb, tabs, "cast", "T." + node.getCast().show(gs));
        child(sb, tabs, "arg", node.getArg());
        field(sb, tabs, "type", node.getType().toString(gs));
        close(sb, tabs);
        return sb.toString();
    }

    @Override
    public String visitZSuperArgs(ZSuperArgs node, Integer tabs) {
        return "ZSuperArgs{ }";
    }

    @Override
    public String visitHash(Hash node, Integer tabs) {
        StringBuilder sb = new StringBuilder();
        open(sb, node);
        printTabs(sb, tabs + 1);
        sb.append("pairs = [").append('\n');
        for (int i = 0; i < node.getKeys().size(); i++) {
            printTabs(sb, tabs + 2);
            sb.append("[").append('\n');
            printTabs(sb, tabs + 3);
            sb.append("key = ").append(raw(node.getKeys().get(i), tabs + 3)).append('\n');
            printTabs(sb, tabs + 3);
            sb.append("value = ").append(raw(node.getValues().get(i), tabs + 3)).append('\n');
            printTabs(sb, tabs + 2);
            sb.append("]").append('\n');
        }
        printTabs(sb, tabs + 1);
        sb.append("]").append('\n');
        close(sb, tabs);
        return sb.toString();
    }

    @Override
    public String visitArray(Array node, Integer tabs) {
        StringBuilder sb = new StringBuilder();
        open(sb, node);
        blockList(sb, tabs, "elems", node.getElems());
        close(sb, tabs);
        return sb.toString();
    }

    @Override
    public String visitLiteral(Literal node, Integer tabs) {
        return "Literal{ value = " + node.toString(gs) + " }";
    }

    @Override
    public String visitUnresolvedConstantLit(UnresolvedConstantLit node, Integer tabs) {
        StringBuilder sb = new StringBuilder();
        open(sb, node);
        child(sb, tabs, "scope", node.getScope());
        field(sb, tabs, "cnst", node.getCnst().show(gs));
        close(sb, tabs);
        return sb.toString();
    }

    @Override
    public String visitConstantLit(ConstantLit node, Integer tabs) {
        StringBuilder sb = new StringBuilder();
        open(sb, node);
        field(sb, tabs, "orig", node.getOriginal() != null ? raw(node.getOriginal(), tabs + 1) : "null");
        field(sb, tabs, "symbol", fullName(node.getSymbol()));
        field(sb, tabs, "typeAlias", node.getTypeAlias() != null ? raw(node.getTypeAlias(), tabs + 1) : "null");
        close(sb, tabs);
        return sb.toString();
    }

    @Override
    public String visitSelf(Self node, Integer tabs) {
        return "Self{ claz = " + fullName(node.getClaz()) + " }";
    }

    @Override
    public String visitBlock(Block node, Integer tabs) {
        StringBuilder sb = new StringBuilder();
        open(sb, node);
        inlineList(sb, tabs, "args", node.getArgs());
        child(sb, tabs, "body", node.getBody());
        close(sb, tabs);
        return sb.toString();
    }

    @Override
    public String visitInsSeq(InsSeq node, Integer tabs) {
        StringBuilder sb = new StringBuilder();
        open(sb, node);
        blockList(sb, tabs, "stats", node.getStats());
        child(sb, tabs, "expr", node.getExpr());
        close(sb, tabs);
        return sb.toString();
    }

    @Override
    public String visitEmptyTree(EmptyTree node, Integer tabs) {
        return "EmptyTree";
    }
}
