package com.garnet.ast.print;

import com.garnet.ast.EmptyTree;
import com.garnet.ast.Expression;
import com.garnet.ast.TreeVisitor;
import com.garnet.ast.decl.*;
import com.garnet.ast.expr.*;
import com.garnet.ast.flow.*;
import com.garnet.ast.ref.*;
import com.garnet.core.GlobalState;
import com.garnet.core.SymbolData;
import com.garnet.core.SymbolRef;
import com.garnet.core.Symbols;
import com.garnet.core.types.ClassType;
import com.garnet.core.types.LiteralType;

import java.util.List;

import static com.garnet.ast.print.PrintUtils.printTabs;

/**
 * 可读输出：近似源码语法，两空格缩进。
 *
 * <p>上下文参数是当前缩进层级。只读取符号表，不修改树或符号表。</p>
 */
public class TreePrinter implements TreeVisitor<String, Integer> {

    private final GlobalState gs;

    public TreePrinter(GlobalState gs) {
        this.gs = gs;
    }

    public String print(Expression tree) {
        return tree.accept(this, 0);
    }

    private String str(Expression tree, int tabs) {
        return tree.accept(this, tabs);
    }

    private String symbolName(SymbolRef symbol) {
        return symbol.data(gs).getName().show(gs);
    }

    /**
     * 逗号分隔；第一个影子参数之前改用分号（块参数 |a; b|）。
     */
    private void printElems(StringBuilder sb, List<? extends Expression> elems, int tabs) {
        boolean first = true;
        boolean didShadow = false;
        for (Expression e : elems) {
            if (!first) {
                if (e instanceof ShadowArg && !didShadow) {
                    sb.append("; ");
                    didShadow = true;
                } else {
                    sb.append(", ");
                }
            }
            first = false;
            sb.append(str(e, tabs + 1));
        }
    }

    private void printArgs(StringBuilder sb, List<? extends Expression> args, int tabs) {
        sb.append("(");
        printElems(sb, args, tabs);
        sb.append(")");
    }

    // ===== 定义 =====

    @Override
    public String visitClassDef(ClassDef node, Integer tabs) {
        StringBuilder sb = new StringBuilder();
        sb.append(node.getKind() == ClassDefKind.MODULE ? "module " : "class ");
        sb.append(str(node.getName(), tabs)).append("<").append(symbolName(node.getSymbol())).append("> < ");
        printArgs(sb, node.getAncestors(), tabs);
        for (Expression stat : node.getRhs()) {
            sb.append('\n');
            printTabs(sb, tabs + 1);
            sb.append(str(stat, tabs + 1)).append('\n');
        }
        printTabs(sb, tabs);
        sb.append("end");
        return sb.toString();
    }

    @Override
    public String visitMethodDef(MethodDef node, Integer tabs) {
        StringBuilder sb = new StringBuilder();
        sb.append(node.isSelf() ? "def self." : "def ");
        sb.append(node.getName().show(gs)).append("<").append(symbolName(node.getSymbol())).append(">");
        sb.append("(");
        boolean first = true;
        if (node.getSymbol().equals(Symbols.TODO) || !node.getSymbol().exists()) {
            for (Expression arg : node.getArgs()) {
                if (!first) {
                    sb.append(", ");
                }
                first = false;
                sb.append(str(arg, tabs + 1));
            }
        } else {
            for (SymbolRef arg : node.getSymbol().data(gs).getArguments()) {
                if (!first) {
                    sb.append(", ");
                }
                first = false;
                sb.append(symbolName(arg));
            }
        }
        sb.append(")").append('\n');
        printTabs(sb, tabs + 1);
        sb.append(str(node.getRhs(), tabs + 1)).append('\n');
        printTabs(sb, tabs);
        sb.append("end");
        return sb.toString();
    }

    // ===== 控制流 =====

    @Override
    public String visitIf(If node, Integer tabs) {
        StringBuilder sb = new StringBuilder();
        sb.append("if ").append(str(node.getCond(), tabs + 1)).append('\n');
        printTabs(sb, tabs + 1);
        sb.append(str(node.getThenp(), tabs + 1)).append('\n');
        printTabs(sb, tabs);
        sb.append("else").append('\n');
        printTabs(sb, tabs + 1);
        sb.append(str(node.getElsep(), tabs + 1)).append('\n');
        printTabs(sb, tabs);
        sb.append("end");
        return sb.toString();
    }

    @Override
    public String visitWhile(While node, Integer tabs) {
        StringBuilder sb = new StringBuilder();
        sb.append("while ").append(str(node.getCond(), tabs + 1)).append('\n');
        printTabs(sb, tabs + 1);
        sb.append(str(node.getBody(), tabs + 1)).append('\n');
        printTabs(sb, tabs);
        sb.append("end");
        return sb.toString();
    }

    @Override
    public String visitBreak(Break node, Integer tabs) {
        return "break(" + str(node.getExpr(), tabs + 1) + ")";
    }

    @Override
    public String visitRetry(Retry node, Integer tabs) {
        return "retry";
    }

    @Override
    public String visitNext(Next node, Integer tabs) {
        return "next(" + str(node.getExpr(), tabs + 1) + ")";
    }

    @Override
    public String visitReturn(Return node, Integer tabs) {
        return "return " + str(node.getExpr(), tabs + 1);
    }

    @Override
    public String visitYield(Yield node, Integer tabs) {
        StringBuilder sb = new StringBuilder("yield");
        printArgs(sb, node.getArgs(), tabs);
        return sb.toString();
    }

    @Override
    public String visitRescueCase(RescueCase node, Integer tabs) {
        StringBuilder sb = new StringBuilder("rescue");
        boolean first = true;
        for (Expression exception : node.getExceptions()) {
            sb.append(first ? " " : ", ");
            first = false;
            sb.append(str(exception, tabs));
        }
        sb.append(" => ").append(str(node.getVar(), tabs));
        sb.append('\n');
        printTabs(sb, tabs);
        sb.append(str(node.getBody(), tabs));
        return sb.toString();
    }

    @Override
    public String visitRescue(Rescue node, Integer tabs) {
        StringBuilder sb = new StringBuilder();
        sb.append(str(node.getBody(), tabs));
        for (RescueCase rescueCase : node.getRescueCases()) {
            sb.append('\n');
            printTabs(sb, tabs - 1);
            sb.append(str(rescueCase, tabs));
        }
        // EmptyTree 表示没有该子句
        if (!node.getElse().isEmptyTree()) {
            sb.append('\n');
            printTabs(sb, tabs - 1);
            sb.append("else").append('\n');
            printTabs(sb, tabs);
            sb.append(str(node.getElse(), tabs));
        }
        if (!node.getEnsure().isEmptyTree()) {
            sb.append('\n');
            printTabs(sb, tabs - 1);
            sb.append("ensure").append('\n');
            printTabs(sb, tabs);
            sb.append(str(node.getEnsure(), tabs));
        }
        return sb.toString();
    }

    // ===== 引用与形参 =====

    @Override
    public String visitField(Field node, Integer tabs) {
        return node.getSymbol().data(gs).fullName(gs);
    }

    @Override
    public String visitLocal(Local node, Integer tabs) {
        return node.getLocalVariable().toString(gs);
    }

    @Override
    public String visitUnresolvedIdent(UnresolvedIdent node, Integer tabs) {
        return node.getName().show(gs);
    }

    @Override
    public String visitRestArg(RestArg node, Integer tabs) {
        return "*" + str(node.getExpr(), tabs);
    }

    @Override
    public String visitKeywordArg(KeywordArg node, Integer tabs) {
        return str(node.getExpr(), tabs) + ":";
    }

    @Override
    public String visitOptionalArg(OptionalArg node, Integer tabs) {
        return str(node.getExpr(), tabs) + " = " + str(node.getDefault(), tabs);
    }

    @Override
    public String visitShadowArg(ShadowArg node, Integer tabs) {
        return str(node.getExpr(), tabs);
    }

    @Override
    public String visitBlockArg(BlockArg node, Integer tabs) {
        return "&" + str(node.getExpr(), tabs);
    }

    // ===== 指令 =====

    @Override
    public String visitAssign(Assign node, Integer tabs) {
        return str(node.getLhs(), tabs) + " = " + str(node.getRhs(), tabs);
    }

    @Override
    public String visitSend(Send node, Integer tabs) {
        StringBuilder sb = new StringBuilder();
        sb.append(str(node.getRecv(), tabs)).append(".").append(node.getFun().show(gs));
        printArgs(sb, node.getArgs(), tabs);
        if (node.hasBlock()) {
            sb.append(str(node.getBlock(), tabs));
        }
        return sb.toString();
    }

    @Override
    public String visitCast(Cast node, Integer tabs) {
        return "T." + node.getCast().show(gs) + "(" + str(node.getArg(), tabs) + ", "
                + node.getType().toString(gs) + ")";
    }

    @Override
    public String visitZSuperArgs(ZSuperArgs node, Integer tabs) {
        return "ZSuperArgs";
    }

    @Override
    public String visitHash(Hash node, Integer tabs) {
        StringBuilder sb = new StringBuilder("{");
        for (int i = 0; i < node.getKeys().size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(str(node.getKeys().get(i), tabs + 1));
            sb.append(" => ");
            sb.append(str(node.getValues().get(i), tabs + 1));
        }
        sb.append("}");
        return sb.toString();
    }

    @Override
    public String visitArray(Array node, Integer tabs) {
        StringBuilder sb = new StringBuilder("[");
        printElems(sb, node.getElems(), tabs);
        sb.append("]");
        return sb.toString();
    }

    @Override
    public String visitLiteral(Literal node, Integer tabs) {
        if (node.getValue() instanceof LiteralType) {
            return ((LiteralType) node.getValue()).showValue(gs);
        }
        if (node.getValue() instanceof ClassType) {
            SymbolRef symbol = ((ClassType) node.getValue()).getSymbol();
            if (symbol.equals(Symbols.NIL_CLASS)) {
                return "nil";
            } else if (symbol.equals(Symbols.FALSE_CLASS)) {
                return "false";
            } else if (symbol.equals(Symbols.TRUE_CLASS)) {
                return "true";
            }
        }
        return "literal(" + node.getValue().toString(gs) + ")";
    }

    @Override
    public String visitUnresolvedConstantLit(UnresolvedConstantLit node, Integer tabs) {
        return str(node.getScope(), tabs) + "::" + node.getCnst().show(gs);
    }

    @Override
    public String visitConstantLit(ConstantLit node, Integer tabs) {
        if (node.getSymbol().exists()) {
            return node.getSymbol().data(gs).fullName(gs);
        }
        if (node.getTypeAlias() != null) {
            return str(node.getTypeAlias(), tabs);
        }
        return "Unresolved: " + (node.getOriginal() != null ? str(node.getOriginal(), tabs) : "<none>");
    }

    @Override
    public String visitSelf(Self node, Integer tabs) {
        if (node.getClaz().exists()) {
            return "self(" + symbolName(node.getClaz()) + ")";
        }
        return "self(TODO)";
    }

    @Override
    public String visitBlock(Block node, Integer tabs) {
        StringBuilder sb = new StringBuilder(" do |");
        if (!node.getSymbol().exists()) {
            printElems(sb, node.getArgs(), tabs + 1);
        } else {
            boolean first = true;
            for (SymbolRef argSym : node.getSymbol().data(gs).getArguments()) {
                SymbolData arg = argSym.data(gs);
                if (!first) {
                    sb.append(", ");
                }
                first = false;
                if (arg.isBlockArgument()) {
                    sb.append("&");
                }
                if (arg.isRepeated()) {
                    sb.append("*");
                }
                sb.append(arg.getName().show(gs));
                if (arg.isKeyword()) {
                    sb.append(":");
                }
            }
        }
        sb.append("|").append('\n');
        printTabs(sb, tabs + 1);
        sb.append(str(node.getBody(), tabs + 1)).append('\n');
        printTabs(sb, tabs);
        sb.append("end");
        return sb.toString();
    }

    @Override
    public String visitInsSeq(InsSeq node, Integer tabs) {
        StringBuilder sb = new StringBuilder("begin").append('\n');
        for (Expression stat : node.getStats()) {
            printTabs(sb, tabs + 1);
            sb.append(str(stat, tabs + 1)).append('\n');
        }
        printTabs(sb, tabs + 1);
        sb.append(str(node.getExpr(), tabs + 1)).append('\n');
        printTabs(sb, tabs);
        sb.append("end");
        return sb.toString();
    }

    @Override
    public String visitEmptyTree(EmptyTree node, Integer tabs) {
        return "<emptyTree>";
    }
}
