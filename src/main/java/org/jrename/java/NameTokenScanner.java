package org.jrename.java;

import com.sun.source.tree.ClassTree;
import com.sun.source.tree.CompilationUnitTree;
import com.sun.source.tree.IdentifierTree;
import com.sun.source.tree.MemberReferenceTree;
import com.sun.source.tree.MemberSelectTree;
import com.sun.source.tree.MethodInvocationTree;
import com.sun.source.tree.MethodTree;
import com.sun.source.tree.PackageTree;
import com.sun.source.tree.Tree;
import com.sun.source.tree.TypeParameterTree;
import com.sun.source.tree.VariableTree;
import com.sun.source.util.SourcePositions;
import com.sun.source.util.TreePathScanner;
import java.util.List;
import java.util.regex.Pattern;
import javax.lang.model.element.Name;
import org.jrename.workspace.TextSpan;

/** Finds every identifier token of a compilation unit. Trees the compiler generated have no position and are skipped. */
class NameTokenScanner extends TreePathScanner<Void, List<NameToken>> {
    private final SourcePositions pos;
    private final CharSequence contents;
    private CompilationUnitTree root;
    private ClassTree surroundingClass;
    private boolean inPackage;

    NameTokenScanner(SourcePositions pos, CharSequence contents) {
        this.pos = pos;
        this.contents = contents;
    }

    @Override
    public Void visitCompilationUnit(CompilationUnitTree t, List<NameToken> tokens) {
        root = t;
        return super.visitCompilationUnit(t, tokens);
    }

    @Override
    public Void visitPackage(PackageTree t, List<NameToken> tokens) {
        inPackage = true;
        super.visitPackage(t, tokens);
        inPackage = false;
        return null;
    }

    @Override
    public Void visitClass(ClassTree t, List<NameToken> tokens) {
        var name = t.getSimpleName();
        if (name.length() > 0) {
            var from = pos.getEndPosition(root, t.getModifiers());
            if (from == -1) from = pos.getStartPosition(root, t);
            declaration(t, name, from, tokens);
        }
        var push = surroundingClass;
        surroundingClass = t;
        super.visitClass(t, tokens);
        surroundingClass = push;
        return null;
    }

    @Override
    public Void visitMethod(MethodTree t, List<NameToken> tokens) {
        Name name = t.getName();
        CharSequence declared = name;
        var from = pos.getStartPosition(root, t);
        if (name.contentEquals("<init>")) {
            declared = surroundingClass.getSimpleName();
        } else if (t.getReturnType() != null) {
            from = pos.getEndPosition(root, t.getReturnType());
        }
        if (pos.getEndPosition(root, t) != -1) {
            declaration(t, declared, from, tokens);
        }
        return super.visitMethod(t, tokens);
    }

    @Override
    public Void visitVariable(VariableTree t, List<NameToken> tokens) {
        var from = pos.getStartPosition(root, t);
        var type = t.getType();
        if (type != null && pos.getEndPosition(root, type) > from) {
            from = pos.getEndPosition(root, type);
        }
        declaration(t, t.getName(), from, tokens);
        return super.visitVariable(t, tokens);
    }

    @Override
    public Void visitTypeParameter(TypeParameterTree t, List<NameToken> tokens) {
        var start = (int) pos.getStartPosition(root, t);
        if (start != -1) {
            add(new TextSpan(start, t.getName().length()), t.getName(), true, tokens);
        }
        return super.visitTypeParameter(t, tokens);
    }

    @Override
    public Void visitIdentifier(IdentifierTree t, List<NameToken> tokens) {
        var name = t.getName();
        var start = (int) pos.getStartPosition(root, t);
        if (start != -1 && !isKeyword(name)) {
            add(new TextSpan(start, name.length()), name, false, tokens);
        }
        return super.visitIdentifier(t, tokens);
    }

    @Override
    public Void visitMemberSelect(MemberSelectTree t, List<NameToken> tokens) {
        var name = t.getIdentifier();
        var end = (int) pos.getEndPosition(root, t);
        if (end != -1 && !isKeyword(name) && !name.contentEquals("*")) {
            add(TextSpan.fromBounds(end - name.length(), end), name, false, tokens);
        }
        return super.visitMemberSelect(t, tokens);
    }

    @Override
    public Void visitMemberReference(MemberReferenceTree t, List<NameToken> tokens) {
        var name = t.getName();
        var end = (int) pos.getEndPosition(root, t);
        if (end != -1 && !name.contentEquals("<init>")) {
            add(TextSpan.fromBounds(end - name.length(), end), name, false, tokens);
        }
        return super.visitMemberReference(t, tokens);
    }

    private void declaration(Tree t, CharSequence name, long from, List<NameToken> tokens) {
        var end = pos.getEndPosition(root, t);
        if (from == -1 || end == -1) return;
        var start = findName(name, (int) from, (int) end);
        if (start == -1) return;
        add(new TextSpan(start, name.length()), name, true, tokens);
    }

    private void add(TextSpan span, CharSequence name, boolean declaration, List<NameToken> tokens) {
        // Implicit trees, like the type of an enum constant, point at text that is not their name
        if (span.end() > contents.length()) return;
        if (!name.toString().contentEquals(contents.subSequence(span.start, span.end()))) return;
        var path = getCurrentPath();
        var parent = path.getParentPath() == null ? null : path.getParentPath().getLeaf();
        var invocation = false;
        if (parent instanceof MethodInvocationTree) {
            invocation = ((MethodInvocationTree) parent).getMethodSelect() == path.getLeaf();
        }
        var memberReference = path.getLeaf() instanceof MemberReferenceTree;
        tokens.add(
                new NameToken(span, name.toString(), path, declaration, invocation, memberReference, inPackage));
    }

    private static boolean isKeyword(Name name) {
        return name.contentEquals("this") || name.contentEquals("super") || name.contentEquals("class");
    }

    private int findName(CharSequence name, int start, int end) {
        var matcher = namePattern(name).matcher(contents);
        matcher.region(start, Math.min(end, contents.length()));
        if (matcher.find()) {
            return matcher.start();
        }
        return -1;
    }

    static Pattern namePattern(CharSequence name) {
        return Pattern.compile(
                "(?<!\\p{javaJavaIdentifierPart})"
                        + Pattern.quote(name.toString())
                        + "(?!\\p{javaJavaIdentifierPart})");
    }
}
